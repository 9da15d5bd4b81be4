package dev.pbxsort.sort;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the display name used to order an array entry or a section record.
 */
public final class NameExtractor {

    private static final String OBJECT_ID = "[A-Fa-f0-9]{24}";

    /** Object identifier, commented name, comma: entries of {@code children}, {@code targets} and similar lists. */
    private static final Pattern LIST_ENTRY = Pattern.compile(
            "^\\s*" + OBJECT_ID + "\\s+/\\*\\s*(.+?)\\s*\\*/,\\s*$");

    /**
     * Entries of build-phase {@code files} lists, whose comment ends with the phase, as in {@code main.m in Sources}
     * or {@code Kit.framework in Embed Frameworks}. Only the last {@code in} is the phase separator.
     */
    private static final Pattern FILES_ENTRY = Pattern.compile(
            "^\\s*" + OBJECT_ID + "\\s+/\\*\\s*(.+)\\s+in\\s+[^*]+?\\s*\\*/");

    /** Older layout where the phase follows the closed comment instead of sitting inside it. */
    private static final Pattern FILES_ENTRY_TRAILING_PHASE = Pattern.compile(
            "^\\s*" + OBJECT_ID + "\\s+/\\*\\s*(.+?)\\s*\\*/\\s+in\\s+");

    private static final Pattern RECORD_COMMENT = Pattern.compile(
            "^\\s*" + OBJECT_ID + "\\s+/\\*\\s*(.+?)\\s*\\*/\\s*=", Pattern.MULTILINE);

    private static final Pattern NAME_ASSIGNMENT = Pattern.compile("(?<![A-Za-z0-9_])name\\s*=\\s*\"(.*?)\"");

    private static final Pattern PATH_ASSIGNMENT = Pattern.compile("(?<![A-Za-z0-9_])path\\s*=\\s*\"(.*?)\"");

    private NameExtractor() {
    }

    /**
     * Name of a single array entry line, or an empty string when the line does not carry one.
     */
    public static String arrayEntryName(String line, ArrayKind kind) {
        if (kind == ArrayKind.FILES) {
            return firstGroup(FILES_ENTRY, line)
                    .or(() -> firstGroup(FILES_ENTRY_TRAILING_PHASE, line))
                    .orElse("");
        }
        return firstGroup(LIST_ENTRY, line).orElse("");
    }

    /**
     * Name of a section record. Tries, in order, the comment after the object identifier, a quoted
     * {@code name} assignment, a quoted {@code path} assignment and the first non-blank line; falls back
     * to the whole record text so that malformed records still order deterministically.
     */
    public static String recordName(String record) {
        return firstGroup(RECORD_COMMENT, record)
                .or(() -> firstGroup(NAME_ASSIGNMENT, record))
                .or(() -> firstGroup(PATH_ASSIGNMENT, record))
                .or(() -> firstNonBlankLine(record))
                .orElse(record);
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static Optional<String> firstNonBlankLine(String text) {
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst();
    }
}

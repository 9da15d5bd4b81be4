package dev.pbxsort.sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rebuilds the records of a sortable {@code Begin <Kind> section}, drops duplicates and re-emits them by name.
 *
 * <p>A record starts at a line holding a 24-digit hex object identifier, a block comment and an equals sign. When that line opens more braces
 * than it closes the record continues until the running brace count is back to zero. Lines that do not start a
 * record are carried as the prefix of the record that follows them; any left after the last record are emitted
 * unchanged at the end of the section.</p>
 */
public class BlockSectionSorter {

    private static final Pattern RECORD_START = Pattern.compile(
            "^\\s*[A-Fa-f0-9]{24}\\s+/\\*\\s*(.+?)\\s*\\*/\\s*=\\s*(\\{)?");

    private final EntryClassifier classifier;
    private final int maxRecordLines;

    public BlockSectionSorter(EntryClassifier classifier, int maxRecordLines) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        if (maxRecordLines < 1) {
            throw new IllegalArgumentException("maxRecordLines must be at least 1");
        }
        this.maxRecordLines = maxRecordLines;
    }

    /**
     * @param kind section kind, used in error messages
     * @param body lines strictly between the {@code Begin} and {@code End} lines
     * @param firstLineNumber one-based document line number of {@code body.get(0)}
     * @return the replacement body
     */
    public List<String> sort(String kind, List<String> body, int firstLineNumber) {
        List<BlockEntry> entries = new ArrayList<>();
        List<String> prefix = new ArrayList<>();
        int index = 0;
        while (index < body.size()) {
            String line = body.get(index);
            if (!RECORD_START.matcher(line).find()) {
                prefix.add(line);
                index++;
                continue;
            }
            int recordStart = index;
            List<String> recordLines = new ArrayList<>();
            recordLines.add(line);
            int balance = braceBalance(line);
            index++;
            while (balance > 0) {
                if (recordLines.size() >= maxRecordLines) {
                    throw new UnbalancedRecordException(kind, firstLineNumber + recordStart,
                            "no closing brace within " + maxRecordLines + " lines");
                }
                if (index >= body.size()) {
                    throw new UnbalancedRecordException(kind, firstLineNumber + recordStart,
                            "section ended before the record was closed");
                }
                String next = body.get(index++);
                recordLines.add(next);
                balance += braceBalance(next);
            }
            entries.add(new BlockEntry(prefix, recordLines));
            prefix = new ArrayList<>();
        }

        List<BlockEntry> sorted = SortableSet.sortedUnique(entries,
                entry -> classifier.keyFor(NameExtractor.recordName(entry.recordText()), true));
        List<String> result = new ArrayList<>(body.size());
        for (BlockEntry entry : sorted) {
            result.addAll(entry.allLines());
        }
        result.addAll(prefix);
        return result;
    }

    static int braceBalance(String line) {
        int balance = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '{') {
                balance++;
            } else if (ch == '}') {
                balance--;
            }
        }
        return balance;
    }
}

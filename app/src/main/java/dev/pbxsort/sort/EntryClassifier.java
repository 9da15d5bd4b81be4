package dev.pbxsort.sort;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether an entry name denotes a group (directory-like) or a file.
 *
 * <p>Names ending in a dot followed by at least one non-dot character are files. Extension-less names are
 * groups unless they are on the known-file allow-list. An empty name, the result of a failed extraction,
 * is treated as a file.</p>
 */
public class EntryClassifier {

    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");

    private final SortSettings settings;

    public EntryClassifier(SortSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public boolean isDirectory(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (EXTENSION.matcher(name).find()) {
            return false;
        }
        return !settings.isKnownFile(name);
    }

    public SortKey keyFor(String name, boolean directoryPrecedence) {
        String safeName = name == null ? "" : name;
        boolean directory = directoryPrecedence && isDirectory(safeName);
        return new SortKey(directory, NaturalKey.of(safeName, settings.caseInsensitive()));
    }
}

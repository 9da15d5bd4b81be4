package dev.pbxsort.sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One record of a {@code Begin ... section} together with the comment or blank lines that preceded it.
 */
public record BlockEntry(List<String> prefix, List<String> lines) {

    public BlockEntry {
        prefix = List.copyOf(Objects.requireNonNull(prefix, "prefix"));
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("A record needs at least its opening line");
        }
    }

    public String recordText() {
        return String.join("\n", lines);
    }

    public List<String> allLines() {
        List<String> all = new ArrayList<>(prefix.size() + lines.size());
        all.addAll(prefix);
        all.addAll(lines);
        return all;
    }
}

package dev.pbxsort.config;

import dev.pbxsort.sort.SortSettings;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        List<String> inputs,
        boolean caseInsensitive,
        boolean checkOnly,
        boolean warningsEnabled,
        boolean verbose,
        boolean recursive,
        boolean failFast,
        LogFormat logFormat,
        Set<String> knownFiles,
        Set<String> sortableSections,
        int maxRecordLines,
        boolean topLevelArraysOnly
) {

    /** Argument that selects stdin/stdout instead of a file. */
    public static final String STREAM_ARGUMENT = "-";

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        knownFiles = knownFiles == null ? Set.of() : Set.copyOf(knownFiles);
        sortableSections = sortableSections == null ? Set.of() : Set.copyOf(sortableSections);
        if (sortableSections.contains(SortSettings.PROTECTED_SECTION)) {
            throw new IllegalArgumentException(SortSettings.PROTECTED_SECTION + " cannot be made sortable: its order is link order");
        }
        if (maxRecordLines < 1) {
            throw new IllegalArgumentException("maxRecordLines must be greater than zero");
        }
        if (inputs.contains(STREAM_ARGUMENT) && inputs.size() > 1) {
            throw new IllegalArgumentException("'-' (stdin) cannot be combined with other inputs");
        }
    }

    public boolean streamMode() {
        return inputs.size() == 1 && STREAM_ARGUMENT.equals(inputs.get(0));
    }

    public SortSettings sortSettings() {
        return new SortSettings(caseInsensitive, knownFiles, sortableSections, maxRecordLines, topLevelArraysOnly);
    }
}

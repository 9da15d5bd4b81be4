package dev.pbxsort.sort;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options threaded through one sorting pass.
 *
 * @param caseInsensitive fold case in natural-order comparisons and known-file lookups
 * @param knownFiles extension-less names sorted as files, in addition to {@link #DEFAULT_KNOWN_FILES}
 * @param sortableSections section kinds whose records may be reordered, in addition to
 *         {@link #DEFAULT_SORTABLE_SECTIONS}
 * @param maxRecordLines cap on the length of one brace-balanced section record
 * @param topLevelArraysOnly leave arrays inside sections alone; by default every array outside
 *         {@value #PROTECTED_SECTION} is sorted
 */
public record SortSettings(
        boolean caseInsensitive,
        Set<String> knownFiles,
        Set<String> sortableSections,
        int maxRecordLines,
        boolean topLevelArraysOnly
) {

    /** Section whose entries carry link order and are never reordered. */
    public static final String PROTECTED_SECTION = "PBXFrameworksBuildPhase";

    /** Extension-less names that still sort with files rather than with groups. */
    public static final Set<String> DEFAULT_KNOWN_FILES = Set.of("create_hash_table");

    public static final Set<String> DEFAULT_SORTABLE_SECTIONS = Set.of(
            "PBXFileReference",
            "PBXBuildFile",
            "PBXGroup",
            "PBXVariantGroup",
            "PBXReferenceProxy",
            "PBXContainerItemProxy",
            "PBXTargetDependency",
            "XCBuildConfiguration",
            "XCConfigurationList");

    public static final int DEFAULT_MAX_RECORD_LINES = 10_000;

    private static final SortSettings DEFAULTS = new SortSettings(false, Set.of(), Set.of(), DEFAULT_MAX_RECORD_LINES, false);

    public SortSettings {
        knownFiles = union(DEFAULT_KNOWN_FILES, knownFiles);
        sortableSections = union(DEFAULT_SORTABLE_SECTIONS, sortableSections);
        if (sortableSections.contains(PROTECTED_SECTION)) {
            throw new IllegalArgumentException(PROTECTED_SECTION + " is link-order sensitive and cannot be sorted");
        }
        if (maxRecordLines < 1) {
            throw new IllegalArgumentException("maxRecordLines must be at least 1");
        }
    }

    public static SortSettings defaults() {
        return DEFAULTS;
    }

    public SortSettings withCaseInsensitive(boolean value) {
        return new SortSettings(value, knownFiles, sortableSections, maxRecordLines, topLevelArraysOnly);
    }

    public SortSettings withTopLevelArraysOnly(boolean value) {
        return new SortSettings(caseInsensitive, knownFiles, sortableSections, maxRecordLines, value);
    }

    public boolean isKnownFile(String name) {
        if (!caseInsensitive) {
            return knownFiles.contains(name);
        }
        String folded = name.toLowerCase(Locale.ROOT);
        return knownFiles.stream().anyMatch(known -> known.toLowerCase(Locale.ROOT).equals(folded));
    }

    public boolean isSortableSection(String kind) {
        return !PROTECTED_SECTION.equals(kind) && sortableSections.contains(kind);
    }

    private static Set<String> union(Set<String> defaults, Collection<String> extra) {
        Set<String> merged = new LinkedHashSet<>(defaults);
        if (extra != null) {
            extra.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .forEach(merged::add);
        }
        return merged.stream().collect(Collectors.toUnmodifiableSet());
    }
}

package dev.pbxsort.sort;

import java.util.List;
import java.util.Objects;

/**
 * Sorts the raw entry lines found between an array's opening line and its closing marker.
 */
public class ArrayRegionSorter {

    private final EntryClassifier classifier;

    public ArrayRegionSorter(EntryClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Returns the entries without exact duplicates, ordered groups-first (except for {@link ArrayKind#FILES})
     * and then by natural order of the commented name.
     */
    public List<String> sort(List<String> entries, ArrayKind kind) {
        Objects.requireNonNull(kind, "kind");
        return SortableSet.sortedUnique(entries,
                line -> classifier.keyFor(NameExtractor.arrayEntryName(line, kind), kind.directoryPrecedence()));
    }
}

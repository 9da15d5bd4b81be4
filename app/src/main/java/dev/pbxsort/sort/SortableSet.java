package dev.pbxsort.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Deduplicates the entries of one region and orders them by a key computed once per entry.
 * Entries with equal keys keep their input order.
 */
final class SortableSet {

    private SortableSet() {
    }

    static <T> List<T> sortedUnique(List<T> entries, Function<T, SortKey> keyFunction) {
        List<Keyed<T>> keyed = new ArrayList<>();
        for (T entry : Deduplicator.uniq(entries)) {
            keyed.add(new Keyed<>(keyFunction.apply(entry), entry));
        }
        // List.sort is a stable merge sort
        keyed.sort(Comparator.comparing((Keyed<T> item) -> item.key()));
        List<T> result = new ArrayList<>(keyed.size());
        for (Keyed<T> item : keyed) {
            result.add(item.value());
        }
        return result;
    }

    private record Keyed<T>(SortKey key, T value) {
    }
}

package dev.pbxsort.sort;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops exact duplicates, keeping the first occurrence of each value in input order.
 */
public final class Deduplicator {

    private Deduplicator() {
    }

    public static <T> List<T> uniq(List<T> items) {
        Set<T> seen = new HashSet<>();
        List<T> result = new ArrayList<>(items.size());
        for (T item : items) {
            if (seen.add(item)) {
                result.add(item);
            }
        }
        return result;
    }
}

package dev.pbxsort.sort;

import java.util.Comparator;
import java.util.Objects;

/**
 * Precomputed ordering key: directory-like entries first, then natural order of the name.
 */
public record SortKey(boolean directory, NaturalKey name) implements Comparable<SortKey> {

    private static final Comparator<SortKey> ORDER = Comparator
            .comparing((SortKey key) -> !key.directory())
            .thenComparing(SortKey::name);

    public SortKey {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public int compareTo(SortKey other) {
        return ORDER.compare(this, other);
    }
}

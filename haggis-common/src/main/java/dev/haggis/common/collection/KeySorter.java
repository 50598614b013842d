package dev.haggis.common.collection;

import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.List;

// May return a subset of the keys to skip branches, keys that are not children are ignored
@FunctionalInterface
public interface KeySorter<K> {

    static <K> KeySorter<K> identity() {
        return keys -> keys;
    }

    static <K extends Comparable<? super K>> KeySorter<K> natural() {
        return ordering(Comparator.naturalOrder());
    }

    static <K> KeySorter<K> ordering(final Comparator<? super K> comparator) {
        final var ordering = Ordering.from(comparator);
        return ordering::sortedCopy;
    }

    Iterable<K> sort(final List<K> keys);
}

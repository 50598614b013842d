package dev.haggis.common.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.Streams;
import dev.haggis.common.collection.Trie;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// A list item is a nested key, any other item is a top-level key
public final class KeyExclusions {

    private final Trie.Mutable<String, List<String>> keys = Trie.create();

    private KeyExclusions() {}

    public static KeyExclusions of(final Object... items) {
        return copyOf(Arrays.asList(items));
    }

    public static KeyExclusions copyOf(final Iterable<?> items) {
        Preconditions.checkNotNull(items, "items");
        final var exclusions = new KeyExclusions();
        for (final var item : items) {
            exclusions.keys.add(toPath(item));
        }
        return exclusions;
    }

    public boolean excludes(final List<String> path) {
        return this.keys.contains(path);
    }

    public boolean excludes(final String... path) {
        return this.excludes(Arrays.asList(path));
    }

    public int size() {
        return this.keys.size();
    }

    public boolean isEmpty() {
        return this.keys.isEmpty();
    }

    private static List<String> toPath(final Object item) {
        Preconditions.checkNotNull(item, "item");
        if (!(item instanceof List<?> list)) {
            return List.of(item.toString());
        }
        final List<String> path = new ArrayList<>(list.size());
        for (final var key : list) {
            path.add(String.valueOf(key));
        }
        return path;
    }

    @Override
    public String toString() {
        // Drops the placeholder root key from each path
        final var paths = this.keys.iterate(hierarchy -> hierarchy.subList(1, hierarchy.size()));
        return "KeyExclusions" + Streams.stream(paths).toList();
    }
}

package dev.haggis.common.collection;

import com.google.common.collect.Streams;
import java.util.List;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

public interface Trie<K, T> extends Iterable<T> {

    static <K> Trie.Mutable<K, List<K>> create() {
        return create(null);
    }

    static <K> Trie.Mutable<K, List<K>> create(final @Nullable K empty) {
        return new TrieImpl<>(empty, KeySorter.identity(), KeyJoiner.tuple());
    }

    static <K, T> Trie.Mutable<K, T> create(
            final @Nullable K empty, final KeySorter<K> sorter, final KeyJoiner<K, T> joiner) {
        return new TrieImpl<>(empty, sorter, joiner);
    }

    static Trie.Mutable<String, String> strings() {
        return new TrieImpl<>("", KeySorter.natural(), KeyJoiner.concat());
    }

    static Trie.Mutable<String, String> paths() {
        return paths(KeySorter.natural());
    }

    static Trie.Mutable<String, String> paths(final KeySorter<String> sorter) {
        return paths(sorter, PathJoiner.platform());
    }

    static Trie.Mutable<String, String> paths(final KeySorter<String> sorter, final KeyJoiner<String, String> joiner) {
        return new TrieImpl<>("", sorter, joiner);
    }

    boolean contains(final Iterable<? extends K> keys);

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }

    KeySorter<K> sorter();

    KeyJoiner<K, T> joiner();

    <R> Iterable<R> iterate(final KeySorter<K> sorter, final KeyJoiner<K, R> joiner, final Traversal traversal);

    default <R> Iterable<R> iterate(final KeyJoiner<K, R> joiner) {
        return this.iterate(this.sorter(), joiner, Traversal.DEPTH_FIRST);
    }

    default Iterable<T> iterate(final Traversal traversal) {
        return this.iterate(this.sorter(), this.joiner(), traversal);
    }

    default Stream<T> stream() {
        return Streams.stream(this);
    }

    interface Mutable<K, T> extends Trie<K, T> {

        boolean add(final Iterable<? extends K> keys);

        boolean remove(final Iterable<? extends K> keys);
    }
}

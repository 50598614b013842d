package dev.haggis.common.collection;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

final class TrieImpl<K, T> implements Trie.Mutable<K, T> {

    private final TrieNode<K> root;
    private final KeySorter<K> sorter;
    private final KeyJoiner<K, T> joiner;
    private int size = 0;

    TrieImpl(final @Nullable K empty, final KeySorter<K> sorter, final KeyJoiner<K, T> joiner) {
        Preconditions.checkNotNull(sorter, "sorter");
        Preconditions.checkNotNull(joiner, "joiner");
        this.root = new TrieNode<>(empty, null);
        this.sorter = sorter;
        this.joiner = joiner;
    }

    @Override
    public boolean add(final Iterable<? extends K> keys) {
        Preconditions.checkNotNull(keys, "keys");

        var node = this.root;
        for (final var key : keys) {
            node = node.child(key);
        }

        if (node.isLeaf()) {
            return false;
        }
        node.setLeaf(true);
        this.size++;
        return true;
    }

    @Override
    public boolean remove(final Iterable<? extends K> keys) {
        final var node = this.find(keys);
        if (node == null || !node.isLeaf()) {
            return false;
        }

        node.setLeaf(false);
        this.size--;

        var current = node;
        while (!current.shouldExist()) {
            // The root always exists, so any pruned node has a parent
            final var parent = Objects.requireNonNull(current.parent());
            parent.removeChild(current.key());
            current = parent;
        }
        return true;
    }

    @Override
    public boolean contains(final Iterable<? extends K> keys) {
        final var node = this.find(keys);
        return node != null && node.isLeaf();
    }

    @Override
    public int size() {
        return this.size;
    }

    @Override
    public KeySorter<K> sorter() {
        return this.sorter;
    }

    @Override
    public KeyJoiner<K, T> joiner() {
        return this.joiner;
    }

    @Override
    public <R> Iterable<R> iterate(
            final KeySorter<K> sorter, final KeyJoiner<K, R> joiner, final Traversal traversal) {
        Preconditions.checkNotNull(sorter, "sorter");
        Preconditions.checkNotNull(joiner, "joiner");
        Preconditions.checkNotNull(traversal, "traversal");
        return () -> TrieTraversal.of(this.root, sorter, joiner, traversal);
    }

    @Override
    public Iterator<T> iterator() {
        return TrieTraversal.of(this.root, this.sorter, this.joiner, Traversal.DEPTH_FIRST);
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder()
                .append("Trie@")
                .append(Integer.toHexString(System.identityHashCode(this)));
        final Deque<Line<K>> stack = new ArrayDeque<>();
        stack.push(new Line<>(this.root, 2));
        while (!stack.isEmpty()) {
            final var line = stack.pop();
            builder.append('\n').append(" ".repeat(line.indent())).append(line.node());
            final Deque<Line<K>> children = new ArrayDeque<>();
            for (final var key : this.sorter.sort(line.node().childKeys())) {
                final var child = line.node().findChild(key);
                if (child != null) {
                    children.push(new Line<>(child, line.indent() + 2));
                }
            }
            // Reversed so that the first child is popped first
            while (!children.isEmpty()) {
                stack.push(children.pop());
            }
        }
        return builder.toString();
    }

    private @Nullable TrieNode<K> find(final Iterable<? extends K> keys) {
        Preconditions.checkNotNull(keys, "keys");

        var node = this.root;
        for (final var key : keys) {
            node = node.findChild(key);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private record Line<K>(TrieNode<K> node, int indent) {}
}

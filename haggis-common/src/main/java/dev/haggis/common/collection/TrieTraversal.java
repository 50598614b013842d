package dev.haggis.common.collection;

import com.google.common.collect.AbstractIterator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

abstract class TrieTraversal<K, R> extends AbstractIterator<R> {

    private final KeySorter<K> sorter;
    private final KeyJoiner<K, R> joiner;

    private TrieTraversal(final KeySorter<K> sorter, final KeyJoiner<K, R> joiner) {
        this.sorter = sorter;
        this.joiner = joiner;
    }

    static <K, R> Iterator<R> of(
            final TrieNode<K> root,
            final KeySorter<K> sorter,
            final KeyJoiner<K, R> joiner,
            final Traversal traversal) {
        return switch (traversal) {
            case DEPTH_FIRST -> new DepthFirst<>(root, sorter, joiner);
            case BREADTH_FIRST -> new BreadthFirst<>(root, sorter, joiner);
        };
    }

    protected abstract @Nullable TrieNode<K> nextLeaf();

    @Override
    protected final R computeNext() {
        final var leaf = this.nextLeaf();
        return leaf == null ? this.endOfData() : this.joiner.join(leaf.hierarchy());
    }

    protected Iterator<K> children(final TrieNode<K> node) {
        return this.sorter.sort(node.childKeys()).iterator();
    }

    // Pre-order walk, with one frame per node holding the sibling keys still to visit
    private static final class DepthFirst<K, R> extends TrieTraversal<K, R> {

        private final Deque<Frame<K>> stack = new ArrayDeque<>();
        private @Nullable TrieNode<K> pending;

        private DepthFirst(final TrieNode<K> root, final KeySorter<K> sorter, final KeyJoiner<K, R> joiner) {
            super(sorter, joiner);
            this.pending = root;
        }

        @Override
        protected @Nullable TrieNode<K> nextLeaf() {
            while (true) {
                if (this.pending != null) {
                    final var node = this.pending;
                    this.pending = null;
                    this.stack.push(new Frame<>(node, this.children(node)));
                    if (node.isLeaf()) {
                        return node;
                    }
                }
                final var frame = this.stack.peek();
                if (frame == null) {
                    return null;
                }
                if (!frame.remaining().hasNext()) {
                    this.stack.pop();
                    continue;
                }
                final var child = frame.node().findChild(frame.remaining().next());
                if (child != null) {
                    this.pending = child;
                }
            }
        }
    }

    private static final class BreadthFirst<K, R> extends TrieTraversal<K, R> {

        private final Deque<TrieNode<K>> queue = new ArrayDeque<>();

        private BreadthFirst(final TrieNode<K> root, final KeySorter<K> sorter, final KeyJoiner<K, R> joiner) {
            super(sorter, joiner);
            this.queue.add(root);
        }

        @Override
        protected @Nullable TrieNode<K> nextLeaf() {
            while (!this.queue.isEmpty()) {
                final var node = this.queue.removeFirst();
                final var remaining = this.children(node);
                while (remaining.hasNext()) {
                    final var child = node.findChild(remaining.next());
                    if (child != null) {
                        this.queue.addLast(child);
                    }
                }
                if (node.isLeaf()) {
                    return node;
                }
            }
            return null;
        }
    }

    private record Frame<K>(TrieNode<K> node, Iterator<K> remaining) {}
}

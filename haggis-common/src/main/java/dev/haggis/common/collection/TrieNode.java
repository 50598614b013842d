package dev.haggis.common.collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

final class TrieNode<K> {

    private final @Nullable K key;
    private final @Nullable TrieNode<K> parent;
    private @Nullable Map<K, TrieNode<K>> children = null;
    private boolean leaf = false;

    TrieNode(final @Nullable K key, final @Nullable TrieNode<K> parent) {
        this.key = key;
        this.parent = parent;
    }

    @Nullable K key() {
        return this.key;
    }

    @Nullable TrieNode<K> parent() {
        return this.parent;
    }

    boolean isLeaf() {
        return this.leaf;
    }

    void setLeaf(final boolean leaf) {
        this.leaf = leaf;
    }

    TrieNode<K> child(final K key) {
        Preconditions.checkNotNull(key, "key");
        if (this.children == null) {
            this.children = new LinkedHashMap<>();
        }
        var child = this.children.get(key);
        if (child == null) {
            child = new TrieNode<>(key, this);
            this.children.put(key, child);
        }
        return child;
    }

    @Nullable TrieNode<K> findChild(final K key) {
        Preconditions.checkNotNull(key, "key");
        return this.children == null ? null : this.children.get(key);
    }

    boolean hasChild(final K key) {
        return this.findChild(key) != null;
    }

    void removeChild(final K key) {
        if (this.children == null) {
            return;
        }
        this.children.remove(key);
        if (this.children.isEmpty()) {
            this.children = null;
        }
    }

    boolean isEmpty() {
        return this.children == null;
    }

    boolean isRoot() {
        return this.parent == null;
    }

    boolean shouldExist() {
        return this.leaf || !this.isEmpty() || this.isRoot();
    }

    int childCount() {
        return this.children == null ? 0 : this.children.size();
    }

    List<K> childKeys() {
        return this.children == null ? new ArrayList<>() : new ArrayList<>(this.children.keySet());
    }

    List<K> hierarchy() {
        final List<K> keys = new ArrayList<>();
        for (var node = this; node != null; node = node.parent) {
            keys.add(node.key);
        }
        return Collections.unmodifiableList(Lists.reverse(keys));
    }

    @Override
    public String toString() {
        final var rendered = this.key instanceof CharSequence ? "'" + this.key + "'" : String.valueOf(this.key);
        return this.leaf ? rendered + "*" : rendered;
    }
}

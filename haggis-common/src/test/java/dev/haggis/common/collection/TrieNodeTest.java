package dev.haggis.common.collection;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TrieNodeTest {

    @Test
    void test_child_creates_once() {
        final var root = new TrieNode<String>("", null);
        Assertions.assertTrue(root.isEmpty());
        final var child = root.child("a");
        Assertions.assertSame(child, root.child("a"));
        Assertions.assertSame(root, child.parent());
        Assertions.assertFalse(child.isLeaf());
        Assertions.assertFalse(root.isEmpty());
        Assertions.assertEquals(1, root.childCount());
    }

    @Test
    void test_has_child_does_not_create() {
        final var root = new TrieNode<String>("", null);
        Assertions.assertFalse(root.hasChild("a"));
        Assertions.assertNull(root.findChild("a"));
        Assertions.assertTrue(root.isEmpty());
    }

    @Test
    void test_remove_child_releases_map() {
        final var root = new TrieNode<String>("", null);
        root.child("a");
        root.child("b");
        root.removeChild("a");
        Assertions.assertFalse(root.hasChild("a"));
        Assertions.assertTrue(root.hasChild("b"));
        root.removeChild("b");
        Assertions.assertTrue(root.isEmpty());
        Assertions.assertEquals(0, root.childCount());
        root.removeChild("missing");
        Assertions.assertTrue(root.isEmpty());
    }

    @Test
    void test_should_exist() {
        final var root = new TrieNode<String>("", null);
        Assertions.assertTrue(root.shouldExist());

        final var a = root.child("a");
        Assertions.assertFalse(a.shouldExist());

        a.setLeaf(true);
        Assertions.assertTrue(a.shouldExist());

        a.setLeaf(false);
        a.child("b");
        Assertions.assertTrue(a.shouldExist());
    }

    @Test
    void test_hierarchy() {
        final var root = new TrieNode<String>("", null);
        final var node = root.child("a").child("b").child("c");
        Assertions.assertEquals(List.of("", "a", "b", "c"), node.hierarchy());
        Assertions.assertEquals(List.of(""), root.hierarchy());
    }

    @Test
    void test_child_keys_is_a_copy() {
        final var root = new TrieNode<String>("", null);
        root.child("x");
        root.child("y");
        final var keys = root.childKeys();
        keys.clear();
        Assertions.assertEquals(2, root.childCount());
        Assertions.assertTrue(new TrieNode<String>("", null).childKeys().isEmpty());
    }

    @Test
    void test_to_string() {
        final var root = new TrieNode<String>("", null);
        final var a = root.child("a");
        a.setLeaf(true);
        Assertions.assertEquals("''", root.toString());
        Assertions.assertEquals("'a'*", a.toString());
        Assertions.assertEquals("null", new TrieNode<Integer>(null, null).toString());
        final var number = new TrieNode<Integer>(null, null).child(7);
        number.setLeaf(true);
        Assertions.assertEquals("7*", number.toString());
    }

    @Test
    void test_null_key_rejected() {
        final var root = new TrieNode<String>("", null);
        Assertions.assertThrows(NullPointerException.class, () -> root.child(null));
    }
}

package dev.haggis.common.collection;

public enum Traversal {
    DEPTH_FIRST,
    BREADTH_FIRST
}

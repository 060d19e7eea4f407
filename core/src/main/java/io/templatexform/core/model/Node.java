package io.templatexform.core.model;

/**
 * A node of the annotated tree. The hierarchy is sealed: every node is an {@link Element}, a
 * {@link Text} or a {@link Comment}. Nodes are immutable and are assembled bottom-up by the tree
 * builder, so a tree never contains cycles.
 */
public sealed interface Node permits Element, Text, Comment {

    /** Returns {@code true} if this node is an {@link Element}. */
    default boolean isElement() {
        return this instanceof Element;
    }
}

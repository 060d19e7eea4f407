package io.templatexform.core.model;

import java.util.Objects;

/** A source comment preserved in the tree, rendered with each engine's comment syntax. */
public record Comment(String value) implements Node {

    public Comment {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Comment of(String value) {
        return new Comment(value);
    }
}

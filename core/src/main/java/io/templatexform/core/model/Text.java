package io.templatexform.core.model;

import java.util.Objects;

/** Literal text content. The value is emitted verbatim by renderers. */
public record Text(String value) implements Node {

    public Text {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Text of(String value) {
        return new Text(value);
    }
}

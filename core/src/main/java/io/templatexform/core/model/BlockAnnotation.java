package io.templatexform.core.model;

import java.util.Objects;

/**
 * Marks a named, overridable block. A block carrying {@code extendsLayout} declares layout
 * inheritance instead of content.
 */
public record BlockAnnotation(String name, String extendsLayout) {

    public static final String EXTENDS_NAME = "__extends__";

    public BlockAnnotation {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static BlockAnnotation of(String name) {
        return new BlockAnnotation(name, null);
    }

    public static BlockAnnotation extending(String layout) {
        return new BlockAnnotation(EXTENDS_NAME, layout);
    }

    public boolean isExtends() {
        return extendsLayout != null;
    }
}

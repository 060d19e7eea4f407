package io.templatexform.core.model;

import java.util.Objects;

/** Marks a content insertion point. The element's rendered content is the slot's default. */
public record SlotAnnotation(String name) {

    public static final String DEFAULT = "default";

    public SlotAnnotation {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static SlotAnnotation defaultSlot() {
        return new SlotAnnotation(DEFAULT);
    }

    public boolean isDefault() {
        return DEFAULT.equals(name) || "children".equals(name);
    }
}

package io.templatexform.core.model;

import java.util.Locale;

/** Kind of component, inferred from its name. Renderers and callers use it to choose output paths. */
public enum ComponentType {
    LAYOUT,
    PARTIAL,
    PAGE,
    BLOCK,
    COMPONENT;

    /** Lowercase key as used in configuration and JSON output. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

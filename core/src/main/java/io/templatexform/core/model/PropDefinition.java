package io.templatexform.core.model;

import java.util.Objects;

/**
 * A component prop extracted from the destructured first parameter.
 *
 * @param name         prop name
 * @param type         declared type text, or {@code "unknown"} when it could not be resolved
 * @param required     {@code true} when the prop has no default and is not optional in its type
 * @param defaultValue default value source text, or {@code null}
 */
public record PropDefinition(String name, String type, boolean required, String defaultValue) {

    public static final String UNKNOWN_TYPE = "unknown";

    public PropDefinition {
        Objects.requireNonNull(name, "name must not be null");
        type = type != null ? type : UNKNOWN_TYPE;
    }

    public boolean hasKnownType() {
        return !UNKNOWN_TYPE.equals(type);
    }
}

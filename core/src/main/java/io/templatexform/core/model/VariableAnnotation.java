package io.templatexform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Replaces an element with a variable output.
 *
 * @param name         variable path, e.g. {@code user.name}
 * @param defaultValue fallback value, or {@code null}
 * @param filter       filter name (a {@code StandardFilter} key or an engine-specific name)
 * @param filterArgs   filter arguments
 * @param raw          {@code true} when the value must be emitted without escaping
 */
public record VariableAnnotation(
        String name, String defaultValue, String filter, List<String> filterArgs, boolean raw) {

    public VariableAnnotation {
        Objects.requireNonNull(name, "name must not be null");
        filterArgs = filterArgs != null ? List.copyOf(filterArgs) : List.of();
    }

    public static VariableAnnotation of(String name) {
        return new VariableAnnotation(name, null, null, null, false);
    }
}

package io.templatexform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces an element with a reference to another template.
 *
 * <p>Prop values are raw source text: quoted literals keep their quotes, expressions are kept
 * verbatim. Keys starting with {@link #SPREAD_PREFIX} denote a spread of the value expression.
 *
 * @param targetName   normalized target path, e.g. {@code cta-block}
 * @param originalName component name as written in source, or {@code null}
 * @param props        prop name to raw value source, in source order
 * @param hasChildren  {@code true} when the reference wraps child content
 */
public record IncludeAnnotation(
        String targetName, String originalName, Map<String, String> props, boolean hasChildren) {

    public static final String SPREAD_PREFIX = "__spread_";

    public IncludeAnnotation {
        Objects.requireNonNull(targetName, "targetName must not be null");
        props = props != null ? Collections.unmodifiableMap(new LinkedHashMap<>(props)) : Map.of();
    }

    public static IncludeAnnotation of(String targetName) {
        return new IncludeAnnotation(targetName, null, null, false);
    }

    public static boolean isSpreadKey(String key) {
        return key.startsWith(SPREAD_PREFIX);
    }
}

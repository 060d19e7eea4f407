package io.templatexform.core.spi;

import java.util.Locale;
import java.util.Optional;

/**
 * Engine-neutral filter vocabulary. Each renderer maps these onto its own filter or helper names
 * through {@link TemplateRenderer#filter(StandardFilter)}.
 */
public enum StandardFilter {
    UPPERCASE,
    LOWERCASE,
    CAPITALIZE,
    TRIM,
    DATE,
    CURRENCY,
    NUMBER,
    JSON,
    ESCAPE,
    RAW,
    DEFAULT,
    FIRST,
    LAST,
    LENGTH,
    JOIN,
    SPLIT,
    REVERSE,
    SORT,
    SLICE,
    TRUNCATE;

    /** The key used in markup and configuration, e.g. {@code uppercase}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Resolves a filter key case-insensitively. */
    public static Optional<StandardFilter> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        for (StandardFilter filter : values()) {
            if (filter.name().equals(normalized)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }
}

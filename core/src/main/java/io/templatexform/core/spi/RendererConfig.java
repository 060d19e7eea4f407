package io.templatexform.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renderer settings, usually loaded from YAML.
 *
 * @param fileExtension  overrides the renderer's extension, or {@code null}
 * @param outputDir      directory outputs are meant for; renderers only report it
 * @param indent         indentation unit
 * @param prettyPrint    trim the output and end it with exactly one newline
 * @param filterMappings standard filter key to engine filter name overrides
 * @param extra          engine-specific settings
 */
public record RendererConfig(
        String fileExtension,
        String outputDir,
        String indent,
        boolean prettyPrint,
        Map<String, String> filterMappings,
        Map<String, Object> extra) {

    public static final String DEFAULT_INDENT = "  ";
    public static final String DEFAULT_OUTPUT_DIR = ".";

    public RendererConfig {
        outputDir = outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR;
        indent = indent != null ? indent : DEFAULT_INDENT;
        filterMappings = filterMappings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(filterMappings))
                : Map.of();
        extra = extra != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extra)) : Map.of();
    }

    /** Two-space indent, pretty-printing on, output directory {@code "."}. */
    public static RendererConfig defaults() {
        return new RendererConfig(null, DEFAULT_OUTPUT_DIR, DEFAULT_INDENT, true, Map.of(), Map.of());
    }

    public RendererConfig withPrettyPrint(boolean enabled) {
        return new RendererConfig(fileExtension, outputDir, indent, enabled, filterMappings, extra);
    }

    public RendererConfig withFilterMapping(String filterKey, String engineName) {
        Map<String, String> mappings = new LinkedHashMap<>(filterMappings);
        mappings.put(filterKey, engineName);
        return new RendererConfig(fileExtension, outputDir, indent, prettyPrint, mappings, extra);
    }

    /** Returns the configured engine name for a standard filter, if overridden. */
    public Optional<String> filterMapping(StandardFilter filter) {
        return Optional.ofNullable(filterMappings.get(filter.key()));
    }
}

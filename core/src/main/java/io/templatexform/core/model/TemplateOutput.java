package io.templatexform.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Result of rendering one tree with one renderer.
 *
 * @param filename     output file name following the target's naming convention
 * @param content      rendered template text
 * @param variables    deduplicated variable names referenced by the template
 * @param dependencies deduplicated include targets
 * @param warnings     non-fatal problems met while rendering; empty when none
 */
public record TemplateOutput(
        String filename, String content, List<String> variables, List<String> dependencies, List<String> warnings) {

    public TemplateOutput {
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(content, "content must not be null");
        variables = dedupe(variables);
        dependencies = dedupe(dependencies);
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private static List<String> dedupe(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return List.copyOf(new ArrayList<>(new LinkedHashSet<>(values)));
    }
}

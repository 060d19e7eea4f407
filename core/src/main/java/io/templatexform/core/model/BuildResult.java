package io.templatexform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of building an annotated tree from component source.
 *
 * <p>A parse failure yields an empty tree and a non-empty {@link #errors()} list; unsupported
 * constructs only add {@link #warnings()}.
 *
 * @param tree                  the annotated tree, never {@code null}
 * @param variables             sorted variable names collected from the tree's annotations
 * @param referencedIdentifiers sorted root identifiers referenced by lowered expressions
 * @param dependencies          sorted include targets
 * @param warnings              non-fatal problems
 * @param errors                fatal problems for this source
 */
public record BuildResult(
        Root tree,
        List<String> variables,
        List<String> referencedIdentifiers,
        List<String> dependencies,
        List<String> warnings,
        List<String> errors) {

    public BuildResult {
        Objects.requireNonNull(tree, "tree must not be null");
        variables = variables != null ? List.copyOf(variables) : List.of();
        referencedIdentifiers = referencedIdentifiers != null ? List.copyOf(referencedIdentifiers) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /** A failed build: empty tree and a single error. */
    public static BuildResult failed(String sourceFile, String error) {
        return new BuildResult(Root.empty(sourceFile), null, null, null, null, List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Returns {@code true} when there is nothing to emit for this source. */
    public boolean isEmpty() {
        return tree.isEmpty();
    }
}

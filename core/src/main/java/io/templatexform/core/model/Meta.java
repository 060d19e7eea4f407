package io.templatexform.core.model;

import java.util.List;

/**
 * Per-document metadata attached to a {@link Root}.
 *
 * @param sourceFile    source identifier used in diagnostics
 * @param componentName inferred or requested component name, {@code null} when none was found
 * @param componentType kind inferred from the component name
 * @param props         props extracted from the first parameter
 * @param dependencies  referenced child component names, in first-seen order
 * @param imports       import declarations of the source file
 * @param preamble      verbatim statements preceding the markup return
 * @param preambleVars  names declared by the preamble
 */
public record Meta(
        String sourceFile,
        String componentName,
        ComponentType componentType,
        List<PropDefinition> props,
        List<String> dependencies,
        List<ImportDeclaration> imports,
        List<String> preamble,
        List<String> preambleVars) {

    public Meta {
        componentType = componentType != null ? componentType : ComponentType.COMPONENT;
        props = props != null ? List.copyOf(props) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        imports = imports != null ? List.copyOf(imports) : List.of();
        preamble = preamble != null ? List.copyOf(preamble) : List.of();
        preambleVars = preambleVars != null ? List.copyOf(preambleVars) : List.of();
    }

    public static Meta empty(String sourceFile) {
        return new Meta(sourceFile, null, ComponentType.COMPONENT, null, null, null, null, null);
    }

    /** Metadata carrying only a component name, as used by hand-built trees. */
    public static Meta named(String componentName) {
        return new Meta(null, componentName, ComponentType.COMPONENT, null, null, null, null, null);
    }

    public Meta withImports(List<ImportDeclaration> newImports) {
        return new Meta(
                sourceFile, componentName, componentType, props, dependencies, newImports, preamble, preambleVars);
    }

    public Meta withProps(List<PropDefinition> newProps) {
        return new Meta(
                sourceFile, componentName, componentType, newProps, dependencies, imports, preamble, preambleVars);
    }

    public Meta withPreamble(List<String> statements, List<String> vars) {
        return new Meta(sourceFile, componentName, componentType, props, dependencies, imports, statements, vars);
    }
}

package io.templatexform.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An import statement of the source file, kept so that renderers producing a full module (React)
 * can re-emit it.
 */
public record ImportDeclaration(
        String source, String defaultImport, List<String> namedImports, String namespaceImport, boolean typeOnly) {

    public ImportDeclaration {
        Objects.requireNonNull(source, "source must not be null");
        namedImports = namedImports != null ? List.copyOf(namedImports) : List.of();
    }

    /** Returns {@code true} for relative module specifiers such as {@code ./Card}. */
    public boolean isRelative() {
        return source.startsWith("./") || source.startsWith("../");
    }

    /** Returns a copy with one more named import appended. */
    public ImportDeclaration withNamedImport(String name) {
        var names = new ArrayList<>(namedImports);
        names.add(name);
        return new ImportDeclaration(source, defaultImport, names, namespaceImport, typeOnly);
    }
}

package io.templatexform.core.parse;

import io.templatexform.core.error.SourceParseException;
import io.templatexform.core.parse.ast.Program;

/**
 * Parses component source text into a syntax tree.
 *
 * <p>Implementations must be stateless between calls so that one instance can be shared across
 * documents.
 */
@FunctionalInterface
public interface MarkupParser {

    /**
     * Parses a complete source file.
     *
     * @param source     the source text
     * @param sourceFile file name used in diagnostics, may be {@code null}
     * @return the parsed program
     * @throws SourceParseException if the source is malformed
     */
    Program parse(String source, String sourceFile);
}

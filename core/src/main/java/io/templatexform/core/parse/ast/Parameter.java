package io.templatexform.core.parse.ast;

/** A function parameter with its optional type annotation. */
public record Parameter(Pattern pattern, TypeAnnotation type, boolean optional, int start, int end)
        implements SyntaxNode {}

package io.templatexform.core.parse.ast;

/** A node of the parsed source syntax tree. Offsets are half-open character ranges into the source. */
public interface SyntaxNode {

    int start();

    int end();

    /** Returns the source text this node was parsed from. */
    default String text(String source) {
        return source.substring(start(), end());
    }
}

package io.templatexform.core.parse.ast;

/** A child of a JSX element: text, an expression container, an element or a fragment. */
public interface JsxChild extends SyntaxNode {

    /** Raw text between tags, before whitespace normalization. */
    record JsxText(String raw, int start, int end) implements JsxChild {}

    /**
     * A {@code {...}} child or attribute value.
     *
     * @param expression the contained expression, or {@code null} for an empty container
     * @param comment    text of a block comment inside an empty container, or {@code null}
     */
    record JsxExpressionContainer(Expression expression, String comment, int start, int end) implements JsxChild {

        public boolean isEmpty() {
            return expression == null;
        }
    }
}

package io.templatexform.core.parse.ast;

/** An entry of a JSX opening tag: a named attribute or a spread. */
public interface JsxAttributeItem extends SyntaxNode {

    /**
     * A named attribute.
     *
     * @param name  attribute name; namespaced names are joined as {@code ns:name}
     * @param value a string {@link Expression.Literal}, a {@link JsxChild.JsxExpressionContainer},
     *              a JSX element, or {@code null} for a bare attribute
     */
    record JsxAttribute(String name, SyntaxNode value, int start, int end) implements JsxAttributeItem {}

    /** A spread attribute {@code {...props}}. */
    record JsxSpreadAttribute(Expression argument, int start, int end) implements JsxAttributeItem {}
}

package io.templatexform.core.parse.ast;

import java.util.List;

/** An expression of the TypeScript/JSX subset understood by the parser. */
public sealed interface Expression extends SyntaxNode {

    record Identifier(String name, int start, int end) implements Expression, Pattern {}

    /** Kind of a {@link Literal}. */
    enum LiteralKind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        REGEX
    }

    /**
     * A literal.
     *
     * @param value cooked value for strings, source text for everything else
     * @param raw   source text
     */
    record Literal(LiteralKind kind, String value, String raw, int start, int end) implements Expression {}

    /** A template literal; {@code quasis} has exactly one more entry than {@code expressions}. */
    record TemplateLiteral(List<String> quasis, List<Expression> expressions, int start, int end)
            implements Expression {
        public TemplateLiteral {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
        }
    }

    record TaggedTemplate(Expression tag, TemplateLiteral quasi, int start, int end) implements Expression {}

    /**
     * Property access. For non-computed access {@code property} is an {@link Identifier}.
     *
     * @param optional {@code true} for {@code ?.} access
     */
    record Member(Expression object, Expression property, boolean computed, boolean optional, int start, int end)
            implements Expression {}

    record Call(Expression callee, List<Expression> arguments, boolean optional, int start, int end)
            implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    record New(Expression callee, List<Expression> arguments, int start, int end) implements Expression {
        public New {
            arguments = List.copyOf(arguments);
        }
    }

    /** An arrow function; {@code body} is either an {@link Expression} or a {@link Statement.Block}. */
    record Arrow(List<Parameter> params, SyntaxNode body, boolean async, int start, int end) implements Expression {
        public Arrow {
            params = List.copyOf(params);
        }
    }

    record Function(String name, List<Parameter> params, Statement.Block body, boolean async, int start, int end)
            implements Expression {
        public Function {
            params = List.copyOf(params);
        }
    }

    /** An object literal; members are {@link Property} or {@link Spread} entries. */
    record ObjectLiteral(List<Expression> members, int start, int end) implements Expression {
        public ObjectLiteral {
            members = List.copyOf(members);
        }
    }

    /** A {@code key: value} member of an object literal. Only valid inside {@link ObjectLiteral}. */
    record Property(Expression key, Expression value, boolean computed, boolean shorthand, int start, int end)
            implements Expression {}

    /** An array literal; holes are {@code null}. */
    record ArrayLiteral(List<Expression> elements, int start, int end) implements Expression {}

    /** Prefix and postfix operators, including {@code typeof}, {@code await} and {@code ++}. */
    record Unary(String operator, Expression argument, boolean prefix, int start, int end) implements Expression {}

    /** Binary and logical operators ({@code &&}, {@code ||} and {@code ??} included). */
    record Binary(String operator, Expression left, Expression right, int start, int end) implements Expression {}

    record Conditional(Expression test, Expression consequent, Expression alternate, int start, int end)
            implements Expression {}

    record Assignment(String operator, Expression target, Expression value, int start, int end)
            implements Expression {}

    record Sequence(List<Expression> expressions, int start, int end) implements Expression {
        public Sequence {
            expressions = List.copyOf(expressions);
        }
    }

    record Spread(Expression argument, int start, int end) implements Expression {}

    record Parenthesized(Expression expression, int start, int end) implements Expression {}

    /** A TypeScript {@code as} or {@code satisfies} assertion. */
    record TypeAssertion(Expression expression, String type, int start, int end) implements Expression {}

    /** A TypeScript non-null assertion {@code x!}. */
    record NonNull(Expression expression, int start, int end) implements Expression {}

    /**
     * A JSX element.
     *
     * @param name tag name as written: {@code div}, {@code Card}, {@code ns:tag} or {@code Foo.Bar}
     */
    record JsxElement(
            String name,
            List<JsxAttributeItem> attributes,
            List<JsxChild> children,
            boolean selfClosing,
            int start,
            int end)
            implements Expression, JsxChild {
        public JsxElement {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        /** Looks up a named attribute. */
        public JsxAttributeItem.JsxAttribute attribute(String attributeName) {
            for (JsxAttributeItem item : attributes) {
                if (item instanceof JsxAttributeItem.JsxAttribute attr && attr.name().equals(attributeName)) {
                    return attr;
                }
            }
            return null;
        }
    }

    record JsxFragment(List<JsxChild> children, int start, int end) implements Expression, JsxChild {
        public JsxFragment {
            children = List.copyOf(children);
        }
    }

    /** Strips parentheses, type assertions and non-null assertions. */
    static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof Parenthesized p) {
                current = p.expression();
            } else if (current instanceof TypeAssertion t) {
                current = t.expression();
            } else if (current instanceof NonNull n) {
                current = n.expression();
            } else {
                return current;
            }
        }
    }

    /** Returns {@code true} for JSX elements and fragments, looking through parentheses. */
    static boolean isJsx(Expression expression) {
        Expression inner = unwrap(expression);
        return inner instanceof JsxElement || inner instanceof JsxFragment;
    }
}

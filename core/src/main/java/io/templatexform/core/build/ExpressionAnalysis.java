package io.templatexform.core.build;

import io.templatexform.core.parse.ast.Expression;
import java.util.List;
import java.util.Objects;

/**
 * Classification of one embedded expression.
 *
 * @param kind          what the expression expresses in markup terms
 * @param path          dotted variable path for {@link Kind#VARIABLE} and {@link Kind#MEMBER}
 * @param variables     root identifiers referenced anywhere in the expression
 * @param raw           expression source text
 * @param loop          loop details for {@link Kind#LOOP}
 * @param conditional   branch details for {@link Kind#CONDITIONAL}
 * @param literalValue  cooked value for {@link Kind#LITERAL}
 * @param templateParts segments for {@link Kind#TEMPLATE}
 */
public record ExpressionAnalysis(
        Kind kind,
        String path,
        List<String> variables,
        String raw,
        LoopMatch loop,
        ConditionalMatch conditional,
        String literalValue,
        List<TemplatePart> templateParts) {

    /** Expression kinds, in classifier priority order. */
    public enum Kind {
        VARIABLE,
        MEMBER,
        LOOP,
        CONDITIONAL,
        SLOT,
        LITERAL,
        TEMPLATE,
        UNKNOWN
    }

    public ExpressionAnalysis {
        Objects.requireNonNull(kind, "kind must not be null");
        variables = variables != null ? List.copyOf(variables) : List.of();
        templateParts = templateParts != null ? List.copyOf(templateParts) : List.of();
    }

    /**
     * A {@code collection.map(callback)} loop.
     *
     * @param item       callback's first parameter name, {@code item} when destructured
     * @param indexVar   callback's second parameter name, or {@code null}
     * @param collection receiver source text
     * @param key        {@code key} attribute of the returned markup root, or {@code null}
     * @param body       the markup the callback returns
     * @param destructured names bound by a destructured first parameter, empty otherwise
     */
    public record LoopMatch(
            String item, String indexVar, String collection, String key, Expression body, List<String> destructured) {

        public LoopMatch {
            destructured = destructured != null ? List.copyOf(destructured) : List.of();
        }
    }

    /**
     * A markup conditional.
     *
     * @param condition  test source text
     * @param ternary    {@code true} for {@code a ? b : c}, {@code false} for {@code a && b}
     * @param consequent rendered when the test holds
     * @param alternate  rendered otherwise; {@code null} for {@code &&}
     */
    public record ConditionalMatch(
            String condition, boolean ternary, Expression consequent, Expression alternate) {}

    /** One segment of a template literal: either static text or a variable path. */
    public record TemplatePart(String text, String variable) {

        public static TemplatePart text(String value) {
            return new TemplatePart(value, null);
        }

        public static TemplatePart variable(String path) {
            return new TemplatePart(null, path);
        }

        public boolean isText() {
            return text != null;
        }
    }

    public boolean isMarkupControl() {
        return kind == Kind.LOOP || kind == Kind.CONDITIONAL;
    }
}

package io.templatexform.core.build;

import io.templatexform.core.build.ExpressionAnalysis.ConditionalMatch;
import io.templatexform.core.build.ExpressionAnalysis.Kind;
import io.templatexform.core.build.ExpressionAnalysis.LoopMatch;
import io.templatexform.core.build.ExpressionAnalysis.TemplatePart;
import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.JsxAttributeItem;
import io.templatexform.core.parse.ast.JsxChild;
import io.templatexform.core.parse.ast.Parameter;
import io.templatexform.core.parse.ast.Pattern;
import io.templatexform.core.parse.ast.Statement;
import io.templatexform.core.parse.ast.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies an expression embedded in markup: a variable, a loop expressed as {@code .map()}, a
 * conditional expressed as {@code &&} or a ternary, a slot, a literal, a template string, or
 * something templates cannot express.
 *
 * <p>Parentheses, {@code as}/{@code satisfies} assertions and non-null assertions are looked
 * through before any rule is tried.
 */
public final class ExpressionClassifier {

    private final String source;

    public ExpressionClassifier(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public ExpressionAnalysis classify(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String raw = expression.text(source);
        List<String> variables = VariableCollector.collect(expression);
        Expression node = Expression.unwrap(expression);

        if (node instanceof Expression.Identifier id) {
            if ("children".equals(id.name())) {
                return simple(Kind.SLOT, "children", variables, raw);
            }
            return simple(Kind.VARIABLE, id.name(), variables, raw);
        }

        if (node instanceof Expression.Member) {
            String path = memberPath(node);
            if (path != null) {
                if ("props.children".equals(path)) {
                    return simple(Kind.SLOT, path, variables, raw);
                }
                return simple(Kind.MEMBER, path, variables, raw);
            }
        }

        LoopMatch loop = matchLoop(node);
        if (loop != null) {
            return new ExpressionAnalysis(Kind.LOOP, null, variables, raw, loop, null, null, null);
        }

        ConditionalMatch conditional = matchConditional(node);
        if (conditional != null) {
            return new ExpressionAnalysis(Kind.CONDITIONAL, null, variables, raw, null, conditional, null, null);
        }

        if (node instanceof Expression.Literal literal && literal.kind() != Expression.LiteralKind.REGEX) {
            String value = literal.kind() == Expression.LiteralKind.NULL ? null : literal.value();
            return new ExpressionAnalysis(Kind.LITERAL, null, variables, raw, null, null, value, null);
        }

        if (node instanceof Expression.TemplateLiteral template) {
            return new ExpressionAnalysis(
                    Kind.TEMPLATE, null, variables, raw, null, null, null, templateParts(template));
        }

        return simple(Kind.UNKNOWN, null, variables, raw);
    }

    /**
     * Returns {@code true} when the expression produces markup: JSX, or a loop or conditional that
     * does.
     */
    public boolean producesMarkup(Expression expression) {
        Expression node = Expression.unwrap(expression);
        if (Expression.isJsx(node)) {
            return true;
        }
        return matchLoop(node) != null || matchConditional(node) != null;
    }

    /**
     * Builds the dotted path of a property-access chain, normalizing {@code ?.} to {@code .}.
     * Returns {@code null} when the chain has a non-literal computed key or a non-identifier root.
     */
    public String memberPath(Expression expression) {
        Expression node = Expression.unwrap(expression);
        if (node instanceof Expression.Identifier id) {
            return id.name();
        }
        if (!(node instanceof Expression.Member member)) {
            return null;
        }
        String object = memberPath(member.object());
        if (object == null) {
            return null;
        }
        Expression property = member.property();
        if (!member.computed() && property instanceof Expression.Identifier name) {
            return object + "." + name.name();
        }
        if (property instanceof Expression.Literal literal
                && (literal.kind() == Expression.LiteralKind.STRING || literal.kind() == Expression.LiteralKind.NUMBER)) {
            return object + "." + literal.value();
        }
        return null;
    }

    private LoopMatch matchLoop(Expression node) {
        if (!(node instanceof Expression.Call call) || call.arguments().isEmpty()) {
            return null;
        }
        if (!(Expression.unwrap(call.callee()) instanceof Expression.Member callee)
                || callee.computed()
                || !(callee.property() instanceof Expression.Identifier method)
                || !"map".equals(method.name())) {
            return null;
        }
        Expression callback = Expression.unwrap(call.arguments().get(0));
        List<Parameter> params;
        SyntaxNode body;
        if (callback instanceof Expression.Arrow arrow) {
            params = arrow.params();
            body = arrow.body();
        } else if (callback instanceof Expression.Function function) {
            params = function.params();
            body = function.body();
        } else {
            return null;
        }
        if (params.isEmpty()) {
            return null;
        }
        Expression markup = callbackMarkup(body);
        if (markup == null) {
            return null;
        }
        String item = parameterName(params.get(0));
        List<String> destructured = List.of();
        if (item == null) {
            item = "item";
            destructured = boundNames(params.get(0).pattern());
        }
        String index = params.size() > 1 ? parameterName(params.get(1)) : null;
        String collection = callee.object().text(source);
        return new LoopMatch(item, index, collection, keyOf(markup), markup, destructured);
    }

    /** Returns the markup a callback body yields: the expression body or the first returned value. */
    static Expression callbackMarkup(SyntaxNode body) {
        Expression result = null;
        if (body instanceof Expression expression) {
            result = expression;
        } else if (body instanceof Statement.Block block) {
            for (Statement statement : block.body()) {
                if (statement instanceof Statement.Return ret && ret.argument() != null) {
                    result = ret.argument();
                    break;
                }
            }
        }
        if (result == null || !Expression.isJsx(result)) {
            return null;
        }
        return Expression.unwrap(result);
    }

    private static String parameterName(Parameter param) {
        Pattern pattern = param.pattern();
        if (pattern instanceof Pattern.AssignmentPattern assignment) {
            pattern = assignment.target();
        }
        return pattern instanceof Expression.Identifier id ? id.name() : null;
    }

    /** Names bound by a destructuring pattern, in source order. */
    private static List<String> boundNames(Pattern pattern) {
        List<String> names = new ArrayList<>();
        collectBoundNames(pattern, names);
        return names;
    }

    private static void collectBoundNames(Pattern pattern, List<String> names) {
        if (pattern instanceof Expression.Identifier id) {
            names.add(id.name());
        } else if (pattern instanceof Pattern.AssignmentPattern assignment) {
            collectBoundNames(assignment.target(), names);
        } else if (pattern instanceof Pattern.RestElement rest) {
            collectBoundNames(rest.argument(), names);
        } else if (pattern instanceof Pattern.ObjectPattern object) {
            for (Pattern.PatternProperty property : object.properties()) {
                collectBoundNames(property.value(), names);
            }
            if (object.rest() != null) {
                collectBoundNames(object.rest(), names);
            }
        } else if (pattern instanceof Pattern.ArrayPattern array) {
            for (Pattern element : array.elements()) {
                if (element != null) {
                    collectBoundNames(element, names);
                }
            }
        }
    }

    private String keyOf(Expression markup) {
        if (!(markup instanceof Expression.JsxElement element)) {
            return null;
        }
        JsxAttributeItem.JsxAttribute key = element.attribute("key");
        if (key == null || key.value() == null) {
            return null;
        }
        if (key.value() instanceof Expression.Literal literal) {
            return literal.text(source);
        }
        if (key.value() instanceof JsxChild.JsxExpressionContainer container && !container.isEmpty()) {
            return container.expression().text(source);
        }
        return null;
    }

    private ConditionalMatch matchConditional(Expression node) {
        if (node instanceof Expression.Binary binary && "&&".equals(binary.operator())) {
            if (producesMarkup(binary.right())) {
                return new ConditionalMatch(binary.left().text(source), false, binary.right(), null);
            }
            return null;
        }
        if (node instanceof Expression.Conditional ternary) {
            if (producesMarkup(ternary.consequent()) || producesMarkup(ternary.alternate())) {
                return new ConditionalMatch(
                        ternary.test().text(source), true, ternary.consequent(), ternary.alternate());
            }
        }
        return null;
    }

    private List<TemplatePart> templateParts(Expression.TemplateLiteral template) {
        List<TemplatePart> parts = new ArrayList<>();
        for (int i = 0; i < template.quasis().size(); i++) {
            String text = template.quasis().get(i);
            if (!text.isEmpty()) {
                parts.add(TemplatePart.text(text));
            }
            if (i < template.expressions().size()) {
                Expression expression = template.expressions().get(i);
                String path = memberPath(expression);
                parts.add(TemplatePart.variable(path != null ? path : expression.text(source)));
            }
        }
        return parts;
    }

    private static ExpressionAnalysis simple(Kind kind, String path, List<String> variables, String raw) {
        return new ExpressionAnalysis(kind, path, variables, raw, null, null, null, null);
    }

    /** Returns {@code true} for {@code null} and {@code undefined}. */
    static boolean isNullish(Expression expression) {
        Expression node = Expression.unwrap(expression);
        if (node instanceof Expression.Literal literal) {
            return literal.kind() == Expression.LiteralKind.NULL;
        }
        return node instanceof Expression.Identifier id && "undefined".equals(id.name());
    }
}

package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Node;
import io.templatexform.core.model.Text;
import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.JsxAttributeItem;
import io.templatexform.core.parse.ast.JsxChild;
import io.templatexform.core.parse.ast.Parameter;
import io.templatexform.core.parse.ast.Pattern;
import io.templatexform.core.parse.ast.Statement;
import io.templatexform.core.parse.ast.SyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * State shared between the tree builder and the DSL handlers of one document: the source text,
 * the accumulating warnings, and the variable and dependency sets.
 */
public final class DslContext {

    private final String source;
    private final String sourceFile;
    private final List<String> warnings;
    private final Set<String> variables;
    private final Set<String> dependencies;
    private final Function<Expression, List<Node>> markupLowering;

    /**
     * @param markupLowering lowers a markup expression (element or fragment) into tree nodes; used
     *                       to lower render-callback bodies
     */
    public DslContext(
            String source,
            String sourceFile,
            List<String> warnings,
            Set<String> variables,
            Set<String> dependencies,
            Function<Expression, List<Node>> markupLowering) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sourceFile = sourceFile;
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.markupLowering = Objects.requireNonNull(markupLowering, "markupLowering must not be null");
    }

    public String source() {
        return source;
    }

    public String sourceFile() {
        return sourceFile;
    }

    public void warn(String message) {
        warnings.add(message);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Records the root identifier of a dotted path as a referenced variable. */
    public void addVariableRoot(String path) {
        String root = rootOf(path);
        if (!root.isEmpty()) {
            variables.add(root);
        }
    }

    public void addDependency(String name) {
        dependencies.add(name);
    }

    public Set<String> variables() {
        return Collections.unmodifiableSet(variables);
    }

    public Set<String> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /**
     * Reads the named attributes of a tag as strings: string values as is, bare attributes as
     * {@code "true"}, string and boolean literals in braces as their value, and any other
     * expression as its source text. Spread attributes and empty containers are skipped.
     */
    public Map<String, String> attributes(Expression.JsxElement node) {
        Map<String, String> result = new LinkedHashMap<>();
        for (JsxAttributeItem item : node.attributes()) {
            if (item instanceof JsxAttributeItem.JsxAttribute attribute) {
                String value = attributeValue(attribute);
                if (value != null) {
                    result.put(attribute.name(), value);
                }
            }
        }
        return result;
    }

    /** Reads one attribute with the rules of {@link #attributes(Expression.JsxElement)}. */
    public Optional<String> attribute(Expression.JsxElement node, String name) {
        JsxAttributeItem.JsxAttribute attribute = node.attribute(name);
        return attribute == null ? Optional.empty() : Optional.ofNullable(attributeValue(attribute));
    }

    /**
     * Reads an attribute holding a list: an array literal yields the source text of each element,
     * a string is split on commas.
     */
    public List<String> listAttribute(Expression.JsxElement node, String name) {
        JsxAttributeItem.JsxAttribute attribute = node.attribute(name);
        if (attribute == null) {
            return List.of();
        }
        if (attribute.value() instanceof JsxChild.JsxExpressionContainer container
                && !container.isEmpty()
                && Expression.unwrap(container.expression()) instanceof Expression.ArrayLiteral array) {
            List<String> values = new ArrayList<>();
            for (Expression element : array.elements()) {
                if (element != null) {
                    values.add(element.text(source));
                }
            }
            return values;
        }
        String value = attributeValue(attribute);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    private String attributeValue(JsxAttributeItem.JsxAttribute attribute) {
        SyntaxNode value = attribute.value();
        if (value == null) {
            return "true";
        }
        if (value instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (value instanceof JsxChild.JsxExpressionContainer container) {
            if (container.isEmpty()) {
                return null;
            }
            Expression inner = Expression.unwrap(container.expression());
            if (inner instanceof Expression.Literal literal
                    && (literal.kind() == Expression.LiteralKind.STRING
                            || literal.kind() == Expression.LiteralKind.BOOLEAN)) {
                return literal.value();
            }
            return container.expression().text(source);
        }
        return value.text(source);
    }

    /**
     * Finds a render-callback child such as {@code {(item, i) => <li/>}} and lowers the markup it
     * returns.
     */
    public Optional<RenderCallback> renderCallback(Expression.JsxElement node) {
        for (JsxChild child : node.children()) {
            if (!(child instanceof JsxChild.JsxExpressionContainer container) || container.isEmpty()) {
                continue;
            }
            Expression expression = Expression.unwrap(container.expression());
            List<Parameter> params;
            SyntaxNode body;
            if (expression instanceof Expression.Arrow arrow) {
                params = arrow.params();
                body = arrow.body();
            } else if (expression instanceof Expression.Function function) {
                params = function.params();
                body = function.body();
            } else {
                continue;
            }
            Expression markup = returnedMarkup(body);
            if (markup == null) {
                continue;
            }
            List<String> names = new ArrayList<>();
            for (Parameter param : params) {
                names.add(parameterName(param));
            }
            return Optional.of(new RenderCallback(markupLowering.apply(markup), names));
        }
        return Optional.empty();
    }

    /** Returns {@code true} when a child container holds a function, i.e. is a render callback. */
    public static boolean isCallbackChild(JsxChild child) {
        if (!(child instanceof JsxChild.JsxExpressionContainer container) || container.isEmpty()) {
            return false;
        }
        Expression expression = Expression.unwrap(container.expression());
        return expression instanceof Expression.Arrow || expression instanceof Expression.Function;
    }

    /** Returns the trimmed text of a single text child, or {@code null}. */
    public static String textContent(List<Node> children) {
        if (children.size() == 1 && children.get(0) instanceof Text text) {
            String value = text.value().trim();
            return value.isEmpty() ? null : value;
        }
        return null;
    }

    /** Returns the leading identifier of a dotted path or expression. */
    public static String rootOf(String path) {
        String trimmed = path.trim();
        int end = 0;
        while (end < trimmed.length()) {
            char c = trimmed.charAt(end);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) {
                break;
            }
            end++;
        }
        return trimmed.substring(0, end);
    }

    private static Expression returnedMarkup(SyntaxNode body) {
        if (body instanceof Expression expression) {
            return Expression.isJsx(expression) ? Expression.unwrap(expression) : null;
        }
        if (body instanceof Statement.Block block) {
            for (Statement statement : block.body()) {
                if (statement instanceof Statement.Return ret
                        && ret.argument() != null
                        && Expression.isJsx(ret.argument())) {
                    return Expression.unwrap(ret.argument());
                }
            }
        }
        return null;
    }

    private static String parameterName(Parameter param) {
        Pattern pattern = param.pattern();
        if (pattern instanceof Pattern.AssignmentPattern assignment) {
            pattern = assignment.target();
        }
        return pattern instanceof Expression.Identifier id ? id.name() : null;
    }

    /**
     * A lowered render callback.
     *
     * @param children   the lowered markup the callback returns
     * @param parameters parameter names; destructured parameters are {@code null}
     */
    public record RenderCallback(List<Node> children, List<String> parameters) {

        public RenderCallback {
            children = List.copyOf(children);
            parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        }

        public String parameter(int index) {
            return index < parameters.size() ? parameters.get(index) : null;
        }
    }
}

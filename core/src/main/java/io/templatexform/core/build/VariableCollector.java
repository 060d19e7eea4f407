package io.templatexform.core.build;

import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.JsxAttributeItem;
import io.templatexform.core.parse.ast.JsxChild;
import io.templatexform.core.parse.ast.Parameter;
import io.templatexform.core.parse.ast.Pattern;
import io.templatexform.core.parse.ast.Statement;
import io.templatexform.core.parse.ast.SyntaxNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the free root identifiers of an expression: names the expression reads from its
 * environment. Property names, object keys and names bound by nested functions are not collected,
 * nor are well-known globals.
 */
final class VariableCollector {

    static final Set<String> KNOWN_GLOBALS = Set.of(
            "undefined", "null", "true", "false", "this",
            "console", "window", "document", "navigator",
            "Array", "Object", "String", "Number", "Boolean", "Date", "Math", "JSON",
            "Promise", "Map", "Set", "WeakMap", "WeakSet",
            "React", "Fragment", "Component", "PureComponent",
            "useState", "useEffect", "useCallback", "useMemo", "useRef", "useContext",
            "useReducer", "useLayoutEffect", "useImperativeHandle", "useDebugValue",
            "forwardRef", "memo", "lazy", "Suspense",
            "clsx", "cn", "classNames");

    private final Set<String> found = new LinkedHashSet<>();
    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    private VariableCollector() {}

    /** Returns the free root identifiers of {@code expression} in first-seen order. */
    static List<String> collect(Expression expression) {
        VariableCollector collector = new VariableCollector();
        collector.expression(expression);
        return List.copyOf(collector.found);
    }

    static boolean isKnownGlobal(String name) {
        return KNOWN_GLOBALS.contains(name);
    }

    private void reference(String name) {
        if (isKnownGlobal(name)) {
            return;
        }
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) {
                return;
            }
        }
        found.add(name);
    }

    private void expression(Expression expression) {
        if (expression == null) {
            return;
        }
        if (expression instanceof Expression.Identifier id) {
            reference(id.name());
        } else if (expression instanceof Expression.Member member) {
            expression(member.object());
            if (member.computed()) {
                expression(member.property());
            }
        } else if (expression instanceof Expression.Call call) {
            expression(call.callee());
            call.arguments().forEach(this::expression);
        } else if (expression instanceof Expression.New created) {
            expression(created.callee());
            created.arguments().forEach(this::expression);
        } else if (expression instanceof Expression.Arrow arrow) {
            function(arrow.params(), arrow.body());
        } else if (expression instanceof Expression.Function function) {
            function(function.params(), function.body());
        } else if (expression instanceof Expression.ObjectLiteral object) {
            for (Expression member : object.members()) {
                if (member instanceof Expression.Property property) {
                    if (property.computed()) {
                        expression(property.key());
                    }
                    expression(property.value());
                } else {
                    expression(member);
                }
            }
        } else if (expression instanceof Expression.ArrayLiteral array) {
            array.elements().forEach(this::expression);
        } else if (expression instanceof Expression.TemplateLiteral template) {
            template.expressions().forEach(this::expression);
        } else if (expression instanceof Expression.TaggedTemplate tagged) {
            expression(tagged.tag());
            expression(tagged.quasi());
        } else if (expression instanceof Expression.Unary unary) {
            expression(unary.argument());
        } else if (expression instanceof Expression.Binary binary) {
            expression(binary.left());
            expression(binary.right());
        } else if (expression instanceof Expression.Conditional conditional) {
            expression(conditional.test());
            expression(conditional.consequent());
            expression(conditional.alternate());
        } else if (expression instanceof Expression.Assignment assignment) {
            expression(assignment.target());
            expression(assignment.value());
        } else if (expression instanceof Expression.Sequence sequence) {
            sequence.expressions().forEach(this::expression);
        } else if (expression instanceof Expression.Spread spread) {
            expression(spread.argument());
        } else if (expression instanceof Expression.Parenthesized parenthesized) {
            expression(parenthesized.expression());
        } else if (expression instanceof Expression.TypeAssertion assertion) {
            expression(assertion.expression());
        } else if (expression instanceof Expression.NonNull nonNull) {
            expression(nonNull.expression());
        } else if (expression instanceof Expression.JsxElement element) {
            jsxAttributes(element.attributes());
            jsxChildren(element.children());
        } else if (expression instanceof Expression.JsxFragment fragment) {
            jsxChildren(fragment.children());
        }
    }

    private void function(List<Parameter> params, SyntaxNode body) {
        Set<String> scope = new HashSet<>();
        for (Parameter param : params) {
            bindingNames(param.pattern(), scope);
        }
        scopes.push(scope);
        for (Parameter param : params) {
            patternDefaults(param.pattern());
        }
        if (body instanceof Statement.Block block) {
            hoist(block.body(), scope);
            block.body().forEach(this::statement);
        } else if (body instanceof Expression expression) {
            expression(expression);
        }
        scopes.pop();
    }

    private void hoist(List<Statement> statements, Set<String> scope) {
        for (Statement statement : statements) {
            if (statement instanceof Statement.Variables variables) {
                for (Statement.Declarator declarator : variables.declarators()) {
                    bindingNames(declarator.id(), scope);
                }
            } else if (statement instanceof Statement.FunctionDeclaration declaration && declaration.name() != null) {
                scope.add(declaration.name());
            }
        }
    }

    private void statement(Statement statement) {
        if (statement instanceof Statement.Variables variables) {
            for (Statement.Declarator declarator : variables.declarators()) {
                patternDefaults(declarator.id());
                expression(declarator.init());
            }
        } else if (statement instanceof Statement.ExpressionStatement expressionStatement) {
            expression(expressionStatement.expression());
        } else if (statement instanceof Statement.Return ret) {
            expression(ret.argument());
        } else if (statement instanceof Statement.If branch) {
            expression(branch.test());
            statement(branch.consequent());
            if (branch.alternate() != null) {
                statement(branch.alternate());
            }
        } else if (statement instanceof Statement.Block block) {
            Set<String> scope = new HashSet<>();
            hoist(block.body(), scope);
            scopes.push(scope);
            block.body().forEach(this::statement);
            scopes.pop();
        } else if (statement instanceof Statement.Compound compound) {
            compound.bodies().forEach(this::statement);
        } else if (statement instanceof Statement.FunctionDeclaration declaration && declaration.body() != null) {
            function(declaration.params(), declaration.body());
        }
    }

    private void patternDefaults(Pattern pattern) {
        if (pattern instanceof Pattern.AssignmentPattern assignment) {
            patternDefaults(assignment.target());
            expression(assignment.defaultValue());
        } else if (pattern instanceof Pattern.ObjectPattern object) {
            for (Pattern.PatternProperty property : object.properties()) {
                patternDefaults(property.value());
                expression(property.defaultValue());
            }
        } else if (pattern instanceof Pattern.ArrayPattern array) {
            for (Pattern element : array.elements()) {
                patternDefaults(element);
            }
        } else if (pattern instanceof Pattern.RestElement rest) {
            patternDefaults(rest.argument());
        }
    }

    private void jsxAttributes(List<JsxAttributeItem> attributes) {
        for (JsxAttributeItem item : attributes) {
            if (item instanceof JsxAttributeItem.JsxSpreadAttribute spread) {
                expression(spread.argument());
            } else if (item instanceof JsxAttributeItem.JsxAttribute attribute) {
                if (attribute.value() instanceof JsxChild.JsxExpressionContainer container) {
                    expression(container.expression());
                } else if (attribute.value() instanceof Expression value) {
                    expression(value);
                }
            }
        }
    }

    private void jsxChildren(List<JsxChild> children) {
        for (JsxChild child : children) {
            if (child instanceof JsxChild.JsxExpressionContainer container) {
                expression(container.expression());
            } else if (child instanceof Expression nested) {
                expression(nested);
            }
        }
    }

    /** Adds the names a binding pattern declares. */
    static void bindingNames(Pattern pattern, Set<String> into) {
        if (pattern instanceof Expression.Identifier id) {
            into.add(id.name());
        } else if (pattern instanceof Pattern.AssignmentPattern assignment) {
            bindingNames(assignment.target(), into);
        } else if (pattern instanceof Pattern.RestElement rest) {
            bindingNames(rest.argument(), into);
        } else if (pattern instanceof Pattern.ObjectPattern object) {
            for (Pattern.PatternProperty property : object.properties()) {
                bindingNames(property.value(), into);
            }
            if (object.rest() != null) {
                bindingNames(object.rest(), into);
            }
        } else if (pattern instanceof Pattern.ArrayPattern array) {
            for (Pattern element : array.elements()) {
                if (element != null) {
                    bindingNames(element, into);
                }
            }
        }
    }
}

package io.templatexform.core.build;

import io.templatexform.core.build.dsl.DslContext;
import io.templatexform.core.build.dsl.DslHandler;
import io.templatexform.core.build.dsl.DslHandlerRegistry;
import io.templatexform.core.error.SourceParseException;
import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Comment;
import io.templatexform.core.model.ComponentType;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.ImportDeclaration;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.PropDefinition;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.model.SourceLocation;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.VariableAnnotation;
import io.templatexform.core.parse.LineMap;
import io.templatexform.core.parse.TsxParser;
import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.JsxAttributeItem;
import io.templatexform.core.parse.ast.JsxChild;
import io.templatexform.core.parse.ast.Parameter;
import io.templatexform.core.parse.ast.Pattern;
import io.templatexform.core.parse.ast.Program;
import io.templatexform.core.parse.ast.Statement;
import io.templatexform.core.parse.ast.SyntaxNode;
import io.templatexform.core.parse.ast.TypeAnnotation;
import io.templatexform.core.parse.ast.TypeAnnotation.TypeMember;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers one parsed component into an annotated tree.
 *
 * <p>A builder holds the state of a single document (warnings, referenced identifiers, dependency
 * names) and must not be reused: create one per source file.
 */
public final class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    private static final Set<String> COMPONENT_WRAPPERS = Set.of("memo", "forwardRef", "React.memo", "React.forwardRef");
    private static final Set<String> FRAGMENT_TAGS = Set.of("Fragment", "React.Fragment");
    private static final int MAX_ALIAS_DEPTH = 5;

    private final Program program;
    private final String source;
    private final BuildOptions options;
    private final DslHandlerRegistry dslHandlers;
    private final ExpressionClassifier classifier;
    private final LineMap lineMap;
    private final DslContext dslContext;

    private final List<String> warnings = new ArrayList<>();
    private final Set<String> referencedIdentifiers = new LinkedHashSet<>();
    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Map<String, List<TypeMember>> objectTypes = new HashMap<>();
    private final Map<String, String> typeAliases = new HashMap<>();
    private final Map<String, String> propTypes = new HashMap<>();
    private boolean built;

    public TreeBuilder(Program program, BuildOptions options, DslHandlerRegistry dslHandlers) {
        this.program = Objects.requireNonNull(program, "program must not be null");
        this.options = options != null ? options : BuildOptions.defaults();
        this.dslHandlers = Objects.requireNonNull(dslHandlers, "dslHandlers must not be null");
        this.source = program.source();
        this.classifier = new ExpressionClassifier(source);
        this.lineMap = new LineMap(source);
        this.dslContext = new DslContext(
                source, sourceFile(), warnings, referencedIdentifiers, dependencies, this::lowerMarkup);
    }

    /**
     * Builds the tree. Never throws for a well-formed program: unsupported constructs are reported
     * through {@link #warnings()}.
     *
     * @throws IllegalStateException if called twice
     */
    public Root build() {
        if (built) {
            throw new IllegalStateException("TreeBuilder instances build a single document");
        }
        built = true;
        indexTypeDeclarations();
        List<ImportDeclaration> imports = collectImports();

        Optional<Component> located = locateComponent();
        if (located.isEmpty()) {
            warn("No component function found");
            return new Root(List.of(), Meta.empty(sourceFile()).withImports(imports));
        }
        Component component = located.get();
        List<PropDefinition> props = extractProps(component);
        List<String> preamble = new ArrayList<>();
        List<String> preambleVars = new ArrayList<>();
        collectPreamble(component, preamble, preambleVars);

        List<Node> children = lowerComponentBody(component);
        if (children == null) {
            warn("No JSX found in source");
            children = List.of();
        }
        ComponentType type = options.componentTypePatterns().classify(component.name());
        Meta meta = new Meta(
                sourceFile(),
                component.name(),
                type,
                props,
                new ArrayList<>(dependencies),
                imports,
                preamble,
                preambleVars);
        return new Root(children, meta);
    }

    /** Non-fatal problems found while building. */
    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    /** Root identifiers referenced by lowered expressions, sorted. */
    public List<String> referencedIdentifiers() {
        return List.copyOf(new TreeSet<>(referencedIdentifiers));
    }

    private String sourceFile() {
        return options.sourceFile() != null ? options.sourceFile() : program.sourceFile();
    }

    private void warn(String message) {
        warnings.add(message);
        LOG.debug("build.warning: source={}, message={}", sourceFile(), message);
    }

    // ── Component discovery ──

    /** A located component: its name, parameters, body and the declared type of its binding. */
    private record Component(String name, List<Parameter> params, SyntaxNode body, TypeAnnotation bindingType) {}

    private Optional<Component> locateComponent() {
        String requested = options.componentName();
        Component defaultExport = null;
        for (Statement statement : program.body()) {
            if (statement instanceof Statement.ExportDefault export) {
                Component candidate = fromDefaultExport(export.declaration(), requested);
                if (candidate != null) {
                    boolean named = export.declaration() instanceof Statement.FunctionDeclaration fn && fn.name() != null;
                    if (named && (requested == null ? isPascalCase(candidate.name()) : requested.equals(candidate.name()))) {
                        return Optional.of(candidate);
                    }
                    if (defaultExport == null) {
                        defaultExport = candidate;
                    }
                }
                continue;
            }
            Statement declaration = statement instanceof Statement.ExportNamed export ? export.declaration() : statement;
            for (Component candidate : declaredFunctions(declaration)) {
                if (requested != null ? requested.equals(candidate.name()) : isPascalCase(candidate.name())) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.ofNullable(defaultExport);
    }

    private List<Component> declaredFunctions(Statement statement) {
        List<Component> result = new ArrayList<>();
        if (statement instanceof Statement.FunctionDeclaration fn && fn.name() != null && fn.body() != null) {
            result.add(new Component(fn.name(), fn.params(), fn.body(), null));
        } else if (statement instanceof Statement.Variables variables) {
            for (Statement.Declarator declarator : variables.declarators()) {
                if (declarator.id() instanceof Expression.Identifier id && declarator.init() != null) {
                    Expression function = componentFunction(declarator.init());
                    if (function != null) {
                        result.add(component(id.name(), function, declarator.type()));
                    }
                }
            }
        }
        return result;
    }

    private Component fromDefaultExport(SyntaxNode declaration, String requested) {
        String fallbackName = requested != null ? requested : "Component";
        if (declaration instanceof Statement.FunctionDeclaration fn && fn.body() != null) {
            return new Component(fn.name() != null ? fn.name() : fallbackName, fn.params(), fn.body(), null);
        }
        if (declaration instanceof Expression expression) {
            Expression function = componentFunction(expression);
            if (function != null) {
                return component(fallbackName, function, null);
            }
        }
        return null;
    }

    /** Looks through {@code memo(...)} and {@code forwardRef(...)} wrappers. */
    private static Expression componentFunction(Expression init) {
        Expression expression = Expression.unwrap(init);
        if (expression instanceof Expression.Arrow || expression instanceof Expression.Function) {
            return expression;
        }
        if (expression instanceof Expression.Call call
                && !call.arguments().isEmpty()
                && COMPONENT_WRAPPERS.contains(calleeName(call.callee()))) {
            return componentFunction(call.arguments().get(0));
        }
        return null;
    }

    private static String calleeName(Expression callee) {
        Expression node = Expression.unwrap(callee);
        if (node instanceof Expression.Identifier id) {
            return id.name();
        }
        if (node instanceof Expression.Member member
                && member.object() instanceof Expression.Identifier object
                && member.property() instanceof Expression.Identifier property) {
            return object.name() + "." + property.name();
        }
        return "";
    }

    private static Component component(String name, Expression function, TypeAnnotation bindingType) {
        if (function instanceof Expression.Arrow arrow) {
            return new Component(name, arrow.params(), arrow.body(), bindingType);
        }
        Expression.Function fn = (Expression.Function) function;
        return new Component(name, fn.params(), fn.body(), bindingType);
    }

    private static boolean isPascalCase(String name) {
        return SourceText.isPascalCase(name);
    }

    // ── Types and props ──

    private void indexTypeDeclarations() {
        for (Statement statement : program.body()) {
            Statement declaration = statement instanceof Statement.ExportNamed export ? export.declaration() : statement;
            if (statement instanceof Statement.ExportDefault export && export.declaration() instanceof Statement s) {
                declaration = s;
            }
            if (declaration instanceof Statement.Interface iface) {
                objectTypes.merge(iface.name(), iface.members(), TreeBuilder::mergeMembers);
            } else if (declaration instanceof Statement.TypeAlias alias) {
                if (alias.type().isTypeLiteral()) {
                    objectTypes.put(alias.name(), alias.type().members());
                } else {
                    typeAliases.put(alias.name(), alias.type().text());
                }
            }
        }
    }

    private static List<TypeMember> mergeMembers(List<TypeMember> first, List<TypeMember> second) {
        List<TypeMember> merged = new ArrayList<>(first);
        merged.addAll(second);
        return merged;
    }

    private List<PropDefinition> extractProps(Component component) {
        if (component.params().isEmpty()) {
            return List.of();
        }
        Parameter first = component.params().get(0);
        Pattern pattern = first.pattern();
        if (pattern instanceof Pattern.AssignmentPattern assignment) {
            pattern = assignment.target();
        }
        if (!(pattern instanceof Pattern.ObjectPattern object)) {
            return List.of();
        }
        List<TypeMember> members = resolvePropsType(first.type(), component.bindingType());
        Map<String, TypeMember> byName = new LinkedHashMap<>();
        for (TypeMember member : members) {
            byName.put(member.name(), member);
        }

        List<PropDefinition> props = new ArrayList<>();
        for (Pattern.PatternProperty property : object.properties()) {
            String name = property.value() instanceof Expression.Identifier id ? id.name() : property.key();
            TypeMember member = byName.get(property.key());
            String type = member != null && member.type() != null ? member.type() : PropDefinition.UNKNOWN_TYPE;
            boolean optional = member != null && member.optional();
            String defaultValue = property.defaultValue() != null ? property.defaultValue().text(source) : null;
            props.add(new PropDefinition(name, type, defaultValue == null && !optional, defaultValue));
            propTypes.put(name, type);
        }
        return props;
    }

    private List<TypeMember> resolvePropsType(TypeAnnotation parameterType, TypeAnnotation bindingType) {
        if (parameterType != null) {
            if (parameterType.isTypeLiteral()) {
                return parameterType.members();
            }
            return resolveNamedType(parameterType.text(), 0);
        }
        if (bindingType != null) {
            String argument = singleTypeArgument(bindingType.text());
            if (argument != null) {
                if (argument.startsWith("{")) {
                    return parseInlineType(argument);
                }
                return resolveNamedType(argument, 0);
            }
        }
        return List.of();
    }

    private List<TypeMember> resolveNamedType(String typeText, int depth) {
        String name = typeText.trim();
        int generic = name.indexOf('<');
        if (generic > 0) {
            name = name.substring(0, generic).trim();
        }
        List<TypeMember> members = objectTypes.get(name);
        if (members != null) {
            return members;
        }
        String alias = typeAliases.get(name);
        if (alias != null && depth < MAX_ALIAS_DEPTH) {
            if (alias.trim().startsWith("{")) {
                return parseInlineType(alias);
            }
            return resolveNamedType(alias, depth + 1);
        }
        return List.of();
    }

    /** Returns {@code Props} for {@code FC<Props>}, or {@code null} unless there is exactly one argument. */
    private static String singleTypeArgument(String typeText) {
        int open = typeText.indexOf('<');
        int close = typeText.lastIndexOf('>');
        if (open < 0 || close <= open) {
            return null;
        }
        String inner = typeText.substring(open + 1, close).trim();
        int depth = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '<' || c == '{' || c == '(' || c == '[') {
                depth++;
            } else if (c == '>' || c == '}' || c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                return null;
            }
        }
        return inner.isEmpty() ? null : inner;
    }

    private List<TypeMember> parseInlineType(String typeText) {
        try {
            TypeAnnotation type = new TsxParser().parseType(typeText);
            return type.isTypeLiteral() ? type.members() : List.of();
        } catch (SourceParseException e) {
            LOG.debug("build.type_unresolved: source={}, type={}, error={}", sourceFile(), typeText, e.getMessage());
            return List.of();
        }
    }

    /** Returns {@code true} when the element type of an array type declares an {@code id} member. */
    private boolean elementTypeHasId(String typeText) {
        for (String part : splitUnion(typeText)) {
            String type = part.trim();
            if (type.startsWith("readonly ")) {
                type = type.substring("readonly ".length()).trim();
            }
            String element = null;
            if (type.endsWith("[]")) {
                element = type.substring(0, type.length() - 2).trim();
            } else if ((type.startsWith("Array<") || type.startsWith("ReadonlyArray<")) && type.endsWith(">")) {
                element = type.substring(type.indexOf('<') + 1, type.length() - 1).trim();
            }
            if (element == null) {
                continue;
            }
            if (element.startsWith("(") && element.endsWith(")")) {
                element = element.substring(1, element.length() - 1).trim();
            }
            List<TypeMember> members = element.startsWith("{") ? parseInlineType(element) : resolveNamedType(element, 0);
            for (TypeMember member : members) {
                if ("id".equals(member.name())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> splitUnion(String typeText) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < typeText.length(); i++) {
            char c = typeText.charAt(i);
            if (c == '<' || c == '{' || c == '(' || c == '[') {
                depth++;
            } else if (c == '>' || c == '}' || c == ')' || c == ']') {
                depth--;
            } else if (c == '|' && depth == 0) {
                parts.add(typeText.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(typeText.substring(start));
        return parts;
    }

    // ── Imports and preamble ──

    private List<ImportDeclaration> collectImports() {
        List<ImportDeclaration> imports = new ArrayList<>();
        for (Statement statement : program.body()) {
            if (statement instanceof Statement.Import imp) {
                imports.add(new ImportDeclaration(
                        imp.source(), imp.defaultImport(), imp.namedImports(), imp.namespaceImport(), imp.typeOnly()));
            }
        }
        return imports;
    }

    private void collectPreamble(Component component, List<String> preamble, List<String> preambleVars) {
        if (!(component.body() instanceof Statement.Block block)) {
            return;
        }
        for (Statement statement : block.body()) {
            if (statement instanceof Statement.Return) {
                break;
            }
            if (statement instanceof Statement.Variables variables) {
                Set<String> names = new LinkedHashSet<>();
                for (Statement.Declarator declarator : variables.declarators()) {
                    VariableCollector.bindingNames(declarator.id(), names);
                }
                preambleVars.addAll(names);
                preamble.add(collapse(statement.text(source)));
            } else if (statement instanceof Statement.ExpressionStatement) {
                preamble.add(collapse(statement.text(source)));
            }
        }
    }

    private static String collapse(String text) {
        return SourceText.collapseWhitespace(text).trim();
    }

    // ── Markup location ──

    /** Lowers the markup the component returns, or returns {@code null} when it returns none. */
    private List<Node> lowerComponentBody(Component component) {
        if (component.body() instanceof Expression expression) {
            return lowerReturned(expression);
        }
        if (component.body() instanceof Statement.Block block) {
            return findReturn(block.body());
        }
        return null;
    }

    private List<Node> findReturn(List<Statement> statements) {
        for (Statement statement : statements) {
            List<Node> found = findReturn(statement);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private List<Node> findReturn(Statement statement) {
        if (statement == null) {
            return null;
        }
        if (statement instanceof Statement.Return ret) {
            return ret.argument() != null ? lowerReturned(ret.argument()) : null;
        }
        if (statement instanceof Statement.Block block) {
            return findReturn(block.body());
        }
        if (statement instanceof Statement.If branch) {
            List<Node> found = findReturn(branch.consequent());
            return found != null ? found : findReturn(branch.alternate());
        }
        if (statement instanceof Statement.Compound compound) {
            return findReturn(compound.bodies());
        }
        return null;
    }

    private List<Node> lowerReturned(Expression expression) {
        if (Expression.isJsx(expression)) {
            return lowerMarkup(expression);
        }
        if (classifier.producesMarkup(expression)) {
            return lowerExpression(expression);
        }
        return null;
    }

    // ── Element lowering ──

    /** Lowers a JSX element or fragment. */
    List<Node> lowerMarkup(Expression markup) {
        Expression node = Expression.unwrap(markup);
        if (node instanceof Expression.JsxElement element) {
            if (FRAGMENT_TAGS.contains(element.name())) {
                return lowerChildren(element.children(), false);
            }
            return List.of(lowerElement(element));
        }
        if (node instanceof Expression.JsxFragment fragment) {
            return lowerChildren(fragment.children(), false);
        }
        return lowerExpression(node);
    }

    private Element lowerElement(Expression.JsxElement node) {
        String tag = node.name();
        Optional<DslHandler> handler = dslHandlers.get(tag);
        List<Node> children = lowerChildren(node.children(), handler.isPresent());

        Element result = null;
        if (handler.isPresent()) {
            result = handler.get().handle(node, children, dslContext).orElse(null);
            if (result != null && result.annotations().loop() != null) {
                LoopAnnotation loop = withIdentityKey(result.annotations().loop(), node);
                result = result.withAnnotations(result.annotations().withLoop(loop));
            }
        }
        if (result == null) {
            result = lowerTag(node, tag, children);
        }
        if (options.includeSourceLocation()) {
            SourceLocation location =
                    new SourceLocation(sourceFile(), lineMap.line(node.start()), lineMap.column(node.start()));
            result = result.withAnnotations(result.annotations().withSource(location));
        }
        return result;
    }

    private Element lowerTag(Expression.JsxElement node, String tag, List<Node> children) {
        if (!Character.isUpperCase(tag.charAt(0)) || tag.indexOf('.') >= 0) {
            return Element.of(tag, lowerAttributes(node), children);
        }
        if (options.isPassthrough(tag)) {
            return new Element(tag, lowerAttributes(node), children, Annotations.NONE.withComponent(true));
        }
        IncludeAnnotation include = new IncludeAnnotation(kebabCase(tag), tag, includeProps(node), !children.isEmpty());
        dependencies.add(tag);
        return Element.annotated("div", children, Annotations.include(include));
    }

    /** {@code CTABlock} becomes {@code cta-block}, {@code SidebarContent} becomes {@code sidebar-content}. */
    static String kebabCase(String componentName) {
        return componentName
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1-$2")
                .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
                .toLowerCase(Locale.ROOT);
    }

    private Map<String, PropertyValue> lowerAttributes(Expression.JsxElement node) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        for (JsxAttributeItem item : node.attributes()) {
            if (item instanceof JsxAttributeItem.JsxSpreadAttribute spread) {
                warn("Spread attribute not supported in templates: " + spread.text(source));
                continue;
            }
            JsxAttributeItem.JsxAttribute attribute = (JsxAttributeItem.JsxAttribute) item;
            if ("key".equals(attribute.name())) {
                continue;
            }
            PropertyValue value = attributeValue(attribute);
            if (value != null) {
                properties.put(attribute.name(), value);
            }
        }
        return properties;
    }

    private PropertyValue attributeValue(JsxAttributeItem.JsxAttribute attribute) {
        SyntaxNode value = attribute.value();
        String name = attribute.name();
        if (value == null) {
            return PropertyValue.bool(true);
        }
        if (value instanceof Expression.Literal literal) {
            return stringValue(name, literal.value());
        }
        if (value instanceof JsxChild.JsxExpressionContainer container) {
            if (container.isEmpty()) {
                return null;
            }
            Expression inner = Expression.unwrap(container.expression());
            if (inner instanceof Expression.Literal literal) {
                PropertyValue literalValue = switch (literal.kind()) {
                    case STRING -> stringValue(name, literal.value());
                    case NUMBER -> new PropertyValue.NumberValue(literal.raw());
                    case BOOLEAN -> PropertyValue.bool(Boolean.parseBoolean(literal.value()));
                    default -> null;
                };
                if (literalValue != null) {
                    return literalValue;
                }
            }
            if ("style".equals(name) && inner instanceof Expression.ObjectLiteral object) {
                Map<String, String> declarations = staticStyle(object);
                if (declarations != null) {
                    return new PropertyValue.StyleValue(declarations);
                }
            }
            return PropertyValue.expression(container.expression().text(source));
        }
        return PropertyValue.expression(value.text(source));
    }

    private static PropertyValue stringValue(String name, String value) {
        if ("className".equals(name)) {
            List<String> classes = new ArrayList<>();
            for (String part : SourceText.splitWhitespace(value.trim())) {
                if (!part.isEmpty()) {
                    classes.add(part);
                }
            }
            return new PropertyValue.ClassList(classes);
        }
        return PropertyValue.string(value);
    }

    /** Returns the declarations of a style object with only literal values, or {@code null}. */
    private static Map<String, String> staticStyle(Expression.ObjectLiteral object) {
        Map<String, String> declarations = new LinkedHashMap<>();
        for (Expression member : object.members()) {
            if (!(member instanceof Expression.Property property) || property.computed() || property.shorthand()) {
                return null;
            }
            String key;
            if (property.key() instanceof Expression.Identifier id) {
                key = id.name();
            } else if (property.key() instanceof Expression.Literal literal) {
                key = literal.value();
            } else {
                return null;
            }
            if (!(Expression.unwrap(property.value()) instanceof Expression.Literal literal)
                    || (literal.kind() != Expression.LiteralKind.STRING
                            && literal.kind() != Expression.LiteralKind.NUMBER)) {
                return null;
            }
            declarations.put(key, literal.value());
        }
        return declarations;
    }

    private Map<String, String> includeProps(Expression.JsxElement node) {
        Map<String, String> props = new LinkedHashMap<>();
        for (JsxAttributeItem item : node.attributes()) {
            if (item instanceof JsxAttributeItem.JsxSpreadAttribute spread) {
                props.put(IncludeAnnotation.SPREAD_PREFIX + props.size(), spread.argument().text(source));
                continue;
            }
            JsxAttributeItem.JsxAttribute attribute = (JsxAttributeItem.JsxAttribute) item;
            if ("key".equals(attribute.name())) {
                continue;
            }
            SyntaxNode value = attribute.value();
            if (value == null) {
                props.put(attribute.name(), "true");
            } else if (value instanceof Expression.Literal literal) {
                props.put(attribute.name(), "\"" + literal.value() + "\"");
            } else if (value instanceof JsxChild.JsxExpressionContainer container) {
                if (!container.isEmpty()) {
                    props.put(attribute.name(), container.expression().text(source));
                }
            } else {
                props.put(attribute.name(), value.text(source));
            }
        }
        return props;
    }

    // ── Children ──

    private List<Node> lowerChildren(List<JsxChild> children, boolean reservedParent) {
        List<Node> result = new ArrayList<>();
        for (JsxChild child : children) {
            if (child instanceof JsxChild.JsxText text) {
                Text lowered = lowerText(text.raw());
                if (lowered != null) {
                    result.add(lowered);
                }
            } else if (child instanceof JsxChild.JsxExpressionContainer container) {
                if (reservedParent && DslContext.isCallbackChild(child)) {
                    continue;
                }
                result.addAll(lowerContainer(container));
            } else if (child instanceof Expression.JsxElement element) {
                if (FRAGMENT_TAGS.contains(element.name())) {
                    result.addAll(lowerChildren(element.children(), false));
                } else {
                    result.add(lowerElement(element));
                }
            } else if (child instanceof Expression.JsxFragment fragment) {
                result.addAll(lowerChildren(fragment.children(), false));
            }
        }
        return result;
    }

    private static Text lowerText(String raw) {
        String normalized = SourceText.collapseWhitespace(raw);
        if (normalized.isEmpty()) {
            return null;
        }
        if (normalized.equals(" ") && SourceText.isNewlineOnly(raw)) {
            return null;
        }
        return Text.of(normalized);
    }

    private List<Node> lowerContainer(JsxChild.JsxExpressionContainer container) {
        if (container.isEmpty()) {
            if (options.preserveComments() && container.comment() != null && !container.comment().isBlank()) {
                return List.of(Comment.of(container.comment().trim()));
            }
            return List.of();
        }
        return lowerExpression(container.expression());
    }

    private List<Node> lowerExpression(Expression expression) {
        ExpressionAnalysis analysis = classifier.classify(expression);
        referencedIdentifiers.addAll(analysis.variables());
        switch (analysis.kind()) {
            case VARIABLE:
            case MEMBER:
                return List.of(variableElement(analysis.path()));
            case LOOP:
                return List.of(loopElement(analysis.loop()));
            case CONDITIONAL:
                return List.of(conditionalElement(analysis.conditional()));
            case SLOT:
                return List.of(Element.annotated("div", List.of(), Annotations.slot(SlotAnnotation.defaultSlot())));
            case LITERAL:
                if (analysis.literalValue() == null || isBooleanLiteral(expression)) {
                    return List.of();
                }
                return List.of(Text.of(analysis.literalValue()));
            case TEMPLATE:
                List<Node> parts = new ArrayList<>();
                for (ExpressionAnalysis.TemplatePart part : analysis.templateParts()) {
                    parts.add(part.isText() ? Text.of(part.text()) : variableElement(part.variable()));
                }
                return parts;
            default:
                warn("Unknown expression type: " + analysis.raw());
                return List.of();
        }
    }

    private static boolean isBooleanLiteral(Expression expression) {
        return Expression.unwrap(expression) instanceof Expression.Literal literal
                && literal.kind() == Expression.LiteralKind.BOOLEAN;
    }

    private static Element variableElement(String path) {
        return Element.annotated("span", List.of(), Annotations.variable(VariableAnnotation.of(path)));
    }

    private Element loopElement(ExpressionAnalysis.LoopMatch match) {
        List<Node> body = lowerMarkup(match.body());
        if (!match.destructured().isEmpty()) {
            warn("Destructured loop item {" + String.join(", ", match.destructured()) + "} of '"
                    + match.collection() + "' is bound as 'item'; references to "
                    + String.join(", ", match.destructured()) + " are left unbound");
        }
        LoopAnnotation loop = new LoopAnnotation(
                match.item(), match.collection(), match.key(), LoopAnnotation.KeyKind.NONE, match.indexVar());
        return Element.annotated("div", body, Annotations.loop(withIdentityKey(loop, match.body())));
    }

    /** Upgrades an unkeyed loop to an {@code id} key when the body or the item type shows one. */
    private LoopAnnotation withIdentityKey(LoopAnnotation loop, Expression body) {
        if (loop.keyKind() != LoopAnnotation.KeyKind.NONE || !hasIdentity(loop, body)) {
            return loop;
        }
        return loop.withKeyKind(LoopAnnotation.KeyKind.IDENTITY);
    }

    private boolean hasIdentity(LoopAnnotation loop, Expression body) {
        if (SourceText.readsId(body.text(source), loop.item())) {
            return true;
        }
        String collection = loop.collection().trim();
        String root = DslContext.rootOf(collection);
        if ("props".equals(root) && collection.length() > root.length() + 1) {
            root = DslContext.rootOf(collection.substring(root.length()).replaceFirst("^\\??\\.", ""));
        }
        String type = propTypes.get(root);
        return type != null && elementTypeHasId(type);
    }

    private Element conditionalElement(ExpressionAnalysis.ConditionalMatch match) {
        List<Node> children = new ArrayList<>(lowerBranch(match.consequent()));
        if (match.ternary()) {
            appendAlternate(match.alternate(), children);
        }
        return Element.annotated("div", children, Annotations.condition(ConditionAnnotation.of(match.condition())));
    }

    /** Appends else and else-if branches for a ternary alternate, flattening nested markup ternaries. */
    private void appendAlternate(Expression alternate, List<Node> branches) {
        if (alternate == null || ExpressionClassifier.isNullish(alternate)) {
            return;
        }
        Expression node = Expression.unwrap(alternate);
        if (node instanceof Expression.Conditional ternary
                && (classifier.producesMarkup(ternary.consequent()) || classifier.producesMarkup(ternary.alternate()))) {
            referencedIdentifiers.addAll(VariableCollector.collect(ternary.test()));
            branches.add(Element.annotated(
                    "div",
                    lowerBranch(ternary.consequent()),
                    Annotations.condition(ConditionAnnotation.elseIf(ternary.test().text(source)))));
            appendAlternate(ternary.alternate(), branches);
            return;
        }
        branches.add(Element.annotated(
                "div", lowerBranch(alternate), Annotations.condition(ConditionAnnotation.elseBranch())));
    }

    private List<Node> lowerBranch(Expression branch) {
        if (branch == null || ExpressionClassifier.isNullish(branch)) {
            return List.of();
        }
        if (Expression.isJsx(branch)) {
            return lowerMarkup(branch);
        }
        return lowerExpression(branch);
    }
}

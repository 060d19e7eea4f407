package io.templatexform.core.render;

import io.templatexform.core.build.TreeQueries;
import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.Comment;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.TemplateOutput;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.ValidationResult;
import io.templatexform.core.spi.FilterDefinition;
import io.templatexform.core.spi.RendererConfig;
import io.templatexform.core.spi.RendererContext;
import io.templatexform.core.spi.StandardFilter;
import io.templatexform.core.spi.TemplateRenderer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared traversal for renderers: applies element annotations in their fixed order, folds sibling
 * else branches into their owning condition and formats HTML tags and attributes. Subclasses supply
 * the engine syntax.
 *
 * <p>Not thread-safe; holds the warnings of the document being rendered.
 */
public abstract class AbstractTemplateRenderer implements TemplateRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTemplateRenderer.class);

    /** Elements that never have content and self-close when childless. */
    protected static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    protected static final String ORPHAN_BRANCH_WARNING = "Else branch without a preceding condition";

    private static final Set<StandardFilter> QUOTED_ARGUMENT_FILTERS =
            Set.of(StandardFilter.DATE, StandardFilter.JOIN, StandardFilter.SPLIT, StandardFilter.DEFAULT);

    private static final Pattern AND_OPERATOR = Pattern.compile("\\s*&&\\s*");
    private static final Pattern OR_OPERATOR = Pattern.compile("\\s*\\|\\|\\s*");
    private static final Pattern NOT_OPERATOR = Pattern.compile("!\\s*(?=[\\w(])");

    private final List<String> warnings = new ArrayList<>();
    private RendererContext context;

    @Override
    public void initialize(RendererContext rendererContext) {
        this.context = Objects.requireNonNull(rendererContext, "rendererContext must not be null");
        warnings.clear();
    }

    @Override
    public void dispose() {
        warnings.clear();
    }

    protected RendererContext context() {
        if (context == null) {
            throw new IllegalStateException(
                    "Renderer '" + metadata().id() + "' is not initialized: call initialize(context) first");
        }
        return context;
    }

    protected RendererConfig config() {
        return context().config();
    }

    // ── Transformation ──

    @Override
    public TemplateOutput transform(Root root) {
        Objects.requireNonNull(root, "root must not be null");
        context();
        warnings.clear();
        String content = assemble(root, formatOutput(transformChildren(root.children())));
        String filename = outputFilename(root);
        TemplateOutput output = new TemplateOutput(
                filename,
                content,
                TreeQueries.collectVariables(root),
                TreeQueries.collectDependencies(root),
                warnings);
        logRendered(output);
        return output;
    }

    /** Builds the final file text around the formatted body; the body itself by default. */
    protected String assemble(Root root, String body) {
        return body;
    }

    protected void logRendered(TemplateOutput output) {
        LOG.debug(
                "template.rendered: renderer={}, file={}, bytes={}, warnings={}",
                metadata().id(),
                output.filename(),
                output.content().getBytes(StandardCharsets.UTF_8).length,
                output.warnings().size());
    }

    @Override
    public String transformElement(Element element) {
        return processElement(element);
    }

    /** Renders a sibling list. Branches directly following a condition are folded into it first. */
    protected String transformChildren(List<Node> children) {
        StringBuilder out = new StringBuilder();
        for (Node child : foldBranches(children)) {
            if (child instanceof Element element) {
                if (element.isBranch()) {
                    out.append(renderOrphanBranch(element));
                } else {
                    out.append(processElement(element));
                }
            } else if (child instanceof Text text) {
                out.append(text.value());
            } else if (child instanceof Comment comment) {
                out.append(renderComment(comment.value()));
            }
        }
        return out.toString();
    }

    /**
     * Moves else and else-if siblings that immediately follow a condition (whitespace-only text in
     * between is dropped) to the end of that condition's children.
     */
    static List<Node> foldBranches(List<Node> children) {
        List<Node> result = new ArrayList<>(children.size());
        int i = 0;
        while (i < children.size()) {
            Node node = children.get(i);
            i++;
            if (!(node instanceof Element owner) || !owner.isConditionOwner()) {
                result.add(node);
                continue;
            }
            List<Node> ownerChildren = null;
            int next = i;
            while (next < children.size()) {
                Node candidate = children.get(next);
                if (candidate instanceof Text text && text.value().isBlank()) {
                    next++;
                    continue;
                }
                if (candidate instanceof Element branch && branch.isBranch()) {
                    if (ownerChildren == null) {
                        ownerChildren = new ArrayList<>(owner.children());
                    }
                    ownerChildren.add(branch);
                    next++;
                    i = next;
                    continue;
                }
                break;
            }
            result.add(ownerChildren != null ? owner.withChildren(ownerChildren) : owner);
        }
        return result;
    }

    protected String renderOrphanBranch(Element branch) {
        addWarning(ORPHAN_BRANCH_WARNING);
        return processElement(withoutCondition(branch));
    }

    protected static Element withoutCondition(Element element) {
        return element.withAnnotations(element.annotations().withCondition(null));
    }

    /** Renders one element: its content, then condition, loop, variable, include, slot and block. */
    protected String processElement(Element element) {
        Annotations annotations = element.annotations();
        String content = elementContent(element);
        if (annotations.condition() != null) {
            content = applyCondition(element, content);
        }
        if (annotations.loop() != null) {
            content = renderLoop(annotations.loop(), content);
        }
        if (annotations.variable() != null) {
            content = renderVariable(annotations.variable());
        }
        if (annotations.include() != null) {
            String childrenContent = element.children().isEmpty() ? null : transformChildren(element.children());
            content = renderInclude(annotations.include(), childrenContent);
        }
        if (annotations.slot() != null) {
            content = renderSlot(annotations.slot(), content);
        }
        if (annotations.block() != null) {
            content = applyBlock(annotations.block(), content);
        }
        return content;
    }

    /**
     * Inner content of an element: the children for unwrapped elements, else the full tag. A
     * condition owner renders without its branches, which follow its content, else-ifs first.
     */
    protected String elementContent(Element element) {
        Annotations annotations = element.annotations();
        if (annotations.variable() != null || annotations.include() != null) {
            return "";
        }
        if (!element.isConditionOwner()) {
            return ownContent(element);
        }
        List<Node> main = new ArrayList<>();
        List<Element> elseIfs = new ArrayList<>();
        List<Element> elses = new ArrayList<>();
        for (Node child : element.children()) {
            if (child instanceof Element branch && branch.isBranch()) {
                if (branch.annotations().condition().isElseIf()) {
                    elseIfs.add(branch);
                } else {
                    elses.add(branch);
                }
            } else {
                main.add(child);
            }
        }
        if (elseIfs.isEmpty() && elses.isEmpty()) {
            return ownContent(element);
        }
        List<Element> branches = new ArrayList<>(elseIfs);
        branches.addAll(elses);
        return ownContent(element.withChildren(main)) + renderBranches(element, branches);
    }

    private String ownContent(Element element) {
        if (element.annotations().unwrap()) {
            return transformChildren(element.children());
        }
        return renderElementContent(element);
    }

    protected String renderElementContent(Element element) {
        String tag = element.tagName();
        if (VOID_ELEMENTS.contains(tag) && element.children().isEmpty()) {
            return renderSelfClosingTag(tag, element.properties());
        }
        return renderOpeningTag(tag, element.properties())
                + transformChildren(element.children())
                + renderClosingTag(tag);
    }

    /**
     * Renders the branches of {@code owner}, else-ifs before elses. Each branch renders through
     * {@link #renderCondition} with its own else or else-if condition.
     */
    protected String renderBranches(Element owner, List<Element> branches) {
        StringBuilder out = new StringBuilder();
        for (Element branch : branches) {
            out.append(processElement(branch));
        }
        return out.toString();
    }

    protected String applyCondition(Element element, String content) {
        return renderCondition(element.annotations().condition(), content);
    }

    protected String applyBlock(BlockAnnotation block, String content) {
        if (block.isExtends()) {
            String extendsTag = renderExtends(block.extendsLayout());
            return content.isEmpty() ? extendsTag : extendsTag + "\n" + content;
        }
        return renderBlock(block, content);
    }

    // ── Tags and attributes ──

    @Override
    public String renderOpeningTag(String tagName, Map<String, PropertyValue> attributes) {
        String formatted = formatAttributes(attributes);
        return formatted.isEmpty() ? "<" + tagName + ">" : "<" + tagName + " " + formatted + ">";
    }

    @Override
    public String renderClosingTag(String tagName) {
        return "</" + tagName + ">";
    }

    @Override
    public String renderSelfClosingTag(String tagName, Map<String, PropertyValue> attributes) {
        String formatted = formatAttributes(attributes);
        return formatted.isEmpty() ? "<" + tagName + " />" : "<" + tagName + " " + formatted + " />";
    }

    protected String formatAttributes(Map<String, PropertyValue> attributes) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, PropertyValue> entry : attributes.entrySet()) {
            String name = htmlAttributeName(entry.getKey());
            PropertyValue value = entry.getValue();
            if (value instanceof PropertyValue.BooleanValue bool) {
                if (bool.value()) {
                    parts.add(name);
                }
            } else if (value instanceof PropertyValue.ClassList classes) {
                parts.add(name + "=\"" + escapeAttribute(classes.joined()) + "\"");
            } else if (value instanceof PropertyValue.StyleValue style) {
                parts.add(name + "=\"" + escapeAttribute(formatStyle(style.declarations())) + "\"");
            } else if (value instanceof PropertyValue.ExpressionValue expression) {
                parts.add(name + "=\"" + renderAttributeExpression(expression.expression()) + "\"");
            } else if (value instanceof PropertyValue.NumberValue number) {
                parts.add(name + "=\"" + number.literal() + "\"");
            } else if (value instanceof PropertyValue.StringValue string) {
                parts.add(name + "=\"" + escapeAttribute(string.value()) + "\"");
            }
        }
        return String.join(" ", parts);
    }

    private static String htmlAttributeName(String name) {
        if ("className".equals(name)) {
            return "class";
        }
        if ("htmlFor".equals(name)) {
            return "for";
        }
        return name;
    }

    /** Output syntax of a dynamic attribute value inside double quotes. */
    protected abstract String renderAttributeExpression(String expression);

    protected static String formatStyle(Map<String, String> declarations) {
        List<String> parts = new ArrayList<>();
        declarations.forEach((property, value) -> parts.add(cssPropertyName(property) + ": " + value));
        return String.join("; ", parts);
    }

    private static String cssPropertyName(String property) {
        return property.replaceAll("([a-z])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    protected static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;").replace(">", "&gt;");
    }

    // ── Filters ──

    /** Engine-specific names and default arguments of the standard filters. */
    protected abstract Map<StandardFilter, FilterDefinition> filterDefinitions();

    @Override
    public Optional<FilterDefinition> filter(StandardFilter standardFilter) {
        FilterDefinition definition = filterDefinitions().get(standardFilter);
        if (definition == null) {
            return Optional.empty();
        }
        Optional<String> override = context != null ? config().filterMapping(standardFilter) : Optional.empty();
        return Optional.of(override.map(name -> new FilterDefinition(name, definition.args())).orElse(definition));
    }

    /** A filter resolved to its engine name and final arguments. */
    protected record FilterCall(String name, List<String> args) {}

    /**
     * Resolves a standard filter key to its engine name. Caller arguments are quoted where the
     * engine expects a string; without caller arguments the engine defaults apply. Unknown names
     * pass through unchanged.
     */
    protected FilterCall resolveFilter(String filterName, List<String> args) {
        List<String> callerArgs = args != null ? args : List.of();
        Optional<StandardFilter> standard = StandardFilter.fromKey(filterName);
        if (standard.isEmpty()) {
            return new FilterCall(filterName, callerArgs);
        }
        Optional<FilterDefinition> definition = filter(standard.get());
        if (definition.isEmpty()) {
            return new FilterCall(filterName, callerArgs);
        }
        if (callerArgs.isEmpty()) {
            return new FilterCall(definition.get().name(), definition.get().args());
        }
        List<String> formatted = new ArrayList<>(callerArgs);
        if (QUOTED_ARGUMENT_FILTERS.contains(standard.get())) {
            formatted.set(0, quote(formatted.get(0)));
        }
        return new FilterCall(definition.get().name(), formatted);
    }

    /** Quotes a string argument unless it already is a quoted literal. */
    protected String quote(String value) {
        if (isQuoted(value)) {
            return value;
        }
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }

    protected static boolean isQuoted(String value) {
        return value.length() >= 2
                && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"));
    }

    /** Pipe syntax: {@code expr | name: a, b}. */
    @Override
    public String applyFilter(String expression, String filterName, List<String> args) {
        FilterCall call = resolveFilter(filterName, args);
        if (call.args().isEmpty()) {
            return expression + " | " + call.name();
        }
        return expression + " | " + call.name() + ": " + String.join(", ", call.args());
    }

    // ── Expressions and includes ──

    /** {@code &&}, {@code ||} and {@code !} as words; strict equality as loose equality. */
    protected static String wordOperators(String expression) {
        String result = expression.replace("!==", "!=").replace("===", "==");
        result = AND_OPERATOR.matcher(result).replaceAll(" and ");
        result = OR_OPERATOR.matcher(result).replaceAll(" or ");
        result = NOT_OPERATOR.matcher(result).replaceAll("not ");
        return result.trim();
    }

    /** The include target with this renderer's extension appended when missing. */
    protected String includePath(String target) {
        String extension = fileExtension();
        return target.endsWith(extension) ? target : target + extension;
    }

    /** Records that an engine without content-passing includes dropped the include's children. */
    protected void warnDroppedChildren(String target, String childrenContent) {
        if (childrenContent != null && !childrenContent.isBlank()) {
            addWarning("Children of include '" + target + "' cannot be passed in " + metadata().id() + " and were dropped");
        }
    }

    /** Records that spread props of an include were dropped. */
    protected void warnDroppedSpread(String target, String spread) {
        addWarning("Spread props '" + spread + "' of include '" + target + "' are not supported in "
                + metadata().id() + " and were dropped");
    }

    // ── Validation and output ──

    @Override
    public ValidationResult validate(String output) {
        List<String> errors = new ArrayList<>();
        if (output == null || output.isBlank()) {
            errors.add("Output is empty");
        } else {
            validateSyntax(output, errors);
        }
        return ValidationResult.of(errors);
    }

    /** Adds engine-specific structural errors of a non-empty output. */
    protected void validateSyntax(String output, List<String> errors) {}

    protected static int count(String text, Pattern pattern) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    protected String outputFilename(Root root) {
        String name = root.meta().componentName() != null ? root.meta().componentName() : "template";
        return kebabCase(name) + fileExtension();
    }

    /** The configured extension override, else the renderer's own. */
    protected String fileExtension() {
        String configured = config().fileExtension();
        return configured != null && !configured.isBlank() ? configured : metadata().fileExtension();
    }

    /** {@code MyPage} becomes {@code my-page}; spaces and underscores become hyphens. */
    protected static String kebabCase(String name) {
        return name.replaceAll("([a-z])([A-Z])", "$1-$2").replaceAll("[\\s_]+", "-").toLowerCase(Locale.ROOT);
    }

    protected String formatOutput(String content) {
        if (config().prettyPrint()) {
            return content.trim() + "\n";
        }
        return content;
    }

    /** Records a warning for the current document and logs it. */
    protected void addWarning(String message) {
        warnings.add(message);
        LOG.warn("[{}] {}", metadata().id(), message);
    }

    protected List<String> warnings() {
        return List.copyOf(warnings);
    }
}

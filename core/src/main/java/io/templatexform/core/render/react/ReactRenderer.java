package io.templatexform.core.render.react;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.ImportDeclaration;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.PropDefinition;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.model.TemplateOutput;
import io.templatexform.core.model.VariableAnnotation;
import io.templatexform.core.render.AbstractTemplateRenderer;
import io.templatexform.core.spi.FilterDefinition;
import io.templatexform.core.spi.RendererFeatures;
import io.templatexform.core.spi.RendererMetadata;
import io.templatexform.core.spi.StandardFilter;
import io.templatexform.core.spi.TargetRuntime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders the annotated tree back into TSX.
 *
 * <p>Conditions become expressions: a ternary with {@code null} when the condition has no
 * branches, a two-armed ternary when it only has an else, and an immediately invoked function when
 * it has else-ifs. Branches are rendered before their owner and handed to it as {@link Branch}
 * values. The flat output is then re-indented by {@link JsxIndenter}.
 *
 * <p>When the tree carries import declarations the output is a complete module with imports, a
 * props interface and an exported function component.
 */
public class ReactRenderer extends AbstractTemplateRenderer {

    public static final String ID = "react";

    static final String EXTENDS_WARNING = "React does not support template inheritance. Use composition instead.";

    /** Tokens of the former text-marker branch protocol; they must never reach the output. */
    static final List<String> LEGACY_MARKERS = List.of("___REACT_ELSE___", "___REACT_ELSEIF___");

    private static final RendererMetadata METADATA = new RendererMetadata(
            ID,
            "1.0.0",
            TargetRuntime.JS,
            ".tsx",
            "React function components in TSX",
            new RendererFeatures(false, true, false, false, false, true, true));

    private static final Pattern VALID_PROP_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern KEBAB_SEGMENT = Pattern.compile("-([a-z])");
    private static final Pattern UNSAFE_TYPE_CHARS = Pattern.compile("[|&{}<>()]");

    private static final Set<String> SAFE_TYPES = Set.of(
            "string", "number", "boolean", "any", "unknown", "void", "never", "null", "undefined",
            "ReactNode", "ReactElement", "JSX.Element", "React.ReactNode", "React.ReactElement",
            "Record", "Array", "Promise", "Partial", "Required", "Readonly", "Pick", "Omit");

    private static final String MODULE_BODY_INDENT = "    ";

    private static final Map<StandardFilter, FilterDefinition> FILTERS = jsFilters();

    private final Map<Element, List<Branch>> pendingBranches = new IdentityHashMap<>();

    @Override
    public RendererMetadata metadata() {
        return METADATA;
    }

    @Override
    public TemplateOutput transform(Root root) {
        pendingBranches.clear();
        return super.transform(root);
    }

    @Override
    public void dispose() {
        pendingBranches.clear();
        super.dispose();
    }

    // ── Conditions ──

    @Override
    protected String renderBranches(Element owner, List<Element> branches) {
        List<Branch> rendered = new ArrayList<>(branches.size());
        for (Element branch : branches) {
            rendered.add(new Branch(branch.annotations().condition(), processElement(withoutCondition(branch))));
        }
        pendingBranches.put(owner, rendered);
        return "";
    }

    @Override
    protected String applyCondition(Element element, String content) {
        ConditionAnnotation condition = element.annotations().condition();
        if (condition.isBranch()) {
            return renderCondition(condition, content);
        }
        List<Branch> branches = pendingBranches.remove(element);
        if (branches == null || branches.isEmpty()) {
            return renderCondition(condition, content);
        }
        List<Branch> elseIfs = branches.stream().filter(Branch::isElseIf).collect(Collectors.toList());
        List<Branch> elses = branches.stream().filter(b -> !b.isElseIf()).collect(Collectors.toList());
        if (elses.size() > 1) {
            addWarning("Condition has " + elses.size() + " else branches, only the first is rendered");
        }
        Branch elseBranch = elses.isEmpty() ? null : elses.get(0);
        if (elseIfs.isEmpty()) {
            return "{" + condition.expression() + " ? (<>" + content.trim() + "</>) : (<>"
                    + elseBranch.content().trim() + "</>)}";
        }
        List<String> lines = new ArrayList<>();
        lines.add("{(() => {");
        lines.add("  if (" + condition.expression() + ") return (<>" + content.trim() + "</>);");
        for (Branch branch : elseIfs) {
            lines.add("  if (" + branch.condition().expression() + ") return (<>" + branch.content().trim() + "</>);");
        }
        lines.add(elseBranch != null ? "  return (<>" + elseBranch.content().trim() + "</>);" : "  return null;");
        lines.add("})()}");
        return String.join("\n", lines);
    }

    /** A plain condition as a ternary with {@code null}; an else or else-if arm renders its content inline. */
    @Override
    public String renderCondition(ConditionAnnotation condition, String content) {
        if (condition.isBranch()) {
            return content;
        }
        return "{" + condition.expression() + " ? (<>" + content + "</>) : null}";
    }

    @Override
    public String renderElse(ConditionAnnotation condition) {
        if (condition == null || condition.isElse()) {
            return "{/* else */}";
        }
        return "{/* else if (" + condition.expression() + ") */}";
    }

    // ── Loops, variables, slots, includes ──

    @Override
    public String renderLoop(LoopAnnotation loop, String content) {
        String item = loop.item();
        String index = loop.indexVar() != null ? loop.indexVar() : "index";
        String key = switch (loop.keyKind()) {
            case EXPLICIT -> loop.key();
            case FIELD -> loop.key().equals(item) || loop.key().startsWith(item + ".")
                    ? loop.key()
                    : item + "." + loop.key();
            case IDENTITY -> item + ".id ?? " + index;
            case NONE -> index;
        };
        String collection = loop.collection().contains(".") ? "(" + loop.collection() + " ?? [])" : loop.collection();
        String body = Arrays.stream(JsxIndenter.indent(content, config().indent()).split("\n"))
                .filter(line -> !line.isBlank())
                .map(line -> MODULE_BODY_INDENT + line)
                .collect(Collectors.joining("\n"));
        return "{" + collection + ".map((" + item + ", " + index + ") => (\n"
                + "  <Fragment key={" + key + "}>\n"
                + (body.isEmpty() ? "" : body + "\n")
                + "  </Fragment>\n"
                + "))}";
    }

    @Override
    public String renderVariable(VariableAnnotation variable) {
        String expression = variable.name();
        if (variable.defaultValue() != null) {
            expression = expression + " ?? " + jsValue(variable.defaultValue());
            if (variable.filter() != null) {
                expression = "(" + expression + ")";
            }
        }
        if (variable.filter() != null) {
            expression = applyFilter(expression, variable.filter(), variable.filterArgs());
        }
        return "{" + expression + "}";
    }

    private static String jsValue(String value) {
        if (NUMBER.matcher(value.trim()).matches() || "true".equals(value) || "false".equals(value)) {
            return value.trim();
        }
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }

    @Override
    public String renderSlot(SlotAnnotation slot, String defaultContent) {
        String name = slot.isDefault() ? "children" : slot.name();
        if (defaultContent != null && !defaultContent.isBlank()) {
            return "{" + name + " ?? (<>" + defaultContent + "</>)}";
        }
        return "{" + name + "}";
    }

    @Override
    public String renderInclude(IncludeAnnotation include, String childrenContent) {
        String component = include.originalName() != null && !include.originalName().isEmpty()
                ? include.originalName()
                : componentName(include.targetName());
        List<String> props = new ArrayList<>();
        include.props().forEach((key, value) ->
                props.add(IncludeAnnotation.isSpreadKey(key) ? "{..." + value + "}" : key + "={" + value + "}"));
        String attributes = props.isEmpty() ? "" : " " + String.join(" ", props);
        if (childrenContent != null && !childrenContent.isBlank()) {
            return "<" + component + attributes + ">" + childrenContent.trim() + "</" + component + ">";
        }
        return "<" + component + attributes + " />";
    }

    /** {@code blocks/cta-block.liquid} becomes {@code CtaBlock}. */
    static String componentName(String target) {
        String basename = target.substring(target.lastIndexOf('/') + 1).replaceAll("\\.\\w+$", "");
        StringBuilder name = new StringBuilder();
        for (String part : basename.split("[-_]")) {
            if (!part.isEmpty()) {
                name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return name.toString();
    }

    @Override
    public String renderBlock(BlockAnnotation block, String content) {
        return "{/* block: " + block.name() + " */}\n" + content + "\n{/* /block: " + block.name() + " */}";
    }

    @Override
    public String renderExtends(String layout) {
        addWarning(EXTENDS_WARNING);
        return "{/* extends: " + layout + " (use composition instead) */}";
    }

    @Override
    public String renderComment(String text) {
        return "{/* " + text + " */}";
    }

    // ── Attributes ──

    @Override
    protected String formatAttributes(Map<String, PropertyValue> attributes) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, PropertyValue> entry : attributes.entrySet()) {
            String name = "for".equals(entry.getKey()) ? "htmlFor" : entry.getKey();
            PropertyValue value = entry.getValue();
            if (value instanceof PropertyValue.BooleanValue bool) {
                if (bool.value()) {
                    parts.add(name);
                }
            } else if (value instanceof PropertyValue.ClassList classes) {
                parts.add(name + "=\"" + escapeAttribute(classes.joined()) + "\"");
            } else if (value instanceof PropertyValue.StyleValue style) {
                parts.add(name + "={" + styleObject(style.declarations()) + "}");
            } else if (value instanceof PropertyValue.ExpressionValue expression) {
                parts.add(name + "=" + renderAttributeExpression(expression.expression()));
            } else if (value instanceof PropertyValue.NumberValue number) {
                parts.add(name + "={" + number.literal() + "}");
            } else if (value instanceof PropertyValue.StringValue string) {
                parts.add(name + "=\"" + escapeAttribute(string.value()) + "\"");
            }
        }
        return String.join(" ", parts);
    }

    @Override
    protected String renderAttributeExpression(String expression) {
        return "{" + expression + "}";
    }

    private static String styleObject(Map<String, String> declarations) {
        List<String> entries = new ArrayList<>();
        declarations.forEach((property, value) -> entries.add(camelCase(property) + ": \"" + value + "\""));
        return "{ " + String.join(", ", entries) + " }";
    }

    private static String camelCase(String property) {
        Matcher matcher = KEBAB_SEGMENT.matcher(property);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, matcher.group(1).toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // ── Filters ──

    @Override
    protected Map<StandardFilter, FilterDefinition> filterDefinitions() {
        return FILTERS;
    }

    private static Map<StandardFilter, FilterDefinition> jsFilters() {
        Map<StandardFilter, FilterDefinition> filters = new EnumMap<>(StandardFilter.class);
        filters.put(StandardFilter.UPPERCASE, FilterDefinition.of("toUpperCase"));
        filters.put(StandardFilter.LOWERCASE, FilterDefinition.of("toLowerCase"));
        filters.put(StandardFilter.CAPITALIZE, FilterDefinition.of("capitalize"));
        filters.put(StandardFilter.TRIM, FilterDefinition.of("trim"));
        filters.put(StandardFilter.JSON, FilterDefinition.of("JSON.stringify"));
        filters.put(StandardFilter.LENGTH, FilterDefinition.of("length"));
        filters.put(StandardFilter.JOIN, FilterDefinition.of("join", "\", \""));
        filters.put(StandardFilter.SPLIT, FilterDefinition.of("split", "\",\""));
        filters.put(StandardFilter.REVERSE, FilterDefinition.of("reverse"));
        filters.put(StandardFilter.SORT, FilterDefinition.of("sort"));
        filters.put(StandardFilter.FIRST, FilterDefinition.of("first"));
        filters.put(StandardFilter.LAST, FilterDefinition.of("last"));
        filters.put(StandardFilter.SLICE, FilterDefinition.of("slice", "0"));
        filters.put(StandardFilter.TRUNCATE, FilterDefinition.of("substring", "0", "50"));
        return Collections.unmodifiableMap(filters);
    }

    /** Standard filters become JS expressions; anything else is called as a method. */
    @Override
    public String applyFilter(String expression, String filterName, List<String> args) {
        List<String> callerArgs = args != null ? args : List.of();
        Optional<StandardFilter> standard = StandardFilter.fromKey(filterName)
                .filter(filter -> filterDefinitions().containsKey(filter));
        Optional<String> override = standard.flatMap(filter -> config().filterMapping(filter));
        if (standard.isEmpty() || override.isPresent()) {
            String method = override.orElse(filterName);
            if (standard.isEmpty()) {
                addWarning("Unknown filter \"" + filterName + "\", passing as method call");
            }
            return expression + "." + method + "(" + String.join(", ", callerArgs) + ")";
        }
        String first = callerArgs.isEmpty() ? null : callerArgs.get(0);
        return switch (standard.get()) {
            case UPPERCASE -> expression + ".toUpperCase()";
            case LOWERCASE -> expression + ".toLowerCase()";
            case CAPITALIZE -> expression + ".charAt(0).toUpperCase() + " + expression + ".slice(1)";
            case TRIM -> expression + ".trim()";
            case JSON -> "JSON.stringify(" + expression + ")";
            case LENGTH -> expression + ".length";
            case JOIN -> expression + ".join(" + (first != null ? quote(first) : "\", \"") + ")";
            case SPLIT -> expression + ".split(" + (first != null ? quote(first) : "\",\"") + ")";
            case REVERSE -> "[..." + expression + "].reverse()";
            case SORT -> "[..." + expression + "].sort()";
            case FIRST -> expression + "[0]";
            case LAST -> expression + "[" + expression + ".length - 1]";
            case SLICE -> expression + ".slice(" + (callerArgs.isEmpty() ? "0" : String.join(", ", callerArgs)) + ")";
            case TRUNCATE -> expression + ".substring(0, " + (first != null ? first : "50") + ")";
            default -> throw new IllegalStateException("Unhandled filter: " + standard.get());
        };
    }

    // ── Output ──

    @Override
    protected String formatOutput(String content) {
        return JsxIndenter.indent(content, config().indent());
    }

    @Override
    protected String assemble(Root root, String body) {
        Meta meta = root.meta();
        if (meta.imports().isEmpty()) {
            return body;
        }
        String name = componentName(root);
        boolean usesFragment = body.contains("<Fragment") || body.contains("</Fragment>");
        List<ImportDeclaration> imports = usesFragment ? withFragmentImport(meta.imports()) : meta.imports();
        List<String> propNames = meta.props().stream()
                .map(PropDefinition::name)
                .filter(prop -> VALID_PROP_NAME.matcher(prop).matches())
                .collect(Collectors.toList());

        StringBuilder out = new StringBuilder(importBlock(imports)).append("\n\n");
        if (!propNames.isEmpty()) {
            out.append(propsInterface(name, meta.props(), propNames)).append("\n\n");
        }
        String preamble = meta.preamble().isEmpty()
                ? ""
                : meta.preamble().stream().map(line -> "  " + line).collect(Collectors.joining("\n")) + "\n\n";
        out.append("export function ").append(name);
        if (propNames.isEmpty()) {
            out.append("() {\n");
        } else {
            out.append("(props: ").append(name).append("Props) {\n")
                    .append("  const { ").append(String.join(", ", propNames)).append(" } = props;\n\n");
        }
        out.append(preamble).append("  return (\n");
        String indentedBody = Arrays.stream(body.split("\n"))
                .map(line -> line.isBlank() ? "" : MODULE_BODY_INDENT + line)
                .collect(Collectors.joining("\n"))
                .stripTrailing();
        if (!indentedBody.isEmpty()) {
            out.append(indentedBody).append("\n");
        }
        return out.append("  );\n}\n").toString();
    }

    private static List<ImportDeclaration> withFragmentImport(List<ImportDeclaration> imports) {
        List<ImportDeclaration> result = new ArrayList<>(imports);
        for (int i = 0; i < result.size(); i++) {
            ImportDeclaration declaration = result.get(i);
            if ("react".equals(declaration.source()) && !declaration.typeOnly()) {
                if (!declaration.namedImports().contains("Fragment")) {
                    result.set(i, declaration.withNamedImport("Fragment"));
                }
                return result;
            }
        }
        result.add(new ImportDeclaration("react", null, List.of("Fragment"), null, false));
        return result;
    }

    static String importBlock(List<ImportDeclaration> imports) {
        List<String> lines = new ArrayList<>();
        for (ImportDeclaration declaration : imports) {
            String from = " from '" + declaration.source() + "';";
            String named = "{ " + String.join(", ", declaration.namedImports()) + " }";
            if (declaration.typeOnly()) {
                if (!declaration.namedImports().isEmpty()) {
                    lines.add("import type " + named + from);
                }
            } else if (declaration.namespaceImport() != null) {
                lines.add("import * as " + declaration.namespaceImport() + from);
            } else if (declaration.defaultImport() != null && declaration.namedImports().isEmpty()) {
                lines.add("import " + declaration.defaultImport() + from);
            } else if (declaration.defaultImport() != null) {
                lines.add("import " + declaration.defaultImport() + ", " + named + from);
            } else if (!declaration.namedImports().isEmpty()) {
                lines.add("import " + named + from);
            } else {
                lines.add("import '" + declaration.source() + "';");
            }
        }
        return String.join("\n", lines);
    }

    private static String propsInterface(String name, List<PropDefinition> props, List<String> propNames) {
        Map<String, PropDefinition> byName = new LinkedHashMap<>();
        props.forEach(prop -> byName.putIfAbsent(prop.name(), prop));
        List<String> lines = new ArrayList<>();
        lines.add("interface " + name + "Props {");
        for (String propName : propNames) {
            PropDefinition prop = byName.get(propName);
            String type = prop != null && prop.hasKnownType() ? sanitizeType(prop.type()) : "any";
            boolean optional = prop == null || !prop.required();
            lines.add("  " + propName + (optional ? "?" : "") + ": " + type + ";");
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    /**
     * Keeps types that resolve without the source file's own declarations. A bare reference to
     * some other named type becomes {@code any}, or {@code any[]} for an array of it.
     */
    static String sanitizeType(String type) {
        boolean array = type.endsWith("[]");
        String base = array ? type.substring(0, type.length() - 2) : type;
        if (UNSAFE_TYPE_CHARS.matcher(base).find()
                || SAFE_TYPES.contains(base)
                || base.trim().startsWith("'")
                || base.trim().startsWith("\"")) {
            return type;
        }
        return array ? "any[]" : "any";
    }

    private static String componentName(Root root) {
        String name = root.meta().componentName();
        return name != null && !name.isEmpty() ? name : "Template";
    }

    @Override
    protected String outputFilename(Root root) {
        return componentName(root) + fileExtension();
    }

    // ── Validation ──

    @Override
    protected void validateSyntax(String output, List<String> errors) {
        for (String marker : LEGACY_MARKERS) {
            if (output.contains(marker)) {
                errors.add("Unprocessed condition branch markers found in output");
                break;
            }
        }
        int balance = JsxIndenter.braceBalance(output);
        if (balance < 0) {
            errors.add("Unbalanced JSX expression braces: extra closing brace");
        } else if (balance > 0) {
            errors.add("Unbalanced JSX expression braces: " + balance + " unclosed");
        }
    }
}

package io.templatexform.core.render.latte;

import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.model.VariableAnnotation;
import io.templatexform.core.render.AbstractTemplateRenderer;
import io.templatexform.core.spi.FilterDefinition;
import io.templatexform.core.spi.RendererFeatures;
import io.templatexform.core.spi.RendererMetadata;
import io.templatexform.core.spi.StandardFilter;
import io.templatexform.core.spi.TargetRuntime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Latte templates for the Nette framework. Template variables carry PHP's {@code $} sigil. */
public class LatteRenderer extends AbstractTemplateRenderer {

    public static final String ID = "latte";

    private static final RendererMetadata METADATA = new RendererMetadata(
            ID,
            "1.0.0",
            TargetRuntime.PHP,
            ".latte",
            "Latte templates for Nette applications",
            RendererFeatures.textEngine(true, true));

    private static final Map<StandardFilter, FilterDefinition> FILTERS = latteFilters();

    private static final Set<String> KEYWORDS = Set.of("true", "false", "null", "and", "or", "not", "in", "as");

    private static final Pattern TAG_OPEN = Pattern.compile("\\{(if|foreach|block|define)\\b");
    private static final Pattern TAG_CLOSE = Pattern.compile("\\{/(if|foreach|block|define)\\}");

    @Override
    public RendererMetadata metadata() {
        return METADATA;
    }

    @Override
    protected Map<StandardFilter, FilterDefinition> filterDefinitions() {
        return FILTERS;
    }

    private static Map<StandardFilter, FilterDefinition> latteFilters() {
        Map<StandardFilter, FilterDefinition> filters = new EnumMap<>(StandardFilter.class);
        filters.put(StandardFilter.UPPERCASE, FilterDefinition.of("upper"));
        filters.put(StandardFilter.LOWERCASE, FilterDefinition.of("lower"));
        filters.put(StandardFilter.CAPITALIZE, FilterDefinition.of("firstUpper"));
        filters.put(StandardFilter.TRIM, FilterDefinition.of("trim"));
        filters.put(StandardFilter.DATE, FilterDefinition.of("date", "'Y-m-d'"));
        filters.put(StandardFilter.CURRENCY, FilterDefinition.of("number", "2"));
        filters.put(StandardFilter.NUMBER, FilterDefinition.of("number"));
        filters.put(StandardFilter.JSON, FilterDefinition.of("json"));
        filters.put(StandardFilter.ESCAPE, FilterDefinition.of("escapeHtml"));
        filters.put(StandardFilter.RAW, FilterDefinition.of("noescape"));
        filters.put(StandardFilter.DEFAULT, FilterDefinition.of("default"));
        filters.put(StandardFilter.FIRST, FilterDefinition.of("first"));
        filters.put(StandardFilter.LAST, FilterDefinition.of("last"));
        filters.put(StandardFilter.LENGTH, FilterDefinition.of("length"));
        filters.put(StandardFilter.JOIN, FilterDefinition.of("implode", "', '"));
        filters.put(StandardFilter.SPLIT, FilterDefinition.of("explode"));
        filters.put(StandardFilter.REVERSE, FilterDefinition.of("reverse"));
        filters.put(StandardFilter.SORT, FilterDefinition.of("sort"));
        filters.put(StandardFilter.SLICE, FilterDefinition.of("slice"));
        filters.put(StandardFilter.TRUNCATE, FilterDefinition.of("truncate", "50"));
        return Collections.unmodifiableMap(filters);
    }

    @Override
    public String renderLoop(LoopAnnotation loop, String content) {
        String collection = phpExpression(loop.collection());
        String open = loop.indexVar() != null
                ? "{foreach " + collection + " as $" + loop.indexVar() + " => $" + loop.item() + "}"
                : "{foreach " + collection + " as $" + loop.item() + "}";
        return open + "\n" + content + "\n{/foreach}";
    }

    @Override
    public String renderCondition(ConditionAnnotation condition, String content) {
        if (condition.isElse()) {
            return "{else}\n" + content;
        }
        if (condition.isElseIf()) {
            return "{elseif " + phpExpression(condition.expression()) + "}\n" + content;
        }
        return "{if " + phpExpression(condition.expression()) + "}\n" + content + "\n{/if}";
    }

    @Override
    public String renderElse(ConditionAnnotation condition) {
        if (condition != null && condition.isElseIf()) {
            return "{elseif " + phpExpression(condition.expression()) + "}";
        }
        return "{else}";
    }

    @Override
    public String renderVariable(VariableAnnotation variable) {
        String expression = phpExpression(variable.name());
        if (variable.defaultValue() != null) {
            expression = expression + " ?? " + quote(variable.defaultValue());
        }
        if (variable.filter() != null) {
            expression = applyFilter(expression, variable.filter(), variable.filterArgs());
        }
        if (variable.raw()) {
            expression = applyFilter(expression, StandardFilter.RAW.key(), List.of());
        }
        return "{" + expression + "}";
    }

    @Override
    public String renderSlot(SlotAnnotation slot, String defaultContent) {
        return "{block " + slot.name() + "}" + (defaultContent != null ? defaultContent : "") + "{/block}";
    }

    @Override
    public String renderInclude(IncludeAnnotation include, String childrenContent) {
        String path = includePath(include.targetName());
        warnDroppedChildren(path, childrenContent);
        List<String> args = new ArrayList<>();
        include.props().forEach((key, value) -> args.add(IncludeAnnotation.isSpreadKey(key)
                ? "..." + phpExpression(value)
                : key + ": " + phpExpression(value)));
        if (args.isEmpty()) {
            return "{include '" + path + "'}";
        }
        return "{include '" + path + "', " + String.join(", ", args) + "}";
    }

    @Override
    public String renderBlock(BlockAnnotation block, String content) {
        return "{block " + block.name() + "}" + content + "{/block}";
    }

    @Override
    public String renderExtends(String layout) {
        return "{layout '" + includePath(layout) + "'}";
    }

    @Override
    public String renderComment(String text) {
        return "{* " + text + " *}";
    }

    @Override
    protected String renderAttributeExpression(String expression) {
        return "{" + phpExpression(expression) + "}";
    }

    /** Latte syntax: {@code expression|name:args}. */
    @Override
    public String applyFilter(String expression, String filterName, List<String> args) {
        FilterCall call = resolveFilter(filterName, args);
        if (call.args().isEmpty()) {
            return expression + "|" + call.name();
        }
        return expression + "|" + call.name() + ":" + String.join(", ", call.args());
    }

    /**
     * Prefixes {@code $} to every bare identifier of a JS-style expression. String literals,
     * property names after {@code .}, function names and the keywords {@code true false null and or
     * not in as} are left alone.
     */
    static String phpExpression(String expression) {
        String source = expression.trim();
        StringBuilder out = new StringBuilder(source.length() + 8);
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                int end = stringEnd(source, i);
                out.append(source, i, end);
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i + 1;
                while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                    end++;
                }
                String identifier = source.substring(i, end);
                if (needsSigil(source, i, end, identifier)) {
                    out.append('$');
                }
                out.append(identifier);
                i = end;
            } else if (Character.isDigit(c)) {
                int end = i + 1;
                while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                    end++;
                }
                out.append(source, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean needsSigil(String source, int start, int end, String identifier) {
        if (KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (start > 0) {
            char before = source.charAt(start - 1);
            if (before == '.' || before == '$' || before == '>' && start > 1 && source.charAt(start - 2) == '-') {
                return false;
            }
        }
        int next = end;
        while (next < source.length() && Character.isWhitespace(source.charAt(next))) {
            next++;
        }
        return next >= source.length() || source.charAt(next) != '(';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int stringEnd(String source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return source.length();
    }

    @Override
    protected void validateSyntax(String output, List<String> errors) {
        int open = count(output, TAG_OPEN);
        int close = count(output, TAG_CLOSE);
        if (open != close) {
            errors.add("Unbalanced block tags: " + open + " open, " + close + " close");
        }
    }
}

package io.templatexform.core.render.handlebars;

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
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Handlebars templates. Filters become helper calls, {@code (helper value args)} inside
 * expressions and {@code {{helper value args}}} at the top level; the helpers themselves are
 * expected to be registered by the host application.
 */
public class HandlebarsRenderer extends AbstractTemplateRenderer {

    public static final String ID = "handlebars";

    private static final RendererMetadata METADATA = new RendererMetadata(
            ID,
            "1.0.0",
            TargetRuntime.JS,
            ".hbs",
            "Handlebars templates for Express and static sites",
            RendererFeatures.textEngine(true, true));

    private static final Map<StandardFilter, FilterDefinition> FILTERS = helpers();

    private static final Pattern EQUALITY = Pattern.compile("\\s*[!=]==?\\s*");
    private static final Pattern BLOCK_OPEN = Pattern.compile("\\{\\{#(if|each|unless|with)\\b");
    private static final Pattern BLOCK_CLOSE = Pattern.compile("\\{\\{/(if|each|unless|with)\\}\\}");
    private static final Pattern MUSTACHE_OPEN = Pattern.compile("\\{\\{(?!\\{)");
    private static final Pattern MUSTACHE_CLOSE = Pattern.compile("(?<!\\})\\}\\}");

    @Override
    public RendererMetadata metadata() {
        return METADATA;
    }

    @Override
    protected Map<StandardFilter, FilterDefinition> filterDefinitions() {
        return FILTERS;
    }

    private static Map<StandardFilter, FilterDefinition> helpers() {
        Map<StandardFilter, FilterDefinition> filters = new EnumMap<>(StandardFilter.class);
        filters.put(StandardFilter.UPPERCASE, FilterDefinition.of("uppercase"));
        filters.put(StandardFilter.LOWERCASE, FilterDefinition.of("lowercase"));
        filters.put(StandardFilter.CAPITALIZE, FilterDefinition.of("capitalize"));
        filters.put(StandardFilter.TRIM, FilterDefinition.of("trim"));
        filters.put(StandardFilter.DATE, FilterDefinition.of("formatDate", "\"YYYY-MM-DD\""));
        filters.put(StandardFilter.CURRENCY, FilterDefinition.of("formatCurrency"));
        filters.put(StandardFilter.NUMBER, FilterDefinition.of("formatNumber"));
        filters.put(StandardFilter.JSON, FilterDefinition.of("json"));
        filters.put(StandardFilter.ESCAPE, FilterDefinition.of("escape"));
        filters.put(StandardFilter.RAW, FilterDefinition.of("raw"));
        filters.put(StandardFilter.DEFAULT, FilterDefinition.of("default"));
        filters.put(StandardFilter.FIRST, FilterDefinition.of("first"));
        filters.put(StandardFilter.LAST, FilterDefinition.of("last"));
        filters.put(StandardFilter.LENGTH, FilterDefinition.of("length"));
        filters.put(StandardFilter.JOIN, FilterDefinition.of("join", "\", \""));
        filters.put(StandardFilter.SPLIT, FilterDefinition.of("split"));
        filters.put(StandardFilter.REVERSE, FilterDefinition.of("reverse"));
        filters.put(StandardFilter.SORT, FilterDefinition.of("sort"));
        filters.put(StandardFilter.SLICE, FilterDefinition.of("slice"));
        filters.put(StandardFilter.TRUNCATE, FilterDefinition.of("truncate", "50"));
        return Collections.unmodifiableMap(filters);
    }

    @Override
    public String renderLoop(LoopAnnotation loop, String content) {
        String params = loop.indexVar() != null ? loop.item() + " " + loop.indexVar() : loop.item();
        return "{{#each " + loop.collection() + " as |" + params + "|}}\n" + content + "\n{{/each}}";
    }

    @Override
    public String renderCondition(ConditionAnnotation condition, String content) {
        if (condition.isElse()) {
            return "{{else}}\n" + content;
        }
        if (condition.isElseIf()) {
            return "{{else if " + conditionExpression(condition.expression()) + "}}\n" + content;
        }
        return "{{#if " + conditionExpression(condition.expression()) + "}}\n" + content + "\n{{/if}}";
    }

    @Override
    public String renderElse(ConditionAnnotation condition) {
        if (condition != null && condition.isElseIf()) {
            return "{{else if " + conditionExpression(condition.expression()) + "}}";
        }
        return "{{else}}";
    }

    /** Handlebars conditions test truthiness only; comparison operators are dropped. */
    private String conditionExpression(String expression) {
        if (EQUALITY.matcher(expression).find()) {
            addWarning("Handlebars does not support comparison operators, condition reduced: " + expression);
            return EQUALITY.matcher(expression).replaceAll(" ").trim();
        }
        return expression.trim();
    }

    @Override
    public String renderVariable(VariableAnnotation variable) {
        String open = variable.raw() ? "{{{" : "{{";
        String close = variable.raw() ? "}}}" : "}}";
        if (variable.filter() != null) {
            FilterCall call = resolveFilter(variable.filter(), variable.filterArgs());
            List<String> parts = new ArrayList<>();
            parts.add(call.name());
            parts.add(variable.name());
            parts.addAll(call.args());
            if (variable.defaultValue() != null) {
                parts.add("default=" + quote(variable.defaultValue()));
            }
            return open + String.join(" ", parts) + close;
        }
        if (variable.defaultValue() != null) {
            return open + "default " + variable.name() + " " + quote(variable.defaultValue()) + close;
        }
        return open + variable.name() + close;
    }

    /**
     * The default slot renders the partial block, named slots render a partial. Default content
     * becomes the failover content of the partial.
     */
    @Override
    public String renderSlot(SlotAnnotation slot, String defaultContent) {
        boolean hasDefault = defaultContent != null && !defaultContent.isBlank();
        if (slot.isDefault()) {
            return hasDefault
                    ? "{{#if @partial-block}}{{> @partial-block}}{{else}}" + defaultContent + "{{/if}}"
                    : "{{> @partial-block}}";
        }
        return hasDefault
                ? "{{#> " + slot.name() + "}}" + defaultContent + "{{/" + slot.name() + "}}"
                : "{{> " + slot.name() + "}}";
    }

    /** Children are passed as the partial block; a spread becomes the partial's context. */
    @Override
    public String renderInclude(IncludeAnnotation include, String childrenContent) {
        String partial = include.targetName().replaceAll("\\.hbs$", "");
        List<String> params = new ArrayList<>();
        String context = null;
        for (Map.Entry<String, String> prop : include.props().entrySet()) {
            if (!IncludeAnnotation.isSpreadKey(prop.getKey())) {
                params.add(prop.getKey() + "=" + prop.getValue());
            } else if (context == null) {
                context = prop.getValue();
            } else {
                warnDroppedSpread(partial, prop.getValue());
            }
        }
        if (context != null) {
            params.add(0, context);
        }
        String arguments = params.isEmpty() ? "" : " " + String.join(" ", params);
        if (childrenContent != null && !childrenContent.isBlank()) {
            return "{{#> " + partial + arguments + "}}" + childrenContent + "{{/" + partial + "}}";
        }
        return "{{> " + partial + arguments + "}}";
    }

    @Override
    public String renderBlock(BlockAnnotation block, String content) {
        return "{{#*inline \"" + block.name() + "\"}}" + content + "{{/inline}}";
    }

    @Override
    public String renderExtends(String layout) {
        return renderComment("layout: " + layout);
    }

    @Override
    public String renderComment(String text) {
        return "{{!-- " + text + " --}}";
    }

    @Override
    protected String renderAttributeExpression(String expression) {
        return "{{" + expression + "}}";
    }

    /** Subexpression syntax: {@code (helper expression args)}. */
    @Override
    public String applyFilter(String expression, String filterName, List<String> args) {
        FilterCall call = resolveFilter(filterName, args);
        if (call.args().isEmpty()) {
            return "(" + call.name() + " " + expression + ")";
        }
        return "(" + call.name() + " " + expression + " " + String.join(" ", call.args()) + ")";
    }

    @Override
    protected void validateSyntax(String output, List<String> errors) {
        int open = count(output, BLOCK_OPEN);
        int close = count(output, BLOCK_CLOSE);
        if (open != close) {
            errors.add("Unbalanced block helpers: " + open + " open, " + close + " close");
        }
        int mustacheOpen = count(output, MUSTACHE_OPEN);
        int mustacheClose = count(output, MUSTACHE_CLOSE);
        if (mustacheOpen != mustacheClose) {
            errors.add("Unbalanced mustaches: " + mustacheOpen + " {{ vs " + mustacheClose + " }}");
        }
    }
}

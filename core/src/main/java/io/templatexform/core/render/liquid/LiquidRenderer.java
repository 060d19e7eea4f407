package io.templatexform.core.render.liquid;

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

/** Liquid templates, as used by Shopify, Jekyll and Eleventy. */
public class LiquidRenderer extends AbstractTemplateRenderer {

    public static final String ID = "liquid";

    static final String EXTENDS_WARNING = "Liquid does not support template inheritance. Use includes instead.";

    private static final RendererMetadata METADATA = new RendererMetadata(
            ID,
            "1.0.0",
            TargetRuntime.JS,
            ".liquid",
            "Liquid templates for Shopify, Jekyll and Eleventy",
            RendererFeatures.textEngine(false, false));

    private static final Map<StandardFilter, FilterDefinition> FILTERS = liquidFilters();

    private static final Pattern CONTROL_OPEN = Pattern.compile("\\{%-?\\s*(if|for|unless|case|capture)\\b");
    private static final Pattern CONTROL_CLOSE =
            Pattern.compile("\\{%-?\\s*end(if|for|unless|case|capture)\\s*-?%\\}");
    private static final Pattern OUTPUT_OPEN = Pattern.compile("\\{\\{");
    private static final Pattern OUTPUT_CLOSE = Pattern.compile("\\}\\}");

    @Override
    public RendererMetadata metadata() {
        return METADATA;
    }

    @Override
    protected Map<StandardFilter, FilterDefinition> filterDefinitions() {
        return FILTERS;
    }

    private static Map<StandardFilter, FilterDefinition> liquidFilters() {
        Map<StandardFilter, FilterDefinition> filters = new EnumMap<>(StandardFilter.class);
        filters.put(StandardFilter.UPPERCASE, FilterDefinition.of("upcase"));
        filters.put(StandardFilter.LOWERCASE, FilterDefinition.of("downcase"));
        filters.put(StandardFilter.CAPITALIZE, FilterDefinition.of("capitalize"));
        filters.put(StandardFilter.TRIM, FilterDefinition.of("strip"));
        filters.put(StandardFilter.DATE, FilterDefinition.of("date", "\"%Y-%m-%d\""));
        filters.put(StandardFilter.CURRENCY, FilterDefinition.of("money"));
        filters.put(StandardFilter.NUMBER, FilterDefinition.of("round"));
        filters.put(StandardFilter.JSON, FilterDefinition.of("json"));
        filters.put(StandardFilter.ESCAPE, FilterDefinition.of("escape"));
        filters.put(StandardFilter.RAW, FilterDefinition.of("raw"));
        filters.put(StandardFilter.DEFAULT, FilterDefinition.of("default"));
        filters.put(StandardFilter.FIRST, FilterDefinition.of("first"));
        filters.put(StandardFilter.LAST, FilterDefinition.of("last"));
        filters.put(StandardFilter.LENGTH, FilterDefinition.of("size"));
        filters.put(StandardFilter.JOIN, FilterDefinition.of("join", "\", \""));
        filters.put(StandardFilter.SPLIT, FilterDefinition.of("split"));
        filters.put(StandardFilter.REVERSE, FilterDefinition.of("reverse"));
        filters.put(StandardFilter.SORT, FilterDefinition.of("sort"));
        filters.put(StandardFilter.SLICE, FilterDefinition.of("slice"));
        filters.put(StandardFilter.TRUNCATE, FilterDefinition.of("truncate", "50"));
        return Collections.unmodifiableMap(filters);
    }

    /** Liquid has no index binding: a loop index is assigned from {@code forloop.index0}. */
    @Override
    public String renderLoop(LoopAnnotation loop, String content) {
        String open = "{% for " + loop.item() + " in " + loop.collection() + " %}";
        String index = loop.indexVar() != null ? "{% assign " + loop.indexVar() + " = forloop.index0 %}\n" : "";
        return open + "\n" + index + content + "\n{% endfor %}";
    }

    @Override
    public String renderCondition(ConditionAnnotation condition, String content) {
        if (condition.isElse()) {
            return "{% else %}\n" + content;
        }
        if (condition.isElseIf()) {
            return "{% elsif " + wordOperators(condition.expression()) + " %}\n" + content;
        }
        return "{% if " + wordOperators(condition.expression()) + " %}\n" + content + "\n{% endif %}";
    }

    @Override
    public String renderElse(ConditionAnnotation condition) {
        if (condition != null && condition.isElseIf()) {
            return "{% elsif " + wordOperators(condition.expression()) + " %}";
        }
        return "{% else %}";
    }

    @Override
    public String renderVariable(VariableAnnotation variable) {
        String expression = variable.name();
        if (variable.defaultValue() != null) {
            expression = expression + " | default: " + quote(variable.defaultValue());
        }
        if (variable.filter() != null) {
            expression = applyFilter(expression, variable.filter(), variable.filterArgs());
        }
        if (variable.raw()) {
            expression = applyFilter(expression, StandardFilter.RAW.key(), List.of());
        }
        return "{{ " + expression + " }}";
    }

    @Override
    public String renderSlot(SlotAnnotation slot, String defaultContent) {
        String variable = slot.name() + "_content";
        if (defaultContent != null && !defaultContent.isBlank()) {
            return "{% if " + variable + " %}{{ " + variable + " }}{% else %}" + defaultContent + "{% endif %}";
        }
        return "{{ " + variable + " }}";
    }

    @Override
    public String renderInclude(IncludeAnnotation include, String childrenContent) {
        String path = includePath(include.targetName());
        warnDroppedChildren(path, childrenContent);
        List<String> props = new ArrayList<>();
        include.props().forEach((key, value) -> {
            if (IncludeAnnotation.isSpreadKey(key)) {
                warnDroppedSpread(path, value);
            } else {
                props.add(key + ": " + value);
            }
        });
        if (props.isEmpty()) {
            return "{% include '" + path + "' %}";
        }
        return "{% include '" + path + "', " + String.join(", ", props) + " %}";
    }

    @Override
    public String renderBlock(BlockAnnotation block, String content) {
        return "{% capture " + block.name() + " %}" + content + "{% endcapture %}";
    }

    @Override
    public String renderExtends(String layout) {
        addWarning(EXTENDS_WARNING);
        return renderComment("extends '" + layout + "' is not supported in Liquid");
    }

    @Override
    public String renderComment(String text) {
        return "{% comment %}" + text + "{% endcomment %}";
    }

    @Override
    protected String renderAttributeExpression(String expression) {
        return "{{ " + expression + " }}";
    }

    @Override
    protected void validateSyntax(String output, List<String> errors) {
        int open = count(output, CONTROL_OPEN);
        int close = count(output, CONTROL_CLOSE);
        if (open != close) {
            errors.add("Unbalanced control tags: " + open + " open, " + close + " close");
        }
        int outputOpen = count(output, OUTPUT_OPEN);
        int outputClose = count(output, OUTPUT_CLOSE);
        if (outputOpen != outputClose) {
            errors.add("Unbalanced output tags: " + outputOpen + " {{ vs " + outputClose + " }}");
        }
    }
}

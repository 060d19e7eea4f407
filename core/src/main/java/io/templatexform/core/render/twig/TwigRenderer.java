package io.templatexform.core.render.twig;

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

/** Twig templates for Symfony and other PHP frameworks. */
public class TwigRenderer extends AbstractTemplateRenderer {

    public static final String ID = "twig";

    private static final RendererMetadata METADATA = new RendererMetadata(
            ID,
            "1.0.0",
            TargetRuntime.PHP,
            ".twig",
            "Twig templates for Symfony and PHP applications",
            RendererFeatures.textEngine(true, true));

    private static final Map<StandardFilter, FilterDefinition> FILTERS = twigFilters();

    private static final Pattern TAG_OPEN = Pattern.compile("\\{%-?\\s*(if|for|block|macro)\\b");
    private static final Pattern TAG_CLOSE = Pattern.compile("\\{%-?\\s*end(if|for|block|macro)\\b[^%]*%\\}");
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

    private static Map<StandardFilter, FilterDefinition> twigFilters() {
        Map<StandardFilter, FilterDefinition> filters = new EnumMap<>(StandardFilter.class);
        filters.put(StandardFilter.UPPERCASE, FilterDefinition.of("upper"));
        filters.put(StandardFilter.LOWERCASE, FilterDefinition.of("lower"));
        filters.put(StandardFilter.CAPITALIZE, FilterDefinition.of("capitalize"));
        filters.put(StandardFilter.TRIM, FilterDefinition.of("trim"));
        filters.put(StandardFilter.DATE, FilterDefinition.of("date", "\"Y-m-d\""));
        filters.put(StandardFilter.CURRENCY, FilterDefinition.of("format_currency", "\"USD\""));
        filters.put(StandardFilter.NUMBER, FilterDefinition.of("number_format"));
        filters.put(StandardFilter.JSON, FilterDefinition.of("json_encode"));
        filters.put(StandardFilter.ESCAPE, FilterDefinition.of("e"));
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
        filters.put(StandardFilter.TRUNCATE, FilterDefinition.of("u.truncate", "50"));
        return Collections.unmodifiableMap(filters);
    }

    /** With an index binding the loop iterates keys and values: {@code for i, item in items}. */
    @Override
    public String renderLoop(LoopAnnotation loop, String content) {
        String targets = loop.indexVar() != null ? loop.indexVar() + ", " + loop.item() : loop.item();
        return "{% for " + targets + " in " + loop.collection() + " %}\n" + content + "\n{% endfor %}";
    }

    @Override
    public String renderCondition(ConditionAnnotation condition, String content) {
        if (condition.isElse()) {
            return "{% else %}\n" + content;
        }
        if (condition.isElseIf()) {
            return "{% elseif " + wordOperators(condition.expression()) + " %}\n" + content;
        }
        return "{% if " + wordOperators(condition.expression()) + " %}\n" + content + "\n{% endif %}";
    }

    @Override
    public String renderElse(ConditionAnnotation condition) {
        if (condition != null && condition.isElseIf()) {
            return "{% elseif " + wordOperators(condition.expression()) + " %}";
        }
        return "{% else %}";
    }

    /** Filters bind tighter than {@code ??} in Twig, so a defaulted value is parenthesized before filtering. */
    @Override
    public String renderVariable(VariableAnnotation variable) {
        String expression = variable.name();
        if (variable.defaultValue() != null) {
            expression = expression + " ?? " + quote(variable.defaultValue());
            if (variable.filter() != null || variable.raw()) {
                expression = "(" + expression + ")";
            }
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
        return "{% block " + slot.name() + " %}" + (defaultContent != null ? defaultContent : "") + "{% endblock %}";
    }

    /** Props are passed with {@code with}; spreads are merged into the prop map. */
    @Override
    public String renderInclude(IncludeAnnotation include, String childrenContent) {
        String path = includePath(include.targetName());
        warnDroppedChildren(path, childrenContent);
        List<String> props = new ArrayList<>();
        List<String> spreads = new ArrayList<>();
        include.props().forEach((key, value) -> {
            if (IncludeAnnotation.isSpreadKey(key)) {
                spreads.add(value);
            } else {
                props.add(key + ": " + value);
            }
        });
        if (props.isEmpty() && spreads.isEmpty()) {
            return "{% include '" + path + "' %}";
        }
        StringBuilder with = new StringBuilder();
        int firstSpread = 0;
        if (!props.isEmpty()) {
            with.append("{").append(String.join(", ", props)).append("}");
        } else {
            with.append(spreads.get(0));
            firstSpread = 1;
        }
        for (String spread : spreads.subList(firstSpread, spreads.size())) {
            with.append("|merge(").append(spread).append(")");
        }
        return "{% include '" + path + "' with " + with + " %}";
    }

    @Override
    public String renderBlock(BlockAnnotation block, String content) {
        return "{% block " + block.name() + " %}" + content + "{% endblock %}";
    }

    @Override
    public String renderExtends(String layout) {
        return "{% extends '" + includePath(layout) + "' %}";
    }

    @Override
    public String renderComment(String text) {
        return "{# " + text + " #}";
    }

    @Override
    protected String renderAttributeExpression(String expression) {
        return "{{ " + expression + " }}";
    }

    /** Twig syntax: {@code expression|name(args)}. */
    @Override
    public String applyFilter(String expression, String filterName, List<String> args) {
        FilterCall call = resolveFilter(filterName, args);
        if (call.args().isEmpty()) {
            return expression + "|" + call.name();
        }
        return expression + "|" + call.name() + "(" + String.join(", ", call.args()) + ")";
    }

    @Override
    protected void validateSyntax(String output, List<String> errors) {
        int open = count(output, TAG_OPEN);
        int close = count(output, TAG_CLOSE);
        if (open != close) {
            errors.add("Unbalanced block tags: " + open + " open, " + close + " close");
        }
        int outputOpen = count(output, OUTPUT_OPEN);
        int outputClose = count(output, OUTPUT_CLOSE);
        if (outputOpen != outputClose) {
            errors.add("Unbalanced output tags: " + outputOpen + " {{ vs " + outputClose + " }}");
        }
    }
}

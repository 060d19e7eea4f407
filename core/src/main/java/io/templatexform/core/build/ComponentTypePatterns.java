package io.templatexform.core.build;

import io.templatexform.core.model.ComponentType;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Name patterns that decide a component's {@link ComponentType}. Groups are tried in the order
 * layout, partial, page, block; a name matching none of them is a plain component.
 */
public record ComponentTypePatterns(
        List<Pattern> layouts, List<Pattern> partials, List<Pattern> pages, List<Pattern> blocks) {

    private static final ComponentTypePatterns DEFAULTS = new ComponentTypePatterns(
            List.of(Pattern.compile("Layout$", Pattern.CASE_INSENSITIVE)),
            List.of(
                    Pattern.compile("^Header$"),
                    Pattern.compile("^Footer$"),
                    Pattern.compile("^Nav(bar)?$"),
                    Pattern.compile("^Sidebar$")),
            List.of(Pattern.compile("Page$", Pattern.CASE_INSENSITIVE)),
            List.of(
                    Pattern.compile("Block$", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("Section$", Pattern.CASE_INSENSITIVE)));

    public ComponentTypePatterns {
        layouts = layouts != null ? List.copyOf(layouts) : List.of();
        partials = partials != null ? List.copyOf(partials) : List.of();
        pages = pages != null ? List.copyOf(pages) : List.of();
        blocks = blocks != null ? List.copyOf(blocks) : List.of();
    }

    public static ComponentTypePatterns defaults() {
        return DEFAULTS;
    }

    public ComponentType classify(String componentName) {
        if (componentName == null) {
            return ComponentType.COMPONENT;
        }
        if (matches(layouts, componentName)) {
            return ComponentType.LAYOUT;
        }
        if (matches(partials, componentName)) {
            return ComponentType.PARTIAL;
        }
        if (matches(pages, componentName)) {
            return ComponentType.PAGE;
        }
        if (matches(blocks, componentName)) {
            return ComponentType.BLOCK;
        }
        return ComponentType.COMPONENT;
    }

    private static boolean matches(List<Pattern> patterns, String name) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }
}

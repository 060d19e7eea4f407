package io.templatexform.core.build;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.Root;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Read-only queries over an annotated tree. */
public final class TreeQueries {

    private static final Pattern IDENTIFIER_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:\\\\.|[^'\\\\])*'|\"(?:\\\\.|[^\"\\\\])*\"");
    private static final Set<String> KEYWORDS = Set.of("true", "false", "null", "undefined");

    private TreeQueries() {}

    /**
     * Collects the variable names a template reads: variable outputs, loop collections and items,
     * condition roots and unquoted include prop values.
     *
     * @return sorted, deduplicated names
     */
    public static List<String> collectVariables(Root root) {
        SortedSet<String> variables = new TreeSet<>();
        for (Node child : root.children()) {
            collectVariables(child, variables);
        }
        return List.copyOf(variables);
    }

    private static void collectVariables(Node node, Set<String> into) {
        if (!(node instanceof Element element)) {
            return;
        }
        Annotations annotations = element.annotations();
        if (annotations.variable() != null) {
            into.add(annotations.variable().name());
        }
        if (annotations.loop() != null) {
            into.add(annotations.loop().collection());
            into.add(annotations.loop().item());
        }
        if (annotations.condition() != null && !annotations.condition().isElse()) {
            conditionRoots(annotations.condition().expression(), into);
        }
        if (annotations.include() != null) {
            for (Map.Entry<String, String> prop : annotations.include().props().entrySet()) {
                String value = prop.getValue().trim();
                // quoted and numeric literals
                if (value.isEmpty() || !Character.isJavaIdentifierStart(value.charAt(0))) {
                    continue;
                }
                int dot = value.indexOf('.');
                String root = dot > 0 ? value.substring(0, dot) : value;
                if (!KEYWORDS.contains(root)) {
                    into.add(root);
                }
            }
        }
        for (Node child : element.children()) {
            collectVariables(child, into);
        }
    }

    private static void conditionRoots(String condition, Set<String> into) {
        String expression = STRING_LITERAL.matcher(condition).replaceAll("''");
        Matcher matcher = IDENTIFIER_PATH.matcher(expression);
        while (matcher.find()) {
            // skip property accesses such as the "length" in "items?.length"
            if (matcher.start() > 0 && expression.charAt(matcher.start() - 1) == '.') {
                continue;
            }
            String match = matcher.group();
            int dot = match.indexOf('.');
            String root = dot > 0 ? match.substring(0, dot) : match;
            if (!KEYWORDS.contains(root)) {
                into.add(root);
            }
        }
    }

    /** Returns the sorted, deduplicated include targets of the tree. */
    public static List<String> collectDependencies(Root root) {
        SortedSet<String> targets = new TreeSet<>();
        for (Node child : root.children()) {
            collectDependencies(child, targets);
        }
        return List.copyOf(targets);
    }

    private static void collectDependencies(Node node, Set<String> into) {
        if (!(node instanceof Element element)) {
            return;
        }
        IncludeAnnotation include = element.annotations().include();
        if (include != null) {
            into.add(include.targetName());
        }
        for (Node child : element.children()) {
            collectDependencies(child, into);
        }
    }

    /** Counts the elements of the tree, at any depth. */
    public static int countElements(Root root) {
        int count = 0;
        for (Node child : root.children()) {
            count += countElements(child);
        }
        return count;
    }

    private static int countElements(Node node) {
        if (!(node instanceof Element element)) {
            return 0;
        }
        int count = 1;
        for (Node child : element.children()) {
            count += countElements(child);
        }
        return count;
    }
}

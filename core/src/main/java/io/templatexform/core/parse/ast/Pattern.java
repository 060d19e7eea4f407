package io.templatexform.core.parse.ast;

import java.util.List;

/** A binding pattern: the left-hand side of a declaration or a function parameter. */
public interface Pattern extends SyntaxNode {

    /** Object destructuring, e.g. {@code { title, items = [] }}. */
    record ObjectPattern(List<PatternProperty> properties, Pattern rest, int start, int end) implements Pattern {
        public ObjectPattern {
            properties = List.copyOf(properties);
        }
    }

    /**
     * One entry of an object pattern.
     *
     * @param key          property name (string keys unquoted; computed keys as source text)
     * @param value        the binding target
     * @param defaultValue default expression, or {@code null}
     * @param shorthand    {@code true} for {@code { a }} and {@code { a = 1 }}
     */
    record PatternProperty(
            String key, Pattern value, Expression defaultValue, boolean shorthand, int start, int end) {}

    /** Array destructuring; holes are {@code null}. */
    record ArrayPattern(List<Pattern> elements, int start, int end) implements Pattern {}

    /** A pattern with a default value, e.g. a parameter {@code x = 1}. */
    record AssignmentPattern(Pattern target, Expression defaultValue, int start, int end) implements Pattern {}

    /** A rest binding, e.g. {@code ...others}. */
    record RestElement(Pattern argument, int start, int end) implements Pattern {}
}

package io.templatexform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value of an element property. Sealed: the tree builder only ever produces the variants below,
 * and renderers format each one with their own attribute syntax.
 */
public sealed interface PropertyValue {

    /** A static string attribute, e.g. {@code href="/about"}. */
    record StringValue(String value) implements PropertyValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A boolean attribute. {@code true} renders as a bare attribute name, {@code false} is omitted. */
    record BooleanValue(boolean value) implements PropertyValue {}

    /** A numeric literal, kept as its source text so formatting survives unchanged. */
    record NumberValue(String literal) implements PropertyValue {
        public NumberValue {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    /** A {@code className} split on whitespace. */
    record ClassList(List<String> classes) implements PropertyValue {
        public ClassList {
            classes = List.copyOf(classes);
        }

        public String joined() {
            return String.join(" ", classes);
        }
    }

    /** A dynamic expression, kept as raw source text. */
    record ExpressionValue(String expression) implements PropertyValue {
        public ExpressionValue {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /** A static inline style object, in source key order. */
    record StyleValue(Map<String, String> declarations) implements PropertyValue {
        public StyleValue {
            declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
        }
    }

    static PropertyValue string(String value) {
        return new StringValue(value);
    }

    static PropertyValue expression(String expression) {
        return new ExpressionValue(expression);
    }

    static PropertyValue bool(boolean value) {
        return new BooleanValue(value);
    }
}

package io.templatexform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A markup element of the annotated tree.
 *
 * <p>Properties keep source attribute order. Annotations are held apart from the properties so
 * they can never leak into rendered output as literal attributes; the JSON form of the tree puts
 * them under the reserved {@code _gen} key.
 */
public record Element(
        String tagName, Map<String, PropertyValue> properties, List<Node> children, Annotations annotations)
        implements Node {

    public Element {
        Objects.requireNonNull(tagName, "tagName must not be null");
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
        annotations = annotations != null ? annotations : Annotations.NONE;
    }

    /** Creates an element without properties, children or annotations. */
    public static Element of(String tagName) {
        return new Element(tagName, null, null, null);
    }

    /** Creates an element without annotations. */
    public static Element of(String tagName, Map<String, PropertyValue> properties, List<Node> children) {
        return new Element(tagName, properties, children, null);
    }

    /** Creates an annotated element with the given children. */
    public static Element annotated(String tagName, List<Node> children, Annotations annotations) {
        return new Element(tagName, null, children, annotations);
    }

    public Element withAnnotations(Annotations newAnnotations) {
        return new Element(tagName, properties, children, newAnnotations);
    }

    public Element withChildren(List<Node> newChildren) {
        return new Element(tagName, properties, newChildren, annotations);
    }

    /** Returns {@code true} if this element carries a non-else, non-else-if condition. */
    public boolean isConditionOwner() {
        ConditionAnnotation condition = annotations.condition();
        return condition != null && !condition.isBranch();
    }

    /** Returns {@code true} if this element is an else or else-if branch. */
    public boolean isBranch() {
        ConditionAnnotation condition = annotations.condition();
        return condition != null && condition.isBranch();
    }
}

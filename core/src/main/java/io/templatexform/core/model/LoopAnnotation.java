package io.templatexform.core.model;

import java.util.Objects;

/**
 * Marks an element as the body of a loop over {@code collection}.
 *
 * @param item       loop item binding name
 * @param collection collection expression source text
 * @param key        explicit key expression or item field name; {@code null} unless {@code keyKind}
 *                   is {@link KeyKind#EXPLICIT} or {@link KeyKind#FIELD}
 * @param keyKind    how the per-item key was determined
 * @param indexVar   index binding name, or {@code null}
 */
public record LoopAnnotation(String item, String collection, String key, KeyKind keyKind, String indexVar) {

    /** Origin of a loop's per-item key. */
    public enum KeyKind {
        /** Key expression given in source, e.g. {@code key={i}}; renderers emit it verbatim. */
        EXPLICIT,
        /** Name of a field on the item, e.g. DSL {@code key="id"}; renderers qualify it with the item. */
        FIELD,
        /** No explicit key, but the item is known to carry an {@code id} field. */
        IDENTITY,
        /** No key information: renderers fall back to the positional index. */
        NONE
    }

    public LoopAnnotation {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
        if (key != null && !key.isEmpty()) {
            if (keyKind != KeyKind.FIELD) {
                keyKind = KeyKind.EXPLICIT;
            }
        } else {
            key = null;
            if (keyKind == null || keyKind == KeyKind.EXPLICIT || keyKind == KeyKind.FIELD) {
                keyKind = KeyKind.NONE;
            }
        }
    }

    /** A loop without key information. */
    public static LoopAnnotation of(String item, String collection) {
        return new LoopAnnotation(item, collection, null, KeyKind.NONE, null);
    }

    /** A loop keyed by {@code field} of each item. */
    public static LoopAnnotation keyedByField(String item, String collection, String field) {
        return new LoopAnnotation(item, collection, field, KeyKind.FIELD, null);
    }

    public LoopAnnotation withIndex(String index) {
        return new LoopAnnotation(item, collection, key, keyKind, index);
    }

    public LoopAnnotation withKeyKind(KeyKind kind) {
        return new LoopAnnotation(item, collection, key, kind, indexVar);
    }
}

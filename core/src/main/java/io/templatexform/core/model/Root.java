package io.templatexform.core.model;

import java.util.List;
import java.util.Objects;

/** Root of an annotated tree: the ordered top-level forest plus per-document metadata. */
public record Root(List<Node> children, Meta meta) {

    public Root {
        children = children != null ? List.copyOf(children) : List.of();
        Objects.requireNonNull(meta, "meta must not be null");
    }

    public static Root of(List<Node> children, Meta meta) {
        return new Root(children, meta);
    }

    /** An empty tree for a source that produced nothing to emit. */
    public static Root empty(String sourceFile) {
        return new Root(List.of(), Meta.empty(sourceFile));
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}

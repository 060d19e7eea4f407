package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Element;
import io.templatexform.core.model.Node;
import io.templatexform.core.parse.ast.Expression.JsxElement;
import java.util.List;
import java.util.Optional;

/**
 * Lowers one reserved markup tag, such as {@code <Loop>} or {@code <If>}, into an annotated
 * element.
 */
@FunctionalInterface
public interface DslHandler {

    /**
     * Lowers a reserved tag.
     *
     * @param node     the tag as parsed
     * @param children the tag's children, already lowered
     * @param context  per-document state and helpers
     * @return the annotated element, or empty to fall back to generic element lowering
     */
    Optional<Element> handle(JsxElement node, List<Node> children, DslContext context);
}

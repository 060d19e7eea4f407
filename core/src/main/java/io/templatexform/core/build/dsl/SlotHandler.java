package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.parse.ast.Expression.JsxElement;
import java.util.List;
import java.util.Optional;

/** {@code <Slot name="sidebar">default content</Slot>}; the name defaults to {@code default}. */
final class SlotHandler implements DslHandler {

    @Override
    public Optional<Element> handle(JsxElement node, List<Node> children, DslContext context) {
        String name = context.attribute(node, "name")
                .filter(value -> !value.isBlank())
                .orElse(SlotAnnotation.DEFAULT);
        return Optional.of(Element.annotated("div", children, Annotations.slot(new SlotAnnotation(name))));
    }
}

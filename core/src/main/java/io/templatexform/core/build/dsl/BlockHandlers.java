package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.Element;
import java.util.List;
import java.util.Optional;

/** {@code <DefineBlock name>} and {@code <Extends layout>}. */
final class BlockHandlers {

    private BlockHandlers() {}

    static DslHandler defineBlockHandler() {
        return (node, children, context) -> {
            Optional<String> name = context.attribute(node, "name").filter(value -> !value.isBlank());
            if (name.isEmpty()) {
                context.warn("DefineBlock requires 'name' prop");
                return Optional.of(Element.of("div", null, children));
            }
            return Optional.of(Element.annotated("div", children, Annotations.block(BlockAnnotation.of(name.get()))));
        };
    }

    static DslHandler extendsHandler() {
        return (node, children, context) -> {
            Optional<String> layout = context.attribute(node, "layout").filter(value -> !value.isBlank());
            if (layout.isEmpty()) {
                context.warn("Extends requires 'layout' prop");
                return Optional.of(Element.of("div"));
            }
            return Optional.of(
                    Element.annotated("div", List.of(), Annotations.block(BlockAnnotation.extending(layout.get()))));
        };
    }
}

package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.VariableAnnotation;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code <Var name="user.name" default="Guest" filter="uppercase" args="..." raw>} and
 * {@code <Raw>html</Raw>}. The variable name may also be given as the tag's only text child.
 */
final class VariableHandlers {

    private VariableHandlers() {}

    static DslHandler varHandler() {
        return (node, children, context) -> {
            Map<String, String> attrs = context.attributes(node);
            String name = attrs.containsKey("name") ? attrs.get("name") : DslContext.textContent(children);
            if (name == null || name.isBlank()) {
                context.warn("Var requires 'name' prop or text children");
                return Optional.of(Element.of("span"));
            }
            List<String> args = context.listAttribute(node, "args");
            boolean raw = "true".equals(attrs.get("raw"));
            context.addVariableRoot(name);
            VariableAnnotation variable =
                    new VariableAnnotation(name.trim(), attrs.get("default"), attrs.get("filter"), args, raw);
            return Optional.of(Element.annotated("span", List.of(), Annotations.variable(variable)));
        };
    }

    static DslHandler rawHandler() {
        return (node, children, context) -> {
            String name = context.attribute(node, "name").orElseGet(() -> DslContext.textContent(children));
            if (name == null || name.isBlank()) {
                context.warn("Raw requires 'name' prop or text children");
                return Optional.of(Element.of("span"));
            }
            context.addVariableRoot(name);
            VariableAnnotation variable = new VariableAnnotation(name.trim(), null, null, null, true);
            return Optional.of(Element.annotated("span", List.of(), Annotations.variable(variable)));
        };
    }
}

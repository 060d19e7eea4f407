package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import java.util.Optional;

/** {@code <If test>}, {@code <ElseIf test>} and {@code <Else>}. */
final class ConditionHandlers {

    private ConditionHandlers() {}

    static DslHandler ifHandler() {
        return (node, children, context) -> {
            Optional<String> test = context.attribute(node, "test");
            if (test.isEmpty() || test.get().isBlank()) {
                context.warn("If requires 'test' prop");
                return Optional.of(Element.of("div", null, children));
            }
            context.addVariableRoot(test.get());
            return Optional.of(
                    Element.annotated("div", children, Annotations.condition(ConditionAnnotation.of(test.get()))));
        };
    }

    static DslHandler elseIfHandler() {
        return (node, children, context) -> {
            Optional<String> test = context.attribute(node, "test");
            if (test.isEmpty() || test.get().isBlank()) {
                context.warn("ElseIf requires 'test' prop");
                return Optional.of(Element.of("div", null, children));
            }
            context.addVariableRoot(test.get());
            return Optional.of(Element.annotated(
                    "div", children, Annotations.condition(ConditionAnnotation.elseIf(test.get()))));
        };
    }

    static DslHandler elseHandler() {
        return (node, children, context) -> Optional.of(
                Element.annotated("div", children, Annotations.condition(ConditionAnnotation.elseBranch())));
    }
}

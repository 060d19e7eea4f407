package io.templatexform.core.model;

/**
 * Generator annotations of one element: at most one of each kind, plus independent flags.
 *
 * <p>Renderers apply them in a fixed order to the element's rendered inner content: condition,
 * loop, variable, include, slot, block, then the {@code unwrap} strip.
 *
 * @param unwrap    emit only the processed content, never the element's own tag
 * @param component the element is a pass-through component kept as literal markup
 * @param source    where the element came from, or {@code null}
 */
public record Annotations(
        LoopAnnotation loop,
        ConditionAnnotation condition,
        VariableAnnotation variable,
        SlotAnnotation slot,
        IncludeAnnotation include,
        BlockAnnotation block,
        boolean unwrap,
        boolean component,
        SourceLocation source) {

    public static final Annotations NONE = new Annotations(null, null, null, null, null, null, false, false, null);

    /** Returns {@code true} when no annotation kind and no flag is set. */
    public boolean isEmpty() {
        return loop == null
                && condition == null
                && variable == null
                && slot == null
                && include == null
                && block == null
                && !unwrap
                && !component
                && source == null;
    }

    public static Annotations loop(LoopAnnotation loop) {
        return NONE.withLoop(loop).withUnwrap(true);
    }

    public static Annotations condition(ConditionAnnotation condition) {
        return NONE.withCondition(condition).withUnwrap(true);
    }

    public static Annotations variable(VariableAnnotation variable) {
        return NONE.withVariable(variable).withUnwrap(true);
    }

    public static Annotations slot(SlotAnnotation slot) {
        return NONE.withSlot(slot).withUnwrap(true);
    }

    public static Annotations include(IncludeAnnotation include) {
        return NONE.withInclude(include);
    }

    public static Annotations block(BlockAnnotation block) {
        return NONE.withBlock(block).withUnwrap(true);
    }

    public Annotations withLoop(LoopAnnotation value) {
        return new Annotations(value, condition, variable, slot, include, block, unwrap, component, source);
    }

    public Annotations withCondition(ConditionAnnotation value) {
        return new Annotations(loop, value, variable, slot, include, block, unwrap, component, source);
    }

    public Annotations withVariable(VariableAnnotation value) {
        return new Annotations(loop, condition, value, slot, include, block, unwrap, component, source);
    }

    public Annotations withSlot(SlotAnnotation value) {
        return new Annotations(loop, condition, variable, value, include, block, unwrap, component, source);
    }

    public Annotations withInclude(IncludeAnnotation value) {
        return new Annotations(loop, condition, variable, slot, value, block, unwrap, component, source);
    }

    public Annotations withBlock(BlockAnnotation value) {
        return new Annotations(loop, condition, variable, slot, include, value, unwrap, component, source);
    }

    public Annotations withUnwrap(boolean value) {
        return new Annotations(loop, condition, variable, slot, include, block, value, component, source);
    }

    public Annotations withComponent(boolean value) {
        return new Annotations(loop, condition, variable, slot, include, block, unwrap, value, source);
    }

    public Annotations withSource(SourceLocation value) {
        return new Annotations(loop, condition, variable, slot, include, block, unwrap, component, value);
    }
}

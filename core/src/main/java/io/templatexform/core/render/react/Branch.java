package io.templatexform.core.render.react;

import io.templatexform.core.model.ConditionAnnotation;

/** A rendered else or else-if arm waiting for its owning condition to choose an output shape. */
record Branch(ConditionAnnotation condition, String content) {

    boolean isElseIf() {
        return condition.isElseIf();
    }
}

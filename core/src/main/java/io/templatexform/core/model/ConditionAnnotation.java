package io.templatexform.core.model;

/**
 * Marks an element as a conditional branch. A plain condition owns the branch chain; else and
 * else-if branches follow it, either as trailing children or as immediately following siblings.
 *
 * @param expression condition source text; empty for an else branch
 */
public record ConditionAnnotation(String expression, boolean isElse, boolean isElseIf) {

    public ConditionAnnotation {
        expression = expression != null ? expression : "";
        if (isElse && isElseIf) {
            throw new IllegalArgumentException("A branch cannot be both else and else-if");
        }
    }

    public static ConditionAnnotation of(String expression) {
        return new ConditionAnnotation(expression, false, false);
    }

    public static ConditionAnnotation elseBranch() {
        return new ConditionAnnotation("", true, false);
    }

    public static ConditionAnnotation elseIf(String expression) {
        return new ConditionAnnotation(expression, false, true);
    }

    /** Returns {@code true} for else and else-if branches. */
    public boolean isBranch() {
        return isElse || isElseIf;
    }
}

package io.templatexform.core.model;

import java.util.List;

/**
 * Outcome of validating rendered output. Validation never throws; callers decide whether to
 * write an invalid file anyway.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationResult ok() {
        return OK;
    }

    /** Builds a result from collected errors: valid when the list is empty. */
    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? OK : new ValidationResult(false, errors);
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[VALID]" : "ValidationResult[INVALID, errors=" + errors + "]";
    }
}

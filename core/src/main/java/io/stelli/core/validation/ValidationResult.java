package io.stelli.core.validation;

import java.util.List;

/**
 * Outcome of validating a candidate entry: every failed rule, in rule order. Valid iff empty.
 *
 * @param failures failed rules, never {@code null}
 */
public record ValidationResult(List<ValidationFailure> failures) {

    private static final ValidationResult OK = new ValidationResult(List.of());

    public ValidationResult {
        failures = List.copyOf(failures);
    }

    /** A result with no failures. */
    public static ValidationResult ok() {
        return OK;
    }

    public boolean valid() {
        return failures.isEmpty();
    }

    /** Failures reported for one field. */
    public List<ValidationFailure> failuresFor(String fieldId) {
        return failures.stream().filter(f -> f.fieldId().equals(fieldId)).toList();
    }

    /** Whether a specific rule failed for a specific field. */
    public boolean has(String fieldId, FailureReason reason) {
        return failures.contains(new ValidationFailure(fieldId, reason));
    }

    @Override
    public String toString() {
        return valid() ? "ValidationResult[VALID]" : "ValidationResult[INVALID, failures=" + failures + "]";
    }
}

package io.stelli.core.validation;

import java.util.Objects;

/**
 * One failed rule.
 *
 * @param fieldId the field the failure belongs to; {@code "1"} for the name, {@link #RATING} for
 *                the rating
 * @param reason  which rule failed
 */
public record ValidationFailure(String fieldId, FailureReason reason) {

    /** Pseudo field id under which rating failures are reported. */
    public static final String RATING = "rating";

    public ValidationFailure {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String toString() {
        return fieldId + ":" + reason.code();
    }
}

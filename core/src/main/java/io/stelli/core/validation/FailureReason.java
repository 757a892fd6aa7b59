package io.stelli.core.validation;

/** Machine-readable reason a candidate entry failed validation. */
public enum FailureReason {
    /** The resolved name is empty after trimming. */
    EMPTY_NAME("empty-name"),
    /** The list is rated but no rating (or the unset sentinel 0) was given. */
    RATING_REQUIRED("rating-required"),
    /** The rating lies outside the list's rating domain. */
    RATING_OUT_OF_RANGE("rating-out-of-range"),
    /** The rating has more decimal digits than the configured precision allows. */
    RATING_PRECISION("rating-precision"),
    /** A required field has no value, or only whitespace. */
    REQUIRED_FIELD_EMPTY("required-field-empty"),
    /** A required multi-select field has no selection. */
    EMPTY_MULTISELECT("empty-multiselect"),
    /** A required yes-no field is unanswered. */
    UNANSWERED_YES_NO("unanswered-yes-no");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    /** Stable code for callers that map reasons to UI text. */
    public String code() {
        return code;
    }
}

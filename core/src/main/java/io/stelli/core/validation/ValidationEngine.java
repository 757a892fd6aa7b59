package io.stelli.core.validation;

import io.stelli.core.error.FieldValueShapeException;
import io.stelli.core.model.EntryCandidate;
import io.stelli.core.model.FieldDefinition;
import io.stelli.core.model.FieldValues;
import io.stelli.core.model.RatingDomain;
import io.stelli.core.model.UserList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a candidate entry against its list's schema before it is created or updated.
 *
 * <p>Rules run in a fixed order and none short-circuits, so the result lists every failure:
 *
 * <ol>
 *   <li>the resolved name is non-empty after trimming, whatever the schema says;
 *   <li>a rated list requires a rating, where {@code 0} counts as unset;
 *   <li>a given rating lies in the list's rating domain and has the configured precision;
 *   <li>each required custom field has a value: yes-no answered (either way), multi-select with at
 *       least one selection, any other type non-blank as text.
 * </ol>
 *
 * <p>Stateless and thread-safe. Malformed input (no value mapping, a multi-select value that is
 * not a collection, a yes-no value that is not a boolean) is a caller error and raises
 * {@link FieldValueShapeException} instead of a failure.
 */
public final class ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    private final ValidationOptions options;

    /** Creates an engine with {@link ValidationOptions#DEFAULT}. */
    public ValidationEngine() {
        this(ValidationOptions.DEFAULT);
    }

    public ValidationEngine(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public ValidationOptions options() {
        return options;
    }

    /**
     * Validates a candidate entry.
     *
     * @param list      the list the entry belongs to
     * @param candidate proposed rating and field values
     * @return every failed rule; valid iff empty
     * @throws FieldValueShapeException if the candidate's values are malformed
     */
    public ValidationResult validate(UserList list, EntryCandidate candidate) {
        Objects.requireNonNull(list, "list must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        Map<String, Object> values = candidate.fieldValues();
        if (values == null) {
            throw new FieldValueShapeException("fieldValues must be a mapping of field id to value, got null",
                    list.id(), null);
        }
        checkShapes(list, values);

        List<ValidationFailure> failures = new ArrayList<>();
        checkName(values, failures);
        checkRating(list, candidate.rating(), failures);
        checkRequiredFields(list, values, failures);

        if (LOG.isDebugEnabled()) {
            LOG.debug("validation.completed list_id={} valid={} failures={}", list.id(), failures.isEmpty(), failures);
        }
        return failures.isEmpty() ? ValidationResult.ok() : new ValidationResult(failures);
    }

    private void checkName(Map<String, Object> values, List<ValidationFailure> failures) {
        if (FieldValues.resolveName(values).trim().isEmpty()) {
            failures.add(new ValidationFailure(FieldDefinition.NAME_FIELD_ID, FailureReason.EMPTY_NAME));
        }
    }

    private void checkRating(UserList list, Double rating, List<ValidationFailure> failures) {
        // 0 is the "unset" sentinel: it fails requiredness and is not range-checked.
        boolean present = rating != null && rating != 0;
        if (list.isRated() && !present) {
            failures.add(new ValidationFailure(ValidationFailure.RATING, FailureReason.RATING_REQUIRED));
        }
        if (!present) {
            return;
        }
        Optional<RatingDomain> domain = options.domainFor(list);
        if (domain.isEmpty()) {
            return;
        }
        if (!domain.get().contains(rating)) {
            failures.add(new ValidationFailure(ValidationFailure.RATING, FailureReason.RATING_OUT_OF_RANGE));
        }
        if (!options.precisionFor(list.ratingType()).admits(rating)) {
            failures.add(new ValidationFailure(ValidationFailure.RATING, FailureReason.RATING_PRECISION));
        }
    }

    private void checkRequiredFields(UserList list, Map<String, Object> values, List<ValidationFailure> failures) {
        for (FieldDefinition field : list.customFields()) {
            if (!field.required()) {
                continue;
            }
            Object value = values.get(field.id());
            FailureReason reason = switch (field.type()) {
                case YES_NO -> value == null ? FailureReason.UNANSWERED_YES_NO : null;
                case MULTI_SELECT -> value == null || ((Collection<?>) value).isEmpty()
                        ? FailureReason.EMPTY_MULTISELECT
                        : null;
                case TEXT, NUMBER, DATE, DROPDOWN, RATING, PHOTOS -> isBlank(value)
                        ? FailureReason.REQUIRED_FIELD_EMPTY
                        : null;
            };
            if (reason != null) {
                failures.add(new ValidationFailure(field.id(), reason));
            }
        }
    }

    private void checkShapes(UserList list, Map<String, Object> values) {
        for (FieldDefinition field : list.customFields()) {
            Object value = values.get(field.id());
            if (value == null) {
                continue;
            }
            switch (field.type()) {
                case MULTI_SELECT -> {
                    if (!(value instanceof Collection)) {
                        throw new FieldValueShapeException(
                                "Multi-select field '" + field.id() + "' must hold a list, got "
                                        + value.getClass().getSimpleName(),
                                list.id(),
                                field.id());
                    }
                }
                case YES_NO -> {
                    if (!(value instanceof Boolean)) {
                        throw new FieldValueShapeException(
                                "Yes-no field '" + field.id() + "' must hold a boolean, got "
                                        + value.getClass().getSimpleName(),
                                list.id(),
                                field.id());
                    }
                }
                case TEXT, NUMBER, DATE, DROPDOWN, RATING, PHOTOS -> {
                    // free-form; requiredness is checked as text
                }
            }
        }
        List<String> unknown = values.keySet().stream()
                .filter(key -> !FieldValues.isNameKey(key) && list.field(key).isEmpty())
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            LOG.warn("validation.unknown_fields list_id={} keys={}", list.id(), unknown);
        }
    }

    /** Blank as text; collections read as their comma-joined elements, so an empty list is blank. */
    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).collect(Collectors.joining(",")).trim().isEmpty();
        }
        return String.valueOf(value).trim().isEmpty();
    }
}

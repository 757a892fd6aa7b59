package io.stelli.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A user-defined list: its rating scheme and the ordered schema its entries must satisfy.
 *
 * <p>Immutable. Field definitions are stored sorted by {@code order}; construction enforces
 * {@link ListInvariants}.
 *
 * @param id               list id
 * @param ratingType       how entries are rated
 * @param ratingConfig     rating maximum and step, or {@code null} for the type's defaults
 * @param fieldDefinitions the schema, Name field first
 */
public record UserList(String id, RatingType ratingType, RatingConfig ratingConfig, List<FieldDefinition> fieldDefinitions) {

    public UserList {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ratingType, "ratingType must not be null");
        Objects.requireNonNull(fieldDefinitions, "fieldDefinitions must not be null");
        List<FieldDefinition> sorted = new ArrayList<>(fieldDefinitions);
        sorted.sort(Comparator.comparingInt(FieldDefinition::order));
        ListInvariants.requireValidRating(id, ratingType, ratingConfig, null);
        ListInvariants.requireValid(id, sorted, null);
        fieldDefinitions = List.copyOf(sorted);
    }

    /** Looks up a field definition by id. */
    public Optional<FieldDefinition> field(String fieldId) {
        return fieldDefinitions.stream().filter(f -> f.id().equals(fieldId)).findFirst();
    }

    /** All field definitions except the Name field, in order. */
    public List<FieldDefinition> customFields() {
        return fieldDefinitions.stream().filter(f -> !f.isNameField()).toList();
    }

    /** Whether entries of this list carry a rating. */
    public boolean isRated() {
        return ratingType != RatingType.NONE;
    }

    /**
     * Returns a new {@link Builder} for a list with the given id.
     *
     * @param id the list id
     * @return a builder pre-populated with the Name field
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Builder for {@link UserList}. Starts with the Name field and no rating. */
    public static final class Builder {

        private final String id;
        private RatingType ratingType = RatingType.NONE;
        private RatingConfig ratingConfig;
        private final List<FieldDefinition> fields = new ArrayList<>();

        Builder(String id) {
            this.id = id;
            fields.add(FieldDefinition.nameField());
        }

        public Builder ratingType(RatingType ratingType) {
            this.ratingType = ratingType;
            return this;
        }

        public Builder ratingConfig(RatingConfig ratingConfig) {
            this.ratingConfig = ratingConfig;
            return this;
        }

        /** Adds a custom field; the reserved Name field is already present. */
        public Builder field(FieldDefinition field) {
            fields.add(field);
            return this;
        }

        public UserList build() {
            return new UserList(id, ratingType, ratingConfig, fields);
        }
    }
}

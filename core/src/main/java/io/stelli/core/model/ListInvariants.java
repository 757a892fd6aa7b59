package io.stelli.core.model;

import io.stelli.core.error.SchemaInvariantException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks every list schema must pass. Called by {@link UserList}'s constructor and,
 * earlier and with the source document attached, by the list parser.
 */
public final class ListInvariants {

    private ListInvariants() {}

    /**
     * Verifies the field definitions of a list.
     *
     * @param listId the list id, for error context
     * @param fields the field definitions
     * @param source the document the list came from, or {@code null}
     * @throws SchemaInvariantException if the Name field is missing or malformed, a field id or
     *                                  order value repeats, or options appear on a non-choice field
     */
    public static void requireValid(String listId, List<FieldDefinition> fields, String source) {
        FieldDefinition nameField = null;
        Set<String> ids = new HashSet<>();
        Set<Integer> orders = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (!ids.add(field.id())) {
                throw new SchemaInvariantException("Duplicate field id: '" + field.id() + "'", listId, source);
            }
            if (!orders.add(field.order())) {
                throw new SchemaInvariantException(
                        "Duplicate field order " + field.order() + " on field '" + field.id() + "'", listId, source);
            }
            if (!field.options().isEmpty() && !field.type().hasOptions()) {
                throw new SchemaInvariantException(
                        "Field '" + field.id() + "' of type " + field.type().wireName() + " must not declare options",
                        listId,
                        source);
            }
            if (field.isNameField()) {
                nameField = field;
            }
        }
        if (nameField == null) {
            throw new SchemaInvariantException("List is missing the reserved Name field (id '1')", listId, source);
        }
        if (nameField.type() != FieldType.TEXT || !nameField.required() || nameField.order() != 0) {
            throw new SchemaInvariantException(
                    "Name field must be a required text field at order 0, got type="
                            + nameField.type().wireName() + " required=" + nameField.required()
                            + " order=" + nameField.order(),
                    listId,
                    source);
        }
    }

    /**
     * Verifies the rating scheme of a list. Points and scale ratings start at 1, so a configured
     * maximum below 1 leaves no valid rating.
     *
     * @param listId       the list id, for error context
     * @param ratingType   the rating type
     * @param ratingConfig the rating configuration, or {@code null}
     * @param source       the document the list came from, or {@code null}
     * @throws SchemaInvariantException if a points or scale maximum is below 1
     */
    public static void requireValidRating(
            String listId, RatingType ratingType, RatingConfig ratingConfig, String source) {
        if (ratingConfig == null) {
            return;
        }
        if ((ratingType == RatingType.POINTS || ratingType == RatingType.SCALE) && ratingConfig.max() < 1) {
            throw new SchemaInvariantException(
                    "rating_config.max of a " + ratingType.wireName() + " list must be at least 1, got: "
                            + ratingConfig.max(),
                    listId,
                    source);
        }
    }
}

package io.stelli.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One field of a list's schema.
 *
 * @param id           stable field id; {@code "1"} is reserved for the Name field
 * @param name         display name
 * @param type         field type, drives value shape and validation
 * @param required     whether an entry must supply a value
 * @param order        position in rendering and validation order, unique within a list
 * @param options      choices for dropdown and multi-select fields, empty otherwise
 * @param ratingConfig configuration for rating fields, or {@code null}
 */
public record FieldDefinition(
        String id,
        String name,
        FieldType type,
        boolean required,
        int order,
        List<String> options,
        RatingConfig ratingConfig) {

    /** Id of the reserved Name field. */
    public static final String NAME_FIELD_ID = "1";

    /** Alternative value key under which some entries store the name. */
    public static final String NAME_ALIAS_KEY = "name";

    public FieldDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        options = options == null ? List.of() : List.copyOf(options);
    }

    /** Creates a field without options or rating configuration. */
    public static FieldDefinition of(String id, String name, FieldType type, boolean required, int order) {
        return new FieldDefinition(id, name, type, required, order, List.of(), null);
    }

    /** Creates a dropdown or multi-select field with the given options. */
    public static FieldDefinition choice(
            String id, String name, FieldType type, boolean required, int order, List<String> options) {
        return new FieldDefinition(id, name, type, required, order, options, null);
    }

    /** The reserved Name field every list carries. */
    public static FieldDefinition nameField() {
        return of(NAME_FIELD_ID, "Name", FieldType.TEXT, true, 0);
    }

    /** Whether this is the reserved Name field. */
    public boolean isNameField() {
        return NAME_FIELD_ID.equals(id);
    }
}

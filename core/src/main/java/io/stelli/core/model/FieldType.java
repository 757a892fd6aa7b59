package io.stelli.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of custom field types. Code that branches on a field type uses an exhaustive
 * {@code switch} expression so that a new constant is a compile error at every branch point.
 */
public enum FieldType {
    TEXT("text"),
    NUMBER("number"),
    DATE("date"),
    DROPDOWN("dropdown"),
    MULTI_SELECT("multi-select"),
    YES_NO("yes-no"),
    RATING("rating"),
    PHOTOS("photos");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    /** The name used in list documents, e.g. {@code "multi-select"}. */
    public String wireName() {
        return wireName;
    }

    /** Whether fields of this type carry an {@code options} list. */
    public boolean hasOptions() {
        return this == DROPDOWN || this == MULTI_SELECT;
    }

    /** Looks up a field type by its document name. */
    public static Optional<FieldType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}

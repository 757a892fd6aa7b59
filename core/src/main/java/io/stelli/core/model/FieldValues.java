package io.stelli.core.model;

import java.util.Map;

/** Helpers for reading an entry's field value mapping. */
public final class FieldValues {

    private FieldValues() {}

    /**
     * Resolves the display name from a value mapping. The name lives under {@code "1"} or, in
     * older entries, under {@code "name"}; both keys denote the same value. {@code "1"} wins when it
     * holds a non-blank value.
     *
     * @param values the field values, may be {@code null}
     * @return the name, or an empty string if neither key holds one
     */
    public static String resolveName(Map<String, ?> values) {
        if (values == null) {
            return "";
        }
        String primary = asText(values.get(FieldDefinition.NAME_FIELD_ID));
        if (!primary.isBlank()) {
            return primary;
        }
        String alias = asText(values.get(FieldDefinition.NAME_ALIAS_KEY));
        return alias.isBlank() ? primary : alias;
    }

    /** Whether {@code key} addresses the Name field under either of its keys. */
    public static boolean isNameKey(String key) {
        return FieldDefinition.NAME_FIELD_ID.equals(key) || FieldDefinition.NAME_ALIAS_KEY.equals(key);
    }

    private static String asText(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}

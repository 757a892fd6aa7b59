package io.stelli.core.error;

/** Thrown when a field definition names a type outside the closed set of field types. */
public final class UnknownFieldTypeException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    private final String fieldType;

    public UnknownFieldTypeException(String fieldType, String listId, String source) {
        super("Unknown field type: '" + fieldType + "'", listId, source);
        this.fieldType = fieldType;
    }

    /** The offending type string as it appeared in the document. */
    public String fieldType() {
        return fieldType;
    }
}

package io.stelli.core.error;

/** Thrown when a list definition does not conform to the bundled JSON Schema. */
public final class SchemaValidationException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaValidationException(String message, String listId, String source) {
        super(message, listId, source);
    }

    public SchemaValidationException(String message, Throwable cause, String listId, String source) {
        super(message, cause, listId, source);
    }
}

package io.stelli.core.error;

/** Thrown when a list definition document cannot be read, is missing a required key or contains unknown keys. */
public final class ListParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public ListParseException(String message, String listId, String source) {
        super(message, listId, source);
    }

    public ListParseException(String message, Throwable cause, String listId, String source) {
        super(message, cause, listId, source);
    }
}

package io.stelli.core.error;

/** Thrown when a list definition parses but breaks a structural invariant (Name field, unique order, unique ids, options on non-choice fields). */
public final class SchemaInvariantException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaInvariantException(String message, String listId, String source) {
        super(message, listId, source);
    }

    public SchemaInvariantException(String message, Throwable cause, String listId, String source) {
        super(message, cause, listId, source);
    }
}

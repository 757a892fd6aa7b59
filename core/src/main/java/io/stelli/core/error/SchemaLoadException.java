package io.stelli.core.error;

/**
 * Abstract parent for errors raised while loading a list definition. Carries an additional
 * {@code source} field identifying the file or resource that caused the error.
 */
public abstract class SchemaLoadException extends StelliException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String listId, String source) {
        super(message, listId, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String listId, String source) {
        super(message, cause, listId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

package io.stelli.core.error;

/**
 * Thrown when a field value does not have the runtime shape its field type requires, for example
 * a scalar where a multi-select list is expected or a string standing in for a yes-no answer.
 */
public final class FieldValueShapeException extends ContractViolationException {

    private static final long serialVersionUID = 1L;

    private final String fieldId;

    public FieldValueShapeException(String message, String listId, String fieldId) {
        super(message, listId);
        this.fieldId = fieldId;
    }

    public FieldValueShapeException(String message, Throwable cause, String listId, String fieldId) {
        super(message, cause, listId);
        this.fieldId = fieldId;
    }

    /** The field whose value was malformed, or {@code null} for the whole value mapping. */
    public String fieldId() {
        return fieldId;
    }
}

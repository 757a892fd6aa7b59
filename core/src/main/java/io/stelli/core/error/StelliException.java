package io.stelli.core.error;

/**
 * Abstract base for all stelli-engine exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SchemaLoadException} or {@link ContractViolationException}.
 *
 * <p>These exceptions signal programming or configuration errors. Invalid user input is never
 * reported by exception; it comes back as a {@code ValidationResult}.
 */
public abstract class StelliException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String listId;
    private final Phase phase;

    protected StelliException(String message, String listId, Phase phase) {
        super(message);
        this.listId = listId;
        this.phase = phase;
    }

    protected StelliException(String message, Throwable cause, String listId, Phase phase) {
        super(message, cause);
        this.listId = listId;
        this.phase = phase;
    }

    /** The list that triggered the error, or {@code null} if not known. */
    public String listId() {
        return listId;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

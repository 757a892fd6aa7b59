package io.stelli.core.error;

/**
 * Thrown when a criteria pool operation would break pool membership: an id in both pools, a
 * duplicated id, an unknown id, or a reorder whose id set differs from the active set.
 */
public final class CriteriaStateException extends ContractViolationException {

    private static final long serialVersionUID = 1L;

    public CriteriaStateException(String message) {
        super(message, null);
    }
}

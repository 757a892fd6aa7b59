package io.stelli.core.error;

/**
 * Abstract parent for caller errors detected while the engine evaluates: inputs that break a
 * documented contract and must not be coerced. Distinct from validation failures, which are
 * expected and returned as data.
 */
public abstract class ContractViolationException extends StelliException {

    private static final long serialVersionUID = 1L;

    protected ContractViolationException(String message, String listId) {
        super(message, listId, Phase.EVALUATION);
    }

    protected ContractViolationException(String message, Throwable cause, String listId) {
        super(message, cause, listId, Phase.EVALUATION);
    }
}

package io.stelli.core.engine;

import io.stelli.core.model.Entry;
import io.stelli.core.validation.ValidationResult;
import java.util.Objects;

/**
 * Result of a gated entry write. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#ACCEPTED}: the candidate was valid and stored; {@code entry} holds the stored
 *       entry.
 *   <li>{@link Type#REJECTED}: the candidate failed validation and nothing was stored;
 *       {@code validation} lists the failures.
 * </ul>
 */
public final class WriteOutcome {

    /** The type of write outcome. */
    public enum Type {
        ACCEPTED,
        REJECTED
    }

    private final Type type;
    private final Entry entry;
    private final ValidationResult validation;

    private WriteOutcome(Type type, Entry entry, ValidationResult validation) {
        this.type = type;
        this.entry = entry;
        this.validation = validation;
    }

    public static WriteOutcome accepted(Entry stored) {
        Objects.requireNonNull(stored, "stored entry must not be null for ACCEPTED");
        return new WriteOutcome(Type.ACCEPTED, stored, ValidationResult.ok());
    }

    public static WriteOutcome rejected(ValidationResult validation) {
        Objects.requireNonNull(validation, "validation must not be null for REJECTED");
        if (validation.valid()) {
            throw new IllegalArgumentException("a REJECTED outcome needs at least one failure");
        }
        return new WriteOutcome(Type.REJECTED, null, validation);
    }

    public Type type() {
        return type;
    }

    /** The stored entry. Only set when {@code type() == ACCEPTED}. */
    public Entry entry() {
        return entry;
    }

    /** The validation result; empty for accepted writes. */
    public ValidationResult validation() {
        return validation;
    }

    public boolean isAccepted() {
        return type == Type.ACCEPTED;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    @Override
    public String toString() {
        return switch (type) {
            case ACCEPTED -> "WriteOutcome[ACCEPTED, entry=" + entry.id() + "]";
            case REJECTED -> "WriteOutcome[REJECTED, failures=" + validation.failures() + "]";
        };
    }
}

package io.stelli.core.engine;

import io.stelli.core.model.Entry;
import io.stelli.core.model.EntryCandidate;
import io.stelli.core.model.UserList;
import io.stelli.core.spi.EntryStore;
import io.stelli.core.validation.ValidationEngine;
import io.stelli.core.validation.ValidationResult;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates entry writes before they reach the {@link EntryStore}. Invalid candidates are
 * rejected with their failures and never stored. Errors raised by the store propagate unchanged.
 */
public final class EntryWriteGate {

    private static final Logger LOG = LoggerFactory.getLogger(EntryWriteGate.class);

    private final ValidationEngine validationEngine;
    private final EntryStore store;

    public EntryWriteGate(ValidationEngine validationEngine, EntryStore store) {
        this.validationEngine = Objects.requireNonNull(validationEngine, "validationEngine must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /** Validates and stores a new entry of {@code list}. */
    public WriteOutcome create(UserList list, EntryCandidate candidate) {
        ValidationResult result = validationEngine.validate(list, candidate);
        if (!result.valid()) {
            LOG.info("entry.create.rejected list_id={} failures={}", list.id(), result.failures());
            return WriteOutcome.rejected(result);
        }
        Entry stored = store.create(list.id(), candidate);
        LOG.debug("entry.create.accepted list_id={} entry_id={}", list.id(), stored.id());
        return WriteOutcome.accepted(stored);
    }

    /** Validates and stores new values for an existing entry of {@code list}. */
    public WriteOutcome update(UserList list, String entryId, EntryCandidate candidate) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        ValidationResult result = validationEngine.validate(list, candidate);
        if (!result.valid()) {
            LOG.info("entry.update.rejected list_id={} entry_id={} failures={}", list.id(), entryId, result.failures());
            return WriteOutcome.rejected(result);
        }
        Entry stored = store.update(entryId, candidate);
        LOG.debug("entry.update.accepted list_id={} entry_id={}", list.id(), entryId);
        return WriteOutcome.accepted(stored);
    }

    /** Deletes an entry. Deletion needs no validation. */
    public void delete(String entryId) {
        store.delete(entryId);
        LOG.debug("entry.delete entry_id={}", entryId);
    }
}

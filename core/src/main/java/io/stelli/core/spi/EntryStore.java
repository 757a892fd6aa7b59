package io.stelli.core.spi;

import io.stelli.core.model.Entry;
import io.stelli.core.model.EntryCandidate;

/**
 * Persists entry mutations. Only reached through {@code EntryWriteGate}, which guarantees that
 * every candidate passed to {@link #create} or {@link #update} has been validated.
 */
public interface EntryStore {

    /** Stores a new entry and returns it with its assigned id and timestamps. */
    Entry create(String listId, EntryCandidate candidate);

    /** Replaces the rating and values of an existing entry and returns the stored result. */
    Entry update(String entryId, EntryCandidate candidate);

    /** Removes an entry. */
    void delete(String entryId);
}

package io.stelli.core.spi;

import io.stelli.core.model.Entry;
import io.stelli.core.model.UserList;
import java.util.List;

/**
 * Supplies lists and their entries to the engine. Implementations front the persistence layer;
 * the engine only consumes what they return and never retries.
 */
public interface ListSource {

    /**
     * Loads a list definition.
     *
     * @param listId the list id
     * @return the list
     */
    UserList fetchList(String listId);

    /**
     * Loads the entries of a list, already migrated to the list's current schema.
     *
     * @param listId the list id
     * @return the entries, in storage order
     */
    List<Entry> fetchEntries(String listId);
}

package io.stelli.core.model;

import java.util.Map;

/**
 * The user-editable part of an entry, as submitted for validation before create or update.
 *
 * @param rating      proposed rating, or {@code null}
 * @param fieldValues proposed values keyed by field id
 */
public record EntryCandidate(Double rating, Map<String, Object> fieldValues) {

    /** The candidate corresponding to an existing entry. */
    public static EntryCandidate of(Entry entry) {
        return new EntryCandidate(entry.rating(), entry.fieldValues());
    }
}

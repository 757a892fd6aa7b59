package io.stelli.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a list.
 *
 * <p>Immutable. The value mapping is copied on construction; it may contain {@code null} values
 * for fields that are unanswered.
 *
 * @param id          entry id
 * @param listId      owning list
 * @param rating      rating, or {@code null} when unrated
 * @param fieldValues values keyed by field id; the shape of each value follows its field type
 * @param createdAt   creation instant
 * @param updatedAt   last modification instant
 */
public record Entry(
        String id, String listId, Double rating, Map<String, Object> fieldValues, Instant createdAt, Instant updatedAt) {

    public Entry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        fieldValues = fieldValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldValues));
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /** The display name, resolved from {@code "1"} or its {@code "name"} synonym. */
    public String displayName() {
        return FieldValues.resolveName(fieldValues);
    }

    /** Whether the entry carries a rating. */
    public boolean isRated() {
        return rating != null;
    }

    /** Returns a copy of this entry with different field values and update instant. */
    public Entry withFieldValues(Map<String, Object> newValues, Instant updated) {
        return new Entry(id, listId, rating, newValues, createdAt, updated);
    }
}

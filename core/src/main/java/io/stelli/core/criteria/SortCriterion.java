package io.stelli.core.criteria;

import java.util.Objects;

/**
 * A sort key with a direction.
 *
 * @param id        pool identity
 * @param key       attribute to order by
 * @param label     display label
 * @param icon      icon name
 * @param direction ascending or descending
 */
public record SortCriterion(String id, SortKey key, String label, String icon, SortDirection direction)
        implements Criterion {

    public SortCriterion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    /** Returns a copy with the opposite direction. */
    public SortCriterion toggled() {
        return new SortCriterion(id, key, label, icon, direction.flip());
    }
}

package io.stelli.core.criteria;

import java.util.Objects;

/**
 * Filters entries by creation date.
 *
 * @param id    pool identity
 * @param label display label
 * @param icon  icon name
 * @param range bounds, or {@code null} before the filter is configured (passes everything)
 */
public record DateFilterCriterion(String id, String label, String icon, DateRange range) implements FilterCriterion {

    public DateFilterCriterion {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public FilterType type() {
        return FilterType.DATE;
    }

    public DateFilterCriterion withRange(DateRange newRange) {
        return new DateFilterCriterion(id, label, icon, newRange);
    }
}

package io.stelli.core.criteria;

import java.util.Objects;

/**
 * Filters entries by rating.
 *
 * @param id    pool identity
 * @param label display label
 * @param icon  icon name
 * @param mode  comparison mode
 * @param range bounds, or {@code null} before the filter is configured
 */
public record RatingFilterCriterion(String id, String label, String icon, RatingFilterMode mode, RatingRange range)
        implements FilterCriterion {

    public RatingFilterCriterion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
    }

    @Override
    public FilterType type() {
        return FilterType.RATING;
    }

    public RatingFilterCriterion withMode(RatingFilterMode newMode) {
        return new RatingFilterCriterion(id, label, icon, newMode, range);
    }

    public RatingFilterCriterion withRange(RatingRange newRange) {
        return new RatingFilterCriterion(id, label, icon, mode, newRange);
    }
}

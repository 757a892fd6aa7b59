package io.stelli.core.model;

import java.util.Optional;

/**
 * The valid numeric range and step of a list's rating. Lists rated {@link RatingType#NONE} have
 * no domain.
 *
 * @param min  smallest valid rating, inclusive
 * @param max  largest valid rating, inclusive
 * @param step distance between adjacent valid ratings
 */
public record RatingDomain(double min, double max, double step) {

    public static final double STARS_MAX = 5;
    public static final double STARS_STEP = 0.5;
    public static final double DEFAULT_POINTS_MAX = 100;
    public static final double DEFAULT_SCALE_MAX = 10;

    public RatingDomain {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " exceeds max " + max);
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
    }

    /**
     * Derives the rating domain of a list.
     *
     * @param list               the list
     * @param starsMinimum       lower bound for star ratings (0.5 or 1 depending on policy)
     * @param scaleMaxFromConfig whether a scale list honours {@code ratingConfig.max}; when false the
     *                           scale is fixed at 1..10
     * @return the domain, or empty when the list is not rated
     */
    public static Optional<RatingDomain> forList(UserList list, double starsMinimum, boolean scaleMaxFromConfig) {
        RatingConfig config = list.ratingConfig();
        return switch (list.ratingType()) {
            case STARS -> Optional.of(new RatingDomain(
                    starsMinimum, STARS_MAX, config != null ? config.step() : STARS_STEP));
            case POINTS -> Optional.of(new RatingDomain(1, config != null ? config.max() : DEFAULT_POINTS_MAX, 1));
            case SCALE -> Optional.of(new RatingDomain(
                    1, scaleMaxFromConfig && config != null ? config.max() : DEFAULT_SCALE_MAX, 1));
            case NONE -> Optional.empty();
        };
    }

    /** Whether {@code value} lies within {@code [min, max]}. */
    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /** Clamps {@code value} into {@code [min, max]}. */
    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }
}

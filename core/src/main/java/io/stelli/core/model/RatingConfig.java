package io.stelli.core.model;

/**
 * Numeric configuration of a rating: the maximum value and the step between selectable values.
 *
 * @param max  upper bound of the rating, positive
 * @param step increment between values, positive
 */
public record RatingConfig(double max, double step) {

    public RatingConfig {
        if (!(max > 0)) {
            throw new IllegalArgumentException("max must be positive, got: " + max);
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
    }
}

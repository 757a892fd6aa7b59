package io.stelli.core.criteria;

/**
 * Inclusive rating bounds of a rating filter. Not ordered by construction: in
 * {@link RatingFilterMode#ABOVE} and {@link RatingFilterMode#BELOW} only one bound is meaningful.
 */
public record RatingRange(double min, double max) {

    /** Returns a copy with {@code bound} set to {@code value}. */
    public RatingRange with(RangeBound bound, double value) {
        return bound == RangeBound.MIN ? new RatingRange(value, max) : new RatingRange(min, value);
    }
}

package io.stelli.core.criteria;

/**
 * How a rating filter compares an entry's rating to its range.
 *
 * <ul>
 *   <li>{@link #ABOVE}: rated and strictly greater than {@code range.min}.
 *   <li>{@link #BELOW}: rated and strictly less than {@code range.max}.
 *   <li>{@link #BETWEEN}: rated and within {@code [range.min, range.max]}.
 *   <li>{@link #UNRATED}: not rated; the range is ignored.
 * </ul>
 */
public enum RatingFilterMode {
    ABOVE,
    BELOW,
    BETWEEN,
    UNRATED
}

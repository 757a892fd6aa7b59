package io.stelli.core.validation;

import io.stelli.core.model.RatingDomain;
import io.stelli.core.model.RatingType;
import io.stelli.core.model.UserList;
import java.util.Objects;
import java.util.Optional;

/**
 * Rating policy knobs. Entry screens have historically disagreed on the lower bound of star
 * ratings, on decimal precision, and on whether a scale honours its configured maximum; each of
 * those choices is a parameter here.
 *
 * <p>Immutable and thread-safe.
 *
 * @param starsMinimum       lowest valid star rating, in {@code (0, 5]}
 * @param starsPrecision     precision of star ratings
 * @param pointsPrecision    precision of point ratings
 * @param scalePrecision     precision of scale ratings
 * @param scaleMaxFromConfig whether scale lists use {@code ratingConfig.max} instead of a fixed 10
 */
public record ValidationOptions(
        double starsMinimum,
        RatingPrecision starsPrecision,
        RatingPrecision pointsPrecision,
        RatingPrecision scalePrecision,
        boolean scaleMaxFromConfig) {

    /** Half-star minimum, free star precision, whole points and scale, configured scale maximum. */
    public static final ValidationOptions DEFAULT =
            new ValidationOptions(0.5, RatingPrecision.ANY, RatingPrecision.INTEGER, RatingPrecision.INTEGER, true);

    public ValidationOptions {
        requireValid(starsMinimum, starsPrecision, pointsPrecision, scalePrecision);
    }

    /**
     * Checks option values without building an instance; used by configurations that carry the
     * same values.
     *
     * @throws IllegalArgumentException if {@code starsMinimum} is outside {@code (0, 5]}
     * @throws NullPointerException     if a precision is {@code null}
     */
    public static void requireValid(
            double starsMinimum,
            RatingPrecision starsPrecision,
            RatingPrecision pointsPrecision,
            RatingPrecision scalePrecision) {
        if (!(starsMinimum > 0) || starsMinimum > RatingDomain.STARS_MAX) {
            throw new IllegalArgumentException("starsMinimum must be in (0, 5], got: " + starsMinimum);
        }
        Objects.requireNonNull(starsPrecision, "starsPrecision must not be null");
        Objects.requireNonNull(pointsPrecision, "pointsPrecision must not be null");
        Objects.requireNonNull(scalePrecision, "scalePrecision must not be null");
    }

    /** The rating domain of {@code list} under these options; empty for unrated lists. */
    public Optional<RatingDomain> domainFor(UserList list) {
        return RatingDomain.forList(list, starsMinimum, scaleMaxFromConfig);
    }

    /** The precision that applies to ratings of the given type. */
    public RatingPrecision precisionFor(RatingType type) {
        return switch (type) {
            case STARS -> starsPrecision;
            case POINTS -> pointsPrecision;
            case SCALE -> scalePrecision;
            case NONE -> RatingPrecision.ANY;
        };
    }
}

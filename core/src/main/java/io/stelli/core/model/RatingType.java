package io.stelli.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How entries of a list are rated.
 *
 * <ul>
 *   <li>{@link #STARS}: half-star steps up to five stars.
 *   <li>{@link #POINTS}: whole points up to 100, or the configured maximum.
 *   <li>{@link #SCALE}: whole numbers up to 10, or the configured maximum.
 *   <li>{@link #NONE}: the list is not rated; entries carry no rating.
 * </ul>
 */
public enum RatingType {
    STARS("stars"),
    POINTS("points"),
    SCALE("scale"),
    NONE("none");

    private final String wireName;

    RatingType(String wireName) {
        this.wireName = wireName;
    }

    /** The name used in list documents, e.g. {@code "stars"}. */
    public String wireName() {
        return wireName;
    }

    /** Looks up a rating type by its document name. */
    public static Optional<RatingType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}

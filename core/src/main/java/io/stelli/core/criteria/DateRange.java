package io.stelli.core.criteria;

import java.time.Instant;

/**
 * Creation-date bounds of a date filter. Either end may be {@code null} (open).
 *
 * @param from earliest creation instant, inclusive
 * @param to   a day whose end (23:59:59.999 in the engine zone) is the latest creation instant
 */
public record DateRange(Instant from, Instant to) {

    /** A range open at both ends. */
    public static DateRange open() {
        return new DateRange(null, null);
    }
}

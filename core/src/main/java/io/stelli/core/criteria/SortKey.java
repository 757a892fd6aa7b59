package io.stelli.core.criteria;

/** Entry attribute a sort criterion orders by. */
public enum SortKey {
    /** Creation instant. */
    DATE,
    /** Rating; unrated entries rank below every rated entry. */
    RATING,
    /** Display name, case-insensitive. */
    NAME
}

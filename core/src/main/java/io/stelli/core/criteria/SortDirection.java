package io.stelli.core.criteria;

/** Ordering direction of a sort criterion. */
public enum SortDirection {
    ASC,
    DESC;

    /** The opposite direction. */
    public SortDirection flip() {
        return this == ASC ? DESC : ASC;
    }
}

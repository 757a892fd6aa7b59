package io.stelli.core.criteria;

/** A configurable unit of sort or filter logic that lives in a {@link CriteriaPool}. */
public interface Criterion {

    /** Identity within a pool. Unique across the active and available collections. */
    String id();

    /** Display label for pickers. */
    String label();

    /** Icon name for pickers. */
    String icon();
}

package io.stelli.core.criteria;

/**
 * A filter predicate with type-specific configuration. The permitted subtypes form a closed set;
 * the {@link #type()} discriminator is switched over exhaustively by the filter engine.
 */
public sealed interface FilterCriterion extends Criterion permits RatingFilterCriterion, DateFilterCriterion {

    /** The filter kind. */
    FilterType type();

    /**
     * An unconfigured filter of the given type, as offered in the available pool. The id is the
     * type's wire name.
     */
    static FilterCriterion template(FilterType type) {
        return switch (type) {
            case RATING -> new RatingFilterCriterion(
                    type.wireName(), type.defaultLabel(), type.defaultIcon(), RatingFilterMode.BETWEEN, null);
            case DATE -> new DateFilterCriterion(type.wireName(), type.defaultLabel(), type.defaultIcon(), null);
        };
    }
}

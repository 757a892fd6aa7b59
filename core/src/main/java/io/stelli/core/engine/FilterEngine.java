package io.stelli.core.engine;

import io.stelli.core.criteria.CriteriaPool;
import io.stelli.core.criteria.CriteriaPoolManager;
import io.stelli.core.criteria.DateFilterCriterion;
import io.stelli.core.criteria.DateRange;
import io.stelli.core.criteria.FilterCriterion;
import io.stelli.core.criteria.FilterType;
import io.stelli.core.criteria.RangeBound;
import io.stelli.core.criteria.RatingFilterCriterion;
import io.stelli.core.criteria.RatingFilterMode;
import io.stelli.core.criteria.RatingRange;
import io.stelli.core.error.CriteriaStateException;
import io.stelli.core.model.Entry;
import io.stelli.core.model.RatingDomain;
import io.stelli.core.model.UserList;
import io.stelli.core.validation.ValidationOptions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the entries that satisfy every active filter criterion, keeping their order.
 *
 * <p>Predicates:
 *
 * <ul>
 *   <li>rating {@code ABOVE}: rated and {@code rating > range.min};
 *   <li>rating {@code BELOW}: rated and {@code rating < range.max};
 *   <li>rating {@code BETWEEN}: rated and {@code range.min <= rating <= range.max};
 *   <li>rating {@code UNRATED}: not rated, range ignored;
 *   <li>date: {@code from} unset or {@code createdAt >= from}, and {@code to} unset or
 *       {@code createdAt <= endOfDay(to)}, where the end of day is 23:59:59.999 in the engine zone.
 *       The upper bound covers the whole of its day so that same-day entries are not excluded.
 * </ul>
 *
 * A rating filter in a comparison mode without a range passes every rated entry.
 *
 * <p>Pool operations add two behaviours to {@link CriteriaPoolManager}: activation applies
 * defaults derived from the list, and deactivation offers at most one template per filter type.
 *
 * <p>Thread-safe. The clock only feeds the default date window; filtering never reads it.
 */
public final class FilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    /** Default trailing window of a freshly activated date filter. */
    public static final int DEFAULT_DATE_WINDOW_DAYS = 30;

    private final ValidationOptions options;
    private final Clock clock;
    private final int dateWindowDays;

    /** Creates an engine with default rating options, the UTC system clock and a 30 day window. */
    public FilterEngine() {
        this(ValidationOptions.DEFAULT, Clock.systemUTC(), DEFAULT_DATE_WINDOW_DAYS);
    }

    /**
     * @param options        rating policy used to derive the rating domain of a list
     * @param clock          source of "now" for date defaults; its zone defines calendar days
     * @param dateWindowDays length of the default date window, positive
     */
    public FilterEngine(ValidationOptions options, Clock clock, int dateWindowDays) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (dateWindowDays <= 0) {
            throw new IllegalArgumentException("dateWindowDays must be positive, got: " + dateWindowDays);
        }
        this.dateWindowDays = dateWindowDays;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    /**
     * Returns the entries that pass every criterion, in input order.
     *
     * @param entries        entries to test; not modified
     * @param activeCriteria filters to AND together; empty passes everything
     * @return a new list
     */
    public List<Entry> filter(List<Entry> entries, List<FilterCriterion> activeCriteria) {
        Objects.requireNonNull(entries, "entries must not be null");
        Objects.requireNonNull(activeCriteria, "activeCriteria must not be null");
        if (activeCriteria.isEmpty()) {
            return new ArrayList<>(entries);
        }
        List<Entry> passed = new ArrayList<>();
        for (Entry entry : entries) {
            if (matchesAll(activeCriteria, entry)) {
                passed.add(entry);
            }
        }
        LOG.debug(
                "filter.applied entries={} passed={} criteria={}", entries.size(), passed.size(), activeCriteria.size());
        return passed;
    }

    /** Whether {@code entry} satisfies every criterion. */
    public boolean matchesAll(List<FilterCriterion> criteria, Entry entry) {
        for (FilterCriterion criterion : criteria) {
            if (!matches(criterion, entry)) {
                return false;
            }
        }
        return true;
    }

    /** Whether {@code entry} satisfies one criterion. */
    public boolean matches(FilterCriterion criterion, Entry entry) {
        return switch (criterion.type()) {
            case RATING -> matchesRating((RatingFilterCriterion) criterion, entry.rating());
            case DATE -> matchesDate(((DateFilterCriterion) criterion).range(), entry.createdAt());
        };
    }

    private static boolean matchesRating(RatingFilterCriterion criterion, Double rating) {
        if (criterion.mode() == RatingFilterMode.UNRATED) {
            return rating == null;
        }
        if (rating == null) {
            return false;
        }
        RatingRange range = criterion.range();
        if (range == null) {
            return true;
        }
        return switch (criterion.mode()) {
            case ABOVE -> rating > range.min();
            case BELOW -> rating < range.max();
            case BETWEEN -> rating >= range.min() && rating <= range.max();
            case UNRATED -> false;
        };
    }

    private boolean matchesDate(DateRange range, Instant createdAt) {
        if (range == null) {
            return true;
        }
        if (range.from() != null && createdAt.isBefore(range.from())) {
            return false;
        }
        return range.to() == null || !createdAt.isAfter(endOfDay(range.to()));
    }

    /** 23:59:59.999 of the calendar day containing {@code instant}, in the engine zone. */
    public Instant endOfDay(Instant instant) {
        return instant.atZone(zone()).toLocalDate().atTime(END_OF_DAY).atZone(zone()).toInstant();
    }

    // --- Criteria pool ---

    /** Session seed: nothing active; a rating template (rated lists only) and a date template. */
    public static CriteriaPool<FilterCriterion> defaultPool(UserList list) {
        List<FilterCriterion> available = new ArrayList<>();
        if (list.isRated()) {
            available.add(FilterCriterion.template(FilterType.RATING));
        }
        available.add(FilterCriterion.template(FilterType.DATE));
        return new CriteriaPool<>(List.of(), available);
    }

    /**
     * Activates an available filter and gives it defaults derived from the list: a rating filter
     * spans the whole rating domain in {@code BETWEEN} mode (or becomes {@code UNRATED} on an unrated
     * list); a date filter covers the trailing window ending now.
     */
    public CriteriaPool<FilterCriterion> activate(CriteriaPool<FilterCriterion> pool, UserList list, String id) {
        return CriteriaPoolManager.activate(pool, id, criterion -> withDefaults(criterion, list));
    }

    /**
     * Deactivates a filter. A fresh template of its type joins the available pool unless one is
     * already there, so the picker never lists the same type twice. No template is offered while
     * another active filter shares the type or the template id; the last of them to leave brings
     * the template back.
     */
    public CriteriaPool<FilterCriterion> deactivate(CriteriaPool<FilterCriterion> pool, String id) {
        return CriteriaPoolManager.deactivate(pool, id, (deactivated, available) -> {
            FilterCriterion template = FilterCriterion.template(deactivated.type());
            boolean typeOffered = available.stream().anyMatch(c -> c.type() == deactivated.type());
            boolean stillActive = pool.active().stream()
                    .filter(c -> !c.id().equals(deactivated.id()))
                    .anyMatch(c -> c.type() == deactivated.type() || c.id().equals(template.id()));
            return typeOffered || stillActive ? Optional.empty() : Optional.of(template);
        });
    }

    /** Reorders the active filters; has no effect on which entries pass. */
    public CriteriaPool<FilterCriterion> reorder(CriteriaPool<FilterCriterion> pool, List<String> newIdOrder) {
        return CriteriaPoolManager.reorder(pool, newIdOrder);
    }

    /**
     * Switches the mode of an active rating filter. Entering {@code BETWEEN} with an inverted or
     * empty range pushes the maximum one step above the minimum.
     */
    public CriteriaPool<FilterCriterion> setRatingMode(
            CriteriaPool<FilterCriterion> pool, UserList list, String id, RatingFilterMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return CriteriaPoolManager.mutateActive(pool, id, criterion -> {
            RatingFilterCriterion rating = requireRating(criterion);
            RatingFilterCriterion updated = rating.withMode(mode);
            if (mode == RatingFilterMode.BETWEEN && rating.range() != null) {
                RatingDomain domain = requireDomain(list);
                RatingRange range = rating.range();
                updated = updated.withRange(separate(range, RangeBound.MIN, domain));
            }
            return updated;
        });
    }

    /**
     * Edits one bound of an active rating filter. The value is clamped into the list's rating
     * domain; in {@code BETWEEN} mode a bound that meets or crosses the other one moves the other
     * bound one step away. {@code ABOVE} and {@code BELOW} use a single bound, so no ordering is
     * enforced there.
     */
    public CriteriaPool<FilterCriterion> editRatingBound(
            CriteriaPool<FilterCriterion> pool, UserList list, String id, RangeBound bound, double value) {
        Objects.requireNonNull(bound, "bound must not be null");
        RatingDomain domain = requireDomain(list);
        return CriteriaPoolManager.mutateActive(pool, id, criterion -> {
            RatingFilterCriterion rating = requireRating(criterion);
            RatingRange base = rating.range() != null ? rating.range() : new RatingRange(domain.min(), domain.max());
            RatingRange edited = base.with(bound, domain.clamp(value));
            if (rating.mode() == RatingFilterMode.BETWEEN) {
                edited = separate(edited, bound, domain);
            }
            return rating.withRange(edited);
        });
    }

    /** Replaces the range of an active date filter; either end may be {@code null}. */
    public CriteriaPool<FilterCriterion> setDateRange(
            CriteriaPool<FilterCriterion> pool, String id, Instant from, Instant to) {
        return CriteriaPoolManager.mutateActive(pool, id, criterion -> {
            if (criterion.type() != FilterType.DATE) {
                throw new CriteriaStateException("Filter '" + id + "' is a " + criterion.type().wireName()
                        + " filter, not a date filter");
            }
            return ((DateFilterCriterion) criterion).withRange(new DateRange(from, to));
        });
    }

    /** The configuration a filter receives on activation. */
    FilterCriterion withDefaults(FilterCriterion criterion, UserList list) {
        return switch (criterion.type()) {
            case RATING -> {
                RatingFilterCriterion rating = (RatingFilterCriterion) criterion;
                Optional<RatingDomain> domain = options.domainFor(list);
                yield domain.map(d -> rating.withMode(RatingFilterMode.BETWEEN)
                                .withRange(new RatingRange(d.min(), d.max())))
                        .orElseGet(() -> rating.withMode(RatingFilterMode.UNRATED).withRange(null));
            }
            case DATE -> {
                Instant now = clock.instant();
                yield ((DateFilterCriterion) criterion)
                        .withRange(new DateRange(now.minus(Duration.ofDays(dateWindowDays)), now));
            }
        };
    }

    /**
     * Moves the bound opposite to {@code edited} so that {@code min < max}, staying inside the
     * domain. A domain narrower than one step collapses to the whole domain.
     */
    private static RatingRange separate(RatingRange range, RangeBound edited, RatingDomain domain) {
        if (range.min() < range.max()) {
            return range;
        }
        double step = domain.step();
        if (domain.max() - domain.min() < step) {
            return new RatingRange(domain.min(), domain.max());
        }
        if (edited == RangeBound.MIN) {
            double max = range.min() + step;
            if (max > domain.max()) {
                return new RatingRange(domain.clamp(domain.max() - step), domain.max());
            }
            return new RatingRange(range.min(), max);
        }
        double min = range.max() - step;
        if (min < domain.min()) {
            return new RatingRange(domain.min(), domain.clamp(domain.min() + step));
        }
        return new RatingRange(min, range.max());
    }

    private static RatingFilterCriterion requireRating(FilterCriterion criterion) {
        if (criterion.type() != FilterType.RATING) {
            throw new CriteriaStateException("Filter '" + criterion.id() + "' is a " + criterion.type().wireName()
                    + " filter, not a rating filter");
        }
        return (RatingFilterCriterion) criterion;
    }

    private RatingDomain requireDomain(UserList list) {
        return options.domainFor(list)
                .orElseThrow(() -> new IllegalArgumentException(
                        "List '" + list.id() + "' is unrated; rating bounds cannot be edited"));
    }
}

package io.stelli.core.engine;

import io.stelli.core.criteria.CriteriaPool;
import io.stelli.core.criteria.CriteriaPoolManager;
import io.stelli.core.criteria.SortCriterion;
import io.stelli.core.criteria.SortDirection;
import io.stelli.core.criteria.SortKey;
import io.stelli.core.model.Entry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders entries by an ordered list of sort criteria.
 *
 * <p>The comparator consults the criteria in priority order and the first non-zero comparison
 * decides. Entries that tie on every criterion keep their input order: the sort is stable, and
 * callers rely on insertion order as the final tie-break.
 *
 * <p>Per-key comparisons:
 *
 * <ul>
 *   <li>{@link SortKey#DATE}: creation instant.
 *   <li>{@link SortKey#RATING}: rating, with unrated entries read as {@value #UNRATED_SENTINEL} so
 *       they sit below every real rating in the underlying numeric order.
 *   <li>{@link SortKey#NAME}: display name, case-insensitive.
 * </ul>
 *
 * {@link SortDirection#DESC} negates the per-key comparison.
 *
 * <p>Stateless and thread-safe. Never modifies the caller's list.
 */
public final class SortEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SortEngine.class);

    /** Numeric stand-in for a missing rating. */
    public static final double UNRATED_SENTINEL = -1;

    /**
     * Returns a sorted copy of {@code entries}.
     *
     * @param entries        entries to order; not modified
     * @param activeCriteria criteria in priority order, index 0 highest; empty keeps input order
     * @return a new list
     */
    public List<Entry> sort(List<Entry> entries, List<SortCriterion> activeCriteria) {
        Objects.requireNonNull(entries, "entries must not be null");
        Objects.requireNonNull(activeCriteria, "activeCriteria must not be null");
        List<Entry> sorted = new ArrayList<>(entries);
        if (!activeCriteria.isEmpty()) {
            // List.sort is a stable merge sort
            sorted.sort(comparator(activeCriteria));
        }
        LOG.debug("sort.applied entries={} criteria={}", sorted.size(), activeCriteria.size());
        return sorted;
    }

    /** The composite comparator for the given criteria, highest priority first. */
    public Comparator<Entry> comparator(List<SortCriterion> activeCriteria) {
        List<SortCriterion> criteria = List.copyOf(activeCriteria);
        return (a, b) -> {
            for (SortCriterion criterion : criteria) {
                int result = compareBy(criterion.key(), a, b);
                if (criterion.direction() == SortDirection.DESC) {
                    result = -result;
                }
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        };
    }

    private static int compareBy(SortKey key, Entry a, Entry b) {
        return switch (key) {
            case DATE -> a.createdAt().compareTo(b.createdAt());
            case RATING -> Double.compare(ratingOf(a), ratingOf(b));
            case NAME -> a.displayName().compareToIgnoreCase(b.displayName());
        };
    }

    private static double ratingOf(Entry entry) {
        return entry.rating() != null ? entry.rating() : UNRATED_SENTINEL;
    }

    // --- Criteria pool ---

    /** Session seed: newest first is active; rating and name are available. */
    public static CriteriaPool<SortCriterion> defaultPool() {
        return new CriteriaPool<>(
                List.of(new SortCriterion("date", SortKey.DATE, "Date", "calendar", SortDirection.DESC)),
                List.of(
                        new SortCriterion("rating", SortKey.RATING, "Rating", "star", SortDirection.DESC),
                        new SortCriterion("name", SortKey.NAME, "Name", "text", SortDirection.ASC)));
    }

    /** Appends an available criterion to the active list as the lowest priority. */
    public CriteriaPool<SortCriterion> activate(CriteriaPool<SortCriterion> pool, String id) {
        return CriteriaPoolManager.activate(pool, id);
    }

    /** Returns an active criterion, with its direction, to the available pool. */
    public CriteriaPool<SortCriterion> deactivate(CriteriaPool<SortCriterion> pool, String id) {
        return CriteriaPoolManager.deactivate(pool, id);
    }

    /** Replaces the priority order; {@code newIdOrder} must be a permutation of the active ids. */
    public CriteriaPool<SortCriterion> reorder(CriteriaPool<SortCriterion> pool, List<String> newIdOrder) {
        return CriteriaPoolManager.reorder(pool, newIdOrder);
    }

    /** Flips the direction of an active criterion without changing its priority. */
    public CriteriaPool<SortCriterion> toggleDirection(CriteriaPool<SortCriterion> pool, String id) {
        return CriteriaPoolManager.mutateActive(pool, id, SortCriterion::toggled);
    }
}

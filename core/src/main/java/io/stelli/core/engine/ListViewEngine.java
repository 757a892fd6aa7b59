package io.stelli.core.engine;

import io.stelli.core.criteria.CriteriaPool;
import io.stelli.core.criteria.FilterCriterion;
import io.stelli.core.criteria.SortCriterion;
import io.stelli.core.model.Entry;
import io.stelli.core.model.UserList;
import java.util.List;
import java.util.Objects;

/**
 * Produces the entries a list screen shows: sorted by the active sort criteria, then reduced by
 * the active filter criteria. Filtering keeps order, so the result equals filtering first and
 * sorting after.
 *
 * <p>With a {@link ViewCache} repeated renders of identical inputs are served from the cache;
 * without one every call recomputes. Both paths return equal lists.
 */
public final class ListViewEngine {

    private final SortEngine sortEngine;
    private final FilterEngine filterEngine;
    private final ViewCache cache;

    /** Creates an uncached engine. */
    public ListViewEngine(SortEngine sortEngine, FilterEngine filterEngine) {
        this(sortEngine, filterEngine, null);
    }

    /**
     * @param sortEngine   orders entries
     * @param filterEngine selects entries
     * @param cache        memo for rendered views, or {@code null} to always recompute
     */
    public ListViewEngine(SortEngine sortEngine, FilterEngine filterEngine, ViewCache cache) {
        this.sortEngine = Objects.requireNonNull(sortEngine, "sortEngine must not be null");
        this.filterEngine = Objects.requireNonNull(filterEngine, "filterEngine must not be null");
        this.cache = cache;
    }

    /**
     * Renders the visible entries of a list.
     *
     * @param list       the list
     * @param entries    the list's entries, already migrated to its current schema; not modified
     * @param sortPool   sort session state; only the active criteria are used
     * @param filterPool filter session state; only the active criteria are used
     * @return the visible entries in display order
     */
    public List<Entry> render(
            UserList list,
            List<Entry> entries,
            CriteriaPool<SortCriterion> sortPool,
            CriteriaPool<FilterCriterion> filterPool) {
        Objects.requireNonNull(list, "list must not be null");
        Objects.requireNonNull(entries, "entries must not be null");
        if (cache == null) {
            return compute(entries, sortPool.active(), filterPool.active());
        }
        var key = new ViewCache.Key(list, entries, sortPool.active(), filterPool.active());
        return cache.computeIfAbsent(key, () -> compute(key.entries(), key.sort(), key.filter()));
    }

    private List<Entry> compute(List<Entry> entries, List<SortCriterion> sort, List<FilterCriterion> filter) {
        return filterEngine.filter(sortEngine.sort(entries, sort), filter);
    }
}

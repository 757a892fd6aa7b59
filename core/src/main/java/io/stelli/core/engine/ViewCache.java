package io.stelli.core.engine;

import io.stelli.core.criteria.FilterCriterion;
import io.stelli.core.criteria.SortCriterion;
import io.stelli.core.model.Entry;
import io.stelli.core.model.UserList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Optional, caller-owned memo of rendered entry views, bounded with least-recently-used eviction.
 *
 * <p>Keys compare by value: the list, a snapshot copy of the entries, and both active criteria
 * lists. Because rendering is a pure function of those inputs, a hit returns exactly what a fresh
 * computation would.
 *
 * <p>Thread-safe: all access is synchronized on the cache.
 */
public final class ViewCache {

    /** Inputs a rendered view depends on. */
    record Key(UserList list, List<Entry> entries, List<SortCriterion> sort, List<FilterCriterion> filter) {

        Key {
            entries = List.copyOf(entries);
            sort = List.copyOf(sort);
            filter = List.copyOf(filter);
        }
    }

    private final int maxEntries;
    private final Map<Key, List<Entry>> views;
    private long hits;
    private long misses;

    /**
     * @param maxEntries number of views retained, positive
     */
    public ViewCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.views = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, List<Entry>> eldest) {
                return size() > ViewCache.this.maxEntries;
            }
        };
    }

    /** Returns the cached view for {@code key}, computing and storing it on a miss. */
    synchronized List<Entry> computeIfAbsent(Key key, Supplier<List<Entry>> render) {
        List<Entry> cached = views.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        List<Entry> rendered = List.copyOf(render.get());
        views.put(key, rendered);
        return rendered;
    }

    public synchronized int size() {
        return views.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        views.clear();
    }
}

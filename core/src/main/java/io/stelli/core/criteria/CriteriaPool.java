package io.stelli.core.criteria;

import io.stelli.core.error.CriteriaStateException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a criteria session: the active criteria, in priority order, and the
 * criteria available to activate.
 *
 * <p>Every criterion id appears exactly once across both collections; construction rejects any
 * snapshot that breaks this. Pool operations in {@link CriteriaPoolManager} return new snapshots
 * and never modify an existing one, so independent sessions over the same list never interfere.
 *
 * @param active    applied criteria, index 0 has the highest priority
 * @param available criteria that may be activated
 * @param <C>       criterion type
 */
public record CriteriaPool<C extends Criterion>(List<C> active, List<C> available) {

    public CriteriaPool {
        Objects.requireNonNull(active, "active must not be null");
        Objects.requireNonNull(available, "available must not be null");
        active = List.copyOf(active);
        available = List.copyOf(available);
        Set<String> seen = new HashSet<>();
        for (C criterion : active) {
            if (!seen.add(criterion.id())) {
                throw new CriteriaStateException("Criterion id '" + criterion.id() + "' appears twice in the active pool");
            }
        }
        for (C criterion : available) {
            if (!seen.add(criterion.id())) {
                throw new CriteriaStateException(
                        "Criterion id '" + criterion.id() + "' appears more than once across active and available pools");
            }
        }
    }

    /** A pool with nothing active and nothing available. */
    public static <C extends Criterion> CriteriaPool<C> empty() {
        return new CriteriaPool<>(List.of(), List.of());
    }

    /** Ids of the active criteria, in priority order. */
    public List<String> activeIds() {
        return active.stream().map(Criterion::id).toList();
    }

    /** Ids of the available criteria, in pool order. */
    public List<String> availableIds() {
        return available.stream().map(Criterion::id).toList();
    }

    public Optional<C> findActive(String id) {
        return active.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public Optional<C> findAvailable(String id) {
        return available.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public boolean isActive(String id) {
        return findActive(id).isPresent();
    }
}

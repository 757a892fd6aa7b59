package io.stelli.core.criteria;

import io.stelli.core.error.CriteriaStateException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transitions of the two-pool criteria state machine, shared by sort and filter criteria.
 *
 * <pre>
 *   Available --activate--&gt; Active      (appended: lowest priority)
 *   Active    --deactivate--&gt; Available (appended, or replaced per {@link ReturnPolicy})
 *   Active    --reorder--&gt; Active       (permutation; membership checked)
 *   Active    --mutateActive--&gt; Active  (configuration change; id preserved)
 * </pre>
 *
 * <p>All operations are pure: they take a snapshot and return a new one. Unknown ids, id changes
 * and reorders that are not permutations are caller errors and raise
 * {@link CriteriaStateException}.
 */
public final class CriteriaPoolManager {

    private static final Logger LOG = LoggerFactory.getLogger(CriteriaPoolManager.class);

    private CriteriaPoolManager() {}

    /**
     * Decides what goes back into the available pool when a criterion is deactivated.
     *
     * @param <C> criterion type
     */
    @FunctionalInterface
    public interface ReturnPolicy<C extends Criterion> {

        /**
         * @param deactivated the criterion leaving the active pool
         * @param available   the available pool before the criterion is returned
         * @return the criterion to append to the available pool, or empty to retire
         *         {@code deactivated} without adding anything
         */
        Optional<C> toAvailable(C deactivated, List<C> available);

        /** Returns the deactivated criterion itself. */
        static <C extends Criterion> ReturnPolicy<C> identity() {
            return (deactivated, available) -> Optional.of(deactivated);
        }
    }

    /** Moves an available criterion to the end of the active pool unchanged. */
    public static <C extends Criterion> CriteriaPool<C> activate(CriteriaPool<C> pool, String id) {
        return activate(pool, id, UnaryOperator.identity());
    }

    /**
     * Moves an available criterion to the end of the active pool.
     *
     * @param pool       current snapshot
     * @param id         id of an available criterion
     * @param onActivate configuration applied on the way in, e.g. schema defaults; must keep the id
     * @return the new snapshot
     * @throws CriteriaStateException if {@code id} is not available
     */
    public static <C extends Criterion> CriteriaPool<C> activate(
            CriteriaPool<C> pool, String id, UnaryOperator<C> onActivate) {
        C criterion = pool.findAvailable(id)
                .orElseThrow(() -> new CriteriaStateException(
                        "Cannot activate '" + id + "': not in the available pool " + pool.availableIds()));
        C configured = requireSameId(criterion, onActivate.apply(criterion));

        List<C> active = new ArrayList<>(pool.active());
        active.add(configured);
        List<C> available = new ArrayList<>(pool.available());
        available.remove(criterion);
        LOG.debug("criteria.activate id={} active={}", id, active.size());
        return new CriteriaPool<>(active, available);
    }

    /** Moves an active criterion back to the end of the available pool. */
    public static <C extends Criterion> CriteriaPool<C> deactivate(CriteriaPool<C> pool, String id) {
        return deactivate(pool, id, ReturnPolicy.identity());
    }

    /**
     * Removes a criterion from the active pool and returns whatever {@code policy} yields to the
     * available pool.
     *
     * @throws CriteriaStateException if {@code id} is not active
     */
    public static <C extends Criterion> CriteriaPool<C> deactivate(
            CriteriaPool<C> pool, String id, ReturnPolicy<C> policy) {
        C criterion = pool.findActive(id)
                .orElseThrow(() -> new CriteriaStateException(
                        "Cannot deactivate '" + id + "': not in the active pool " + pool.activeIds()));

        List<C> active = new ArrayList<>(pool.active());
        active.remove(criterion);
        List<C> available = new ArrayList<>(pool.available());
        Optional<C> returned = policy.toAvailable(criterion, pool.available());
        returned.ifPresent(available::add);
        LOG.debug(
                "criteria.deactivate id={} returned={} available={}",
                id,
                returned.map(Criterion::id).orElse("none"),
                available.size());
        return new CriteriaPool<>(active, available);
    }

    /**
     * Replaces the order of the active pool.
     *
     * @param pool       current snapshot
     * @param newIdOrder every active id exactly once, highest priority first
     * @return the new snapshot; the available pool is untouched
     * @throws CriteriaStateException if {@code newIdOrder} is not a permutation of the active ids
     */
    public static <C extends Criterion> CriteriaPool<C> reorder(CriteriaPool<C> pool, List<String> newIdOrder) {
        Objects.requireNonNull(newIdOrder, "newIdOrder must not be null");
        Map<String, C> byId = pool.active().stream().collect(Collectors.toMap(Criterion::id, Function.identity()));
        Set<String> seen = new HashSet<>();
        for (String id : newIdOrder) {
            if (!byId.containsKey(id)) {
                throw new CriteriaStateException(
                        "Reorder names '" + id + "', which is not active; active ids are " + pool.activeIds());
            }
            if (!seen.add(id)) {
                throw new CriteriaStateException("Reorder names '" + id + "' more than once");
            }
        }
        if (seen.size() != byId.size()) {
            Set<String> missing = new HashSet<>(byId.keySet());
            missing.removeAll(seen);
            throw new CriteriaStateException("Reorder omits active ids " + missing);
        }

        List<C> active = newIdOrder.stream().map(byId::get).toList();
        LOG.debug("criteria.reorder order={}", newIdOrder);
        return new CriteriaPool<>(active, pool.available());
    }

    /**
     * Updates the configuration of an active criterion in place, keeping its priority.
     *
     * @throws CriteriaStateException if {@code id} is not active or the patch changes the id
     */
    public static <C extends Criterion> CriteriaPool<C> mutateActive(
            CriteriaPool<C> pool, String id, UnaryOperator<C> patch) {
        List<C> active = new ArrayList<>(pool.active());
        for (int i = 0; i < active.size(); i++) {
            C current = active.get(i);
            if (current.id().equals(id)) {
                active.set(i, requireSameId(current, patch.apply(current)));
                LOG.debug("criteria.mutate id={}", id);
                return new CriteriaPool<>(active, pool.available());
            }
        }
        throw new CriteriaStateException("Cannot modify '" + id + "': not in the active pool " + pool.activeIds());
    }

    private static <C extends Criterion> C requireSameId(C before, C after) {
        if (after == null || !before.id().equals(after.id())) {
            throw new CriteriaStateException("Criterion '" + before.id() + "' must keep its id when reconfigured, got "
                    + (after == null ? "null" : "'" + after.id() + "'"));
        }
        return after;
    }
}

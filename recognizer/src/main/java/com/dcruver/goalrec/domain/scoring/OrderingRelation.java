package com.dcruver.goalrec.domain.scoring;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Transitively closed precedence relation over task ids.
 * Immutable; indexed by successor for availability checks.
 */
public final class OrderingRelation {

    private static final OrderingRelation EMPTY = new OrderingRelation(Set.of());

    private final Set<Precedence> pairs;
    private final Map<Integer, Set<Integer>> predecessorsByTask;

    OrderingRelation(Set<Precedence> closedPairs) {
        this.pairs = Collections.unmodifiableSet(new LinkedHashSet<>(closedPairs));
        Map<Integer, Set<Integer>> index = new HashMap<>();
        for (Precedence pair : closedPairs) {
            index.computeIfAbsent(pair.getAfter(), t -> new HashSet<>()).add(pair.getBefore());
        }
        this.predecessorsByTask = index;
    }

    public static OrderingRelation empty() {
        return EMPTY;
    }

    /**
     * Relation holding the transitive closure of the given pairs
     */
    public static OrderingRelation closureOf(Set<Precedence> pairs) {
        return new OrderingRelation(OrderingConstraintResolver.close(pairs));
    }

    public Set<Precedence> getPairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    public boolean precedes(int before, int after) {
        return pairs.contains(new Precedence(before, after));
    }

    public Set<Integer> predecessorsOf(int task) {
        return predecessorsByTask.getOrDefault(task, Set.of());
    }

    /**
     * True if any predecessor of {@code task} is still among the pending tasks
     */
    public boolean hasPendingPredecessor(int task, Collection<Integer> pending) {
        for (int predecessor : predecessorsOf(task)) {
            if (pending.contains(predecessor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A closed relation contains a self pair exactly when the method orderings are cyclic
     */
    public boolean hasCycle() {
        return pairs.stream().anyMatch(Precedence::isSelfLoop);
    }
}

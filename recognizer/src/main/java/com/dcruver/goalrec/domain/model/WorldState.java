package com.dcruver.goalrec.domain.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable set of true propositions used while simulating a plan.
 * Each simulation owns its own instance.
 */
public class WorldState {

    private final Set<Integer> propositions;

    public WorldState(Set<Integer> initial) {
        this.propositions = new HashSet<>(initial);
    }

    public static WorldState initialOf(GroundedModel model) {
        return new WorldState(model.getInitialState());
    }

    public boolean isApplicable(Task action) {
        return propositions.containsAll(action.getPreconditions());
    }

    /**
     * Delete effects first, then add effects, so a proposition that is
     * both deleted and added stays true.
     */
    public void apply(Task action) {
        propositions.removeAll(action.getDeleteEffects());
        propositions.addAll(action.getAddEffects());
    }

    public boolean holds(int proposition) {
        return propositions.contains(proposition);
    }

    public Set<Integer> snapshot() {
        return Collections.unmodifiableSet(new HashSet<>(propositions));
    }
}

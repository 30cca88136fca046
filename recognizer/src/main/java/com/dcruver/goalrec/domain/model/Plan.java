package com.dcruver.goalrec.domain.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Immutable sequence of primitive-action ids as produced by the planner.
 */
@EqualsAndHashCode
@ToString
public final class Plan {

    private final List<Integer> actions;

    private Plan(List<Integer> actions) {
        this.actions = List.copyOf(actions);
    }

    public static Plan of(List<Integer> actions) {
        return new Plan(actions);
    }

    public static Plan empty() {
        return new Plan(List.of());
    }

    public List<Integer> getActions() {
        return actions;
    }

    public int size() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public int actionAt(int step) {
        return actions.get(step);
    }

    /**
     * First {@code length} actions, clamped to the plan length
     */
    public List<Integer> prefix(int length) {
        return actions.subList(0, Math.min(Math.max(length, 0), actions.size()));
    }
}

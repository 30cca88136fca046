package com.dcruver.goalrec.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * A grounded task of the HTN model.
 * Primitive tasks carry STRIPS-style preconditions and effects over proposition ids,
 * compound tasks leave them empty.
 */
@Data
@Builder
public class Task {
    private final int id;
    private final String name;
    private final TaskKind kind;

    @Builder.Default
    private final Set<Integer> preconditions = Set.of();
    @Builder.Default
    private final Set<Integer> addEffects = Set.of();
    @Builder.Default
    private final Set<Integer> deleteEffects = Set.of();

    public boolean isPrimitive() {
        return kind == TaskKind.PRIMITIVE;
    }

    public boolean isCompound() {
        return kind == TaskKind.COMPOUND;
    }
}

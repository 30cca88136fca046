package com.dcruver.goalrec.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A decomposition method for a compound task.
 * The orderings form a partial order over positions in {@link #subtasks}.
 */
@Data
@Builder
public class Method {
    private final int id;
    private final String name;
    private final int taskId;
    private final List<Integer> subtasks;  // Task ids, in declaration order

    @Builder.Default
    private final List<SubtaskOrdering> orderings = List.of();

    /**
     * Resolve the task id of the subtask at a local index
     */
    public int subtaskAt(int index) {
        if (index < 0 || index >= subtasks.size()) {
            throw new IndexOutOfBoundsException(String.format(
                "Method %s has %d subtasks, ordering refers to index %d", name, subtasks.size(), index));
        }
        return subtasks.get(index);
    }
}

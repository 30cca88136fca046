package com.dcruver.goalrec.domain.model;

import lombok.Data;

/**
 * Ordering pair local to a method: the subtask at {@code beforeIndex}
 * precedes the subtask at {@code afterIndex}.
 */
@Data
public class SubtaskOrdering {
    private final int beforeIndex;
    private final int afterIndex;
}

package com.dcruver.goalrec.domain.model;

/**
 * Kind of a grounded task.
 */
public enum TaskKind {
    PRIMITIVE,  // Executable action
    COMPOUND    // Decomposed by methods
}

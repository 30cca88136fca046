package com.dcruver.goalrec.io;

/**
 * Categories of lines found in a planner log.
 */
public enum TraceLineKind {
    PLAN_START,            // "==>"
    PLAN_END,              // "<==", closes plan and decomposition sections
    DECOMPOSITION_ROOT,    // "root <id>"
    DECOMPOSITION_RECORD,  // "<id> <task> -> <method> ..."
    PSEUDO_RECORD,         // "<abs>" or "__method_precondition" records
    STEP,                  // "<id> <action>"
    BLANK,
    OTHER
}

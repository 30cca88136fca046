package com.dcruver.goalrec.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Sections of a planner log, still in terms of names.
 */
@Data
@Builder
public class PlannerTrace {
    private final String source;
    private final boolean planSectionFound;
    private final boolean decompositionSectionFound;

    private final List<String> planSteps;               // Action names in plan order
    private final List<TraceLine> decompositionRecords; // "task -> method" records of the tree
    private final List<TraceLine> lines;                // Every classified line of the log, in order
}

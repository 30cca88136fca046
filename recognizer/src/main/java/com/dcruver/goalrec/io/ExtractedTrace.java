package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.model.DecompositionTrace;
import com.dcruver.goalrec.domain.model.Plan;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A planner trace resolved against the grounded model.
 */
@Data
@Builder
public class ExtractedTrace {
    private final String source;
    private final Plan plan;
    private final DecompositionTrace decomposition;
    private final List<String> unresolvedNames;  // Dropped during resolution
}

package com.dcruver.goalrec.domain.scoring;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Stage II outcome with per-step diagnostics.
 */
@Data
@Builder
public class LinearizationResult {
    private final double logProbability;
    private final List<Integer> availableCounts;  // Unclamped |A_t| per step
    private final int clampedSteps;               // Steps where |A_t| was 0 and counted as 1

    public double getProbability() {
        return Math.exp(logProbability);
    }
}

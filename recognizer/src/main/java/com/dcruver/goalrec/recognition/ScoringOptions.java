package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.scoring.ObservabilityMode;
import lombok.Builder;
import lombok.Value;

/**
 * Stage III settings shared by every hypothesis of a run.
 */
@Value
public class ScoringOptions {
    ObservabilityMode mode;
    double detectionProbability;

    @Builder
    public ScoringOptions(ObservabilityMode mode, double detectionProbability) {
        if (mode == null) {
            throw new IllegalArgumentException("Observability mode is required");
        }
        if (!(detectionProbability >= 0.0 && detectionProbability <= 1.0)) {
            throw new IllegalArgumentException("Detection probability must lie in [0, 1]: " + detectionProbability);
        }
        this.mode = mode;
        this.detectionProbability = detectionProbability;
    }
}

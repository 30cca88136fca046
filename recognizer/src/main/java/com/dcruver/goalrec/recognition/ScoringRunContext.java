package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.scoring.ObservabilityMode;
import com.dcruver.goalrec.io.ExtractedTrace;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the scorers read for one hypothesis in one elimination round.
 * Created by the caller per round and dropped once the score is emitted;
 * the model is shared, everything else belongs to this context.
 */
@Value
@Builder
public class ScoringRunContext {
    String hypothesis;
    int round;
    GroundedModel model;
    ExtractedTrace observedTrace;
    ExtractedTrace baselineTrace;
    List<Integer> observations;
    ObservabilityMode mode;
    double detectionProbability;
}

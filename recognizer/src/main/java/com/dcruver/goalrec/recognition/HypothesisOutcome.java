package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.ErrorKind;
import com.dcruver.goalrec.domain.posterior.PosteriorAccumulator;
import com.dcruver.goalrec.domain.scoring.HypothesisScore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Result of scoring one hypothesis: either a score or an error tag, never both.
 */
@Value
@Slf4j
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HypothesisOutcome {
    String hypothesis;
    HypothesisScore score;
    ErrorKind errorKind;
    String errorMessage;

    public static HypothesisOutcome scored(HypothesisScore score) {
        return new HypothesisOutcome(score.getHypothesis(), score, null, null);
    }

    public static HypothesisOutcome failed(String hypothesis, ErrorKind kind, String message) {
        return new HypothesisOutcome(hypothesis, null, kind, message);
    }

    public boolean isScored() {
        return score != null;
    }

    /**
     * Add this outcome to a posterior, as a likelihood or as a tagged failure.
     * A name the posterior already holds is recorded as a format failure under
     * a suffixed name, so the hypotheses recorded before stay untouched.
     *
     * @return the name the outcome was recorded under
     */
    public String recordInto(PosteriorAccumulator accumulator) {
        synchronized (accumulator) {
            if (accumulator.contains(hypothesis)) {
                String name = accumulator.distinctName(hypothesis);
                log.warn("Hypothesis name {} is already taken, recorded as failed {}", hypothesis, name);
                accumulator.recordFailure(name, ErrorKind.FORMAT, "Duplicate hypothesis name " + hypothesis);
                return name;
            }
            if (isScored()) {
                accumulator.record(hypothesis, score.getNormalizedLikelihood());
            } else {
                accumulator.recordFailure(hypothesis, errorKind, errorMessage);
            }
            return hypothesis;
        }
    }
}

package com.dcruver.goalrec.domain.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Likelihood breakdown for one hypothesis.
 * "Observed" refers to the observation-consistent plan, "baseline" to the
 * unconstrained plan.
 */
@Value
@Builder(toBuilder = true)
public class HypothesisScore {
    String hypothesis;

    double observedStage1;
    double observedStage2;
    double observedStage3;
    double baselineStage1;
    double baselineStage2;

    double logNumerator;
    double logDenominator;
    double numerator;
    double denominator;
    double normalizedLikelihood;

    // Diagnostics
    int observationCount;
    int observedPlanLength;
    int baselinePlanLength;
    int clampedSteps;

    public double getLogLikelihood() {
        return logNumerator - logDenominator;
    }
}

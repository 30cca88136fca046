package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.ScoringComputationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Combines stage probabilities into the normalized likelihood
 * P(obs, pi+, N+) / P(N_base, pi_base). Products are summed in log space and
 * exponentiated once.
 */
@Component
@Slf4j
public class LikelihoodCombiner {

    public HypothesisScore combine(String hypothesis,
                                   StageProbability observedStage1,
                                   LinearizationResult observedStage2,
                                   StageProbability observedStage3,
                                   StageProbability baselineStage1,
                                   LinearizationResult baselineStage2) {
        double logNumerator = observedStage1.getLogProbability()
            + observedStage2.getLogProbability()
            + observedStage3.getLogProbability();
        double logDenominator = baselineStage1.getLogProbability()
            + baselineStage2.getLogProbability();

        if (!Double.isFinite(logDenominator)) {
            throw new ScoringComputationException(String.format(
                "Baseline probability of %s is not a positive finite number (log = %s)", hypothesis, logDenominator));
        }

        double logLikelihood = logNumerator - logDenominator;
        double likelihood = Math.exp(logLikelihood);
        if (Double.isNaN(likelihood) || Double.isInfinite(likelihood)) {
            throw new ScoringComputationException(String.format(
                "Normalized likelihood of %s is not finite (log = %s)", hypothesis, logLikelihood));
        }

        log.debug("{}: log numerator = {}, log denominator = {}, likelihood = {}",
            hypothesis, logNumerator, logDenominator, likelihood);

        return HypothesisScore.builder()
            .hypothesis(hypothesis)
            .observedStage1(observedStage1.getProbability())
            .observedStage2(observedStage2.getProbability())
            .observedStage3(observedStage3.getProbability())
            .baselineStage1(baselineStage1.getProbability())
            .baselineStage2(baselineStage2.getProbability())
            .logNumerator(logNumerator)
            .logDenominator(logDenominator)
            .numerator(Math.exp(logNumerator))
            .denominator(Math.exp(logDenominator))
            .normalizedLikelihood(likelihood)
            .observedPlanLength(observedStage2.getAvailableCounts().size())
            .baselinePlanLength(baselineStage2.getAvailableCounts().size())
            .clampedSteps(observedStage2.getClampedSteps() + baselineStage2.getClampedSteps())
            .build();
    }
}

package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.model.DecompositionTrace;
import com.dcruver.goalrec.domain.model.Plan;
import com.dcruver.goalrec.domain.scoring.DecompositionScorer;
import com.dcruver.goalrec.domain.scoring.HypothesisScore;
import com.dcruver.goalrec.domain.scoring.LikelihoodCombiner;
import com.dcruver.goalrec.domain.scoring.LinearizationResult;
import com.dcruver.goalrec.domain.scoring.LinearizationScorer;
import com.dcruver.goalrec.domain.scoring.ObservationAlignmentScorer;
import com.dcruver.goalrec.domain.scoring.OrderingConstraintResolver;
import com.dcruver.goalrec.domain.scoring.OrderingRelation;
import com.dcruver.goalrec.domain.scoring.StageProbability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Runs the three scoring stages for both plans of a run context and combines them.
 * Pure with respect to the model: all mutable state lives inside the stage scorers' calls.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HypothesisScorer {

    private final OrderingConstraintResolver orderingResolver;
    private final DecompositionScorer decompositionScorer;
    private final LinearizationScorer linearizationScorer;
    private final ObservationAlignmentScorer alignmentScorer;
    private final LikelihoodCombiner combiner;

    public HypothesisScore score(ScoringRunContext context) {
        DecompositionTrace observedDecomposition = context.getObservedTrace().getDecomposition();
        DecompositionTrace baselineDecomposition = context.getBaselineTrace().getDecomposition();
        Plan observedPlan = context.getObservedTrace().getPlan();
        Plan baselinePlan = context.getBaselineTrace().getPlan();

        // Both plans are linearized against the orderings of every method either one used
        Set<Integer> usedMethods = new TreeSet<>(observedDecomposition.getUsedMethodIds());
        usedMethods.addAll(baselineDecomposition.getUsedMethodIds());
        OrderingRelation ordering = orderingResolver.resolve(context.getModel(), usedMethods);

        log.info("[round {}] Scoring {}: observed plan {} steps, baseline plan {} steps, {} observations ({})",
            context.getRound(), context.getHypothesis(), observedPlan.size(), baselinePlan.size(),
            context.getObservations().size(), context.getMode());

        if (observedDecomposition.isEmpty()) {
            log.warn("[round {}] {}: observed trace has no decomposition records, Stage I is 1",
                context.getRound(), context.getHypothesis());
        }

        StageProbability observedStage1 = decompositionScorer.score(observedDecomposition);
        LinearizationResult observedStage2 = linearizationScorer.score(context.getModel(), observedPlan, ordering);
        StageProbability observedStage3 = alignmentScorer.score(
            context.getObservations(), observedPlan, context.getMode(), context.getDetectionProbability());

        StageProbability baselineStage1 = decompositionScorer.score(baselineDecomposition);
        LinearizationResult baselineStage2 = linearizationScorer.score(context.getModel(), baselinePlan, ordering);

        HypothesisScore score = combiner.combine(context.getHypothesis(),
                observedStage1, observedStage2, observedStage3, baselineStage1, baselineStage2)
            .toBuilder()
            .observationCount(context.getObservations().size())
            .build();

        log.info("[round {}] {}: numerator {}, denominator {}, normalized likelihood {}",
            context.getRound(), context.getHypothesis(),
            String.format("%.10e", score.getNumerator()),
            String.format("%.10e", score.getDenominator()),
            String.format("%.10e", score.getNormalizedLikelihood()));
        return score;
    }
}

package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.ErrorKind;
import com.dcruver.goalrec.domain.ScoringComputationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LikelihoodCombinerTest {

    private final LikelihoodCombiner combiner = new LikelihoodCombiner();

    private static LinearizationResult linearization(double probability, Integer... availableCounts) {
        return LinearizationResult.builder()
            .logProbability(Math.log(probability))
            .availableCounts(List.of(availableCounts))
            .clampedSteps(0)
            .build();
    }

    @Test
    void testSingleActionTwoMethodScenario() {
        // One compound task with two methods, one action, full observation of it
        HypothesisScore score = combiner.combine("h1",
            StageProbability.ofProbability(0.5), linearization(1.0, 1), StageProbability.ofProbability(0.5),
            StageProbability.ofProbability(0.5), linearization(1.0, 1));

        assertEquals(0.25, score.getNumerator(), 1e-12);
        assertEquals(0.5, score.getDenominator(), 1e-12);
        assertEquals(0.5, score.getNormalizedLikelihood(), 1e-12);
        assertEquals(1, score.getObservedPlanLength());
    }

    @Test
    void testEqualNumeratorAndDenominatorGiveOne() {
        HypothesisScore score = combiner.combine("h1",
            StageProbability.ofProbability(0.5), linearization(1.0, 1), StageProbability.ofProbability(0.5),
            StageProbability.ofProbability(0.25), linearization(1.0, 1, 1));

        assertEquals(1.0, score.getNormalizedLikelihood(), 1e-12);
        assertEquals(2, score.getBaselinePlanLength());
    }

    @Test
    void testTinyStagesStayFinite() {
        StageProbability tiny = new StageProbability(-800.0);
        HypothesisScore score = combiner.combine("h1",
            tiny, linearization(1.0, 1), StageProbability.certain(),
            tiny, linearization(1.0, 1));

        assertEquals(1.0, score.getNormalizedLikelihood(), 1e-12);
        assertEquals(0.0, score.getNumerator(), 0.0);
    }

    @Test
    void testZeroObservationProbabilityGivesZeroLikelihood() {
        HypothesisScore score = combiner.combine("h1",
            StageProbability.certain(), linearization(1.0, 1), StageProbability.ofProbability(0.0),
            StageProbability.certain(), linearization(1.0, 1));

        assertEquals(0.0, score.getNormalizedLikelihood(), 0.0);
    }

    @Test
    void testZeroDenominatorIsAComputationError() {
        ScoringComputationException e = assertThrows(ScoringComputationException.class, () ->
            combiner.combine("h1",
                StageProbability.certain(), linearization(1.0, 1), StageProbability.certain(),
                StageProbability.ofProbability(0.0), linearization(1.0, 1)));

        assertEquals(ErrorKind.COMPUTATION, e.getKind());
        assertTrue(e.getMessage().contains("h1"));
    }
}

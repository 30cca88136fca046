package com.dcruver.goalrec.reporting;

import com.dcruver.goalrec.domain.scoring.HypothesisScore;
import com.dcruver.goalrec.recognition.HypothesisOutcome;
import org.springframework.stereotype.Component;

import static com.dcruver.goalrec.reporting.ReportFormats.errorTag;
import static com.dcruver.goalrec.reporting.ReportFormats.scientific;

/**
 * Renders the stage breakdown of a scored hypothesis.
 */
@Component
public class ScoreReportFormatter {

    private static final String RULE = "=".repeat(60);

    public String format(HypothesisOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append("\n");
        sb.append("Hypothesis: ").append(outcome.getHypothesis()).append("\n");
        sb.append(RULE).append("\n");

        if (!outcome.isScored()) {
            sb.append(errorTag(outcome.getErrorKind())).append(" ").append(outcome.getErrorMessage()).append("\n");
            return sb.toString();
        }

        HypothesisScore score = outcome.getScore();
        sb.append(String.format("Observed plan: %d actions, baseline plan: %d actions, observations: %d\n",
            score.getObservedPlanLength(), score.getBaselinePlanLength(), score.getObservationCount()));
        if (score.getClampedSteps() > 0) {
            sb.append(String.format("Warning: %d linearization steps had no available action\n",
                score.getClampedSteps()));
        }

        sb.append("\nNumerator (observation-consistent plan):\n");
        sb.append("  Stage I   decomposition  = ").append(scientific(score.getObservedStage1())).append("\n");
        sb.append("  Stage II  linearization  = ").append(scientific(score.getObservedStage2())).append("\n");
        sb.append("  Stage III observations   = ").append(scientific(score.getObservedStage3())).append("\n");
        sb.append("  Product                  = ").append(scientific(score.getNumerator())).append("\n");

        sb.append("\nDenominator (baseline plan):\n");
        sb.append("  Stage I   decomposition  = ").append(scientific(score.getBaselineStage1())).append("\n");
        sb.append("  Stage II  linearization  = ").append(scientific(score.getBaselineStage2())).append("\n");
        sb.append("  Product                  = ").append(scientific(score.getDenominator())).append("\n");

        sb.append("\nNormalized likelihood     = ").append(scientific(score.getNormalizedLikelihood())).append("\n");
        sb.append("log normalized likelihood = ").append(scientific(score.getLogLikelihood())).append("\n");
        return sb.toString();
    }
}

package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.model.Plan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Stage III: probability that the observations were generated by the plan,
 * marginalized over how far execution had progressed when observation stopped.
 */
@Component
@Slf4j
public class ObservationAlignmentScorer {

    public StageProbability score(List<Integer> observations, Plan plan,
                                  ObservabilityMode mode, double detectionProbability) {
        double probability = switch (mode) {
            case FULL -> fullObservability(observations, plan);
            case PARTIAL -> partialObservability(observations, plan, detectionProbability);
        };
        log.debug("Stage III ({}): {} observations against {} plan steps, P = {}",
            mode, observations.size(), plan.size(), probability);
        return StageProbability.ofProbability(probability);
    }

    /**
     * Uniform prior over the number of executed steps, 0..|plan|
     */
    public static double progressPrior(int planLength) {
        return 1.0 / (planLength + 1);
    }

    /**
     * Observations must be the plan prefix of the same length
     */
    double fullObservability(List<Integer> observations, Plan plan) {
        if (observations.size() > plan.size()) {
            return 0.0;
        }
        List<Integer> prefix = plan.prefix(observations.size());
        double alignment = prefix.equals(observations) ? 1.0 : 0.0;
        return alignment * progressPrior(plan.size());
    }

    /**
     * Sum over prefix lengths n in [|obs|, |plan|] of P(obs | plan[0..n)) times the progress prior.
     * The alignment of a prefix of length n is column n of one table over the whole plan.
     */
    double partialObservability(List<Integer> observations, Plan plan, double detectionProbability) {
        if (detectionProbability < 0.0 || detectionProbability > 1.0 || Double.isNaN(detectionProbability)) {
            throw new IllegalArgumentException("Detection probability must lie in [0, 1]: " + detectionProbability);
        }
        int m = observations.size();
        if (m > plan.size()) {
            return 0.0;
        }

        double[][] dp = alignmentTable(observations, plan.getActions(), detectionProbability);
        double prior = progressPrior(plan.size());
        double total = 0.0;
        for (int n = m; n <= plan.size(); n++) {
            double contribution = dp[m][n] * prior;
            total += contribution;
            if (contribution > 1e-10) {
                log.trace("  n={}: P(obs | prefix) = {}, contribution = {}", n, dp[m][n], contribution);
            }
        }
        return total;
    }

    /**
     * dp[i][j] = P(first i observations | first j plan steps): a matching step is
     * detected with probability p, every other step is missed with probability 1 - p.
     */
    public static double[][] alignmentTable(List<Integer> observations, List<Integer> plan, double p) {
        int m = observations.size();
        int n = plan.size();
        double miss = 1.0 - p;

        double[][] dp = new double[m + 1][n + 1];
        dp[0][0] = 1.0;
        for (int j = 1; j <= n; j++) {
            dp[0][j] = dp[0][j - 1] * miss;
        }
        for (int i = 1; i <= m; i++) {
            for (int j = i; j <= n; j++) {
                double match = observations.get(i - 1).equals(plan.get(j - 1)) ? dp[i - 1][j - 1] * p : 0.0;
                dp[i][j] = match + dp[i][j - 1] * miss;
            }
        }
        return dp;
    }
}

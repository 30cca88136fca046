package com.dcruver.goalrec.domain.scoring;

import lombok.Data;

/**
 * Probability of one scoring stage, kept in log space.
 * A zero probability is represented by negative infinity.
 */
@Data
public class StageProbability {
    private final double logProbability;

    public static StageProbability certain() {
        return new StageProbability(0.0);
    }

    public static StageProbability ofProbability(double probability) {
        return new StageProbability(Math.log(probability));
    }

    public double getProbability() {
        return Math.exp(logProbability);
    }
}

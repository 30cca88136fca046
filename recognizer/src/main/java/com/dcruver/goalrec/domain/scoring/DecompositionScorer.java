package com.dcruver.goalrec.domain.scoring;

import com.dcruver.goalrec.domain.model.DecompositionTrace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stage I: probability of the method choices under uniform selection,
 * P(m | X) = 1 / |M(X)| for every decomposed compound task X.
 */
@Component
@Slf4j
public class DecompositionScorer {

    public StageProbability score(DecompositionTrace trace) {
        if (trace.isEmpty()) {
            log.debug("Stage I: no decomposed tasks, P = 1");
            return StageProbability.certain();
        }

        double logProbability = 0.0;
        int compoundTasks = 0;

        for (Map.Entry<String, Integer> entry : trace.getMethodCounts().entrySet()) {
            int alternatives = entry.getValue();
            if (alternatives <= 0) {
                continue;
            }
            logProbability -= Math.log(alternatives);
            compoundTasks++;
            log.debug("  Task {} | |M(X)| = {} | P(m|X) = {}", entry.getKey(), alternatives, 1.0 / alternatives);
        }

        log.debug("Stage I: {} compound tasks, log P = {}", compoundTasks, logProbability);
        return new StageProbability(logProbability);
    }
}

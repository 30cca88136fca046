package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.ErrorKind;
import com.dcruver.goalrec.domain.model.GroundedModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Scores independent hypotheses concurrently against one shared, read-only model.
 * Outcomes are returned in request order.
 */
@Component
@Slf4j
public class ParallelHypothesisScorer {

    private final GoalRecognitionService recognitionService;
    private final TaskExecutor executor;

    public ParallelHypothesisScorer(GoalRecognitionService recognitionService,
                                    @Qualifier("scoringExecutor") TaskExecutor executor) {
        this.recognitionService = recognitionService;
        this.executor = executor;
    }

    public List<HypothesisOutcome> scoreAll(GroundedModel model, List<HypothesisRequest> requests,
                                            ScoringOptions options) {
        log.info("Scoring {} hypotheses in parallel", requests.size());

        List<CompletableFuture<HypothesisOutcome>> futures = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            HypothesisRequest request = requests.get(i);
            int round = i + 1;
            futures.add(CompletableFuture.supplyAsync(
                () -> recognitionService.score(model, request, options, round), executor));
        }

        List<HypothesisOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), requests.get(i)));
        }

        long failed = outcomes.stream().filter(o -> !o.isScored()).count();
        log.info("Scored {} hypotheses, {} failed", outcomes.size() - failed, failed);
        return outcomes;
    }

    private HypothesisOutcome await(CompletableFuture<HypothesisOutcome> future, HypothesisRequest request) {
        try {
            return future.join();
        } catch (CompletionException e) {
            String name = request.getHypothesis() != null
                ? request.getHypothesis()
                : String.valueOf(request.getObservationLog());
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected failure while scoring {}", name, cause);
            return HypothesisOutcome.failed(name, ErrorKind.INTERNAL, String.valueOf(cause.getMessage()));
        }
    }
}

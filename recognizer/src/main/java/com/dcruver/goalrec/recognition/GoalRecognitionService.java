package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.RecognitionException;
import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.model.Plan;
import com.dcruver.goalrec.domain.scoring.HypothesisScore;
import com.dcruver.goalrec.io.ExtractedTrace;
import com.dcruver.goalrec.io.HypothesisIdentifier;
import com.dcruver.goalrec.io.ObservationFileReader;
import com.dcruver.goalrec.io.PlannerTrace;
import com.dcruver.goalrec.io.PlannerTraceReader;
import com.dcruver.goalrec.io.TraceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores hypotheses from planner logs. Errors are contained per hypothesis:
 * a hypothesis that cannot be scored yields a failed outcome carrying the
 * error tag instead of a likelihood.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GoalRecognitionService {

    private final PlannerTraceReader traceReader;
    private final TraceExtractor traceExtractor;
    private final HypothesisIdentifier hypothesisIdentifier;
    private final ObservationFileReader observationFileReader;
    private final HypothesisScorer hypothesisScorer;

    public HypothesisOutcome score(GroundedModel model, HypothesisRequest request,
                                   ScoringOptions options, int round) {
        boolean named = request.getHypothesis() != null && !request.getHypothesis().isBlank();
        String hypothesis = named ? request.getHypothesis().strip() : fallbackName(request.getObservationLog());

        try {
            PlannerTrace observedLog = traceReader.read(request.getObservationLog());
            if (!named) {
                hypothesis = hypothesisIdentifier.identify(observedLog).orElse(hypothesis);
            }

            ScoringRunContext context = buildContext(model, request, options, round, hypothesis, observedLog);
            HypothesisScore score = hypothesisScorer.score(context);
            return HypothesisOutcome.scored(score);

        } catch (RecognitionException e) {
            log.error("[round {}] Hypothesis {} could not be scored ({}): {}",
                round, hypothesis, e.getKind(), e.getMessage(), e);
            return HypothesisOutcome.failed(hypothesis, e.getKind(), e.getMessage());
        }
    }

    /**
     * Identify the hypothesis an observation-constrained planner log committed to
     */
    public String identifyHypothesis(Path observationLog) {
        return hypothesisIdentifier.identify(traceReader.read(observationLog))
            .orElseThrow(() -> new IllegalStateException("No hypothesis found in " + observationLog));
    }

    private ScoringRunContext buildContext(GroundedModel model, HypothesisRequest request, ScoringOptions options,
                                           int round, String hypothesis, PlannerTrace observedLog) {
        ExtractedTrace observed = traceExtractor.extract(observedLog, model);
        ExtractedTrace baseline = traceExtractor.extract(request.getBaselineLog(), model);

        return ScoringRunContext.builder()
            .hypothesis(hypothesis)
            .round(round)
            .model(model)
            .observedTrace(observed)
            .baselineTrace(baseline)
            .observations(observations(model, request, observed.getPlan()))
            .mode(options.getMode())
            .detectionProbability(options.getDetectionProbability())
            .build();
    }

    /**
     * Observations from the observation file, or the leading actions of the observed plan
     */
    List<Integer> observations(GroundedModel model, HypothesisRequest request, Plan observedPlan) {
        if (request.getObservationFile() != null) {
            List<String> names = observationFileReader.read(request.getObservationFile());
            List<String> unresolved = new ArrayList<>();
            List<Integer> observations = traceExtractor.resolveActions(
                names, model, unresolved, request.getObservationFile().toString());
            log.info("Read {} observations from {} ({} unresolved)",
                observations.size(), request.getObservationFile(), unresolved.size());
            return observations;
        }

        Integer count = request.getObservationCount();
        if (count == null || count < 0 || count > observedPlan.size()) {
            return observedPlan.getActions();
        }
        return observedPlan.prefix(count);
    }

    /**
     * Log file name without extension, qualified by its directory: "h1/obs_pgr" for h1/obs_pgr.log
     */
    private String fallbackName(Path observationLog) {
        String fileName = observationLog.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        Path parent = observationLog.getParent();
        if (parent == null || parent.getFileName() == null) {
            return stem;
        }
        return parent.getFileName() + "/" + stem;
    }
}

package com.dcruver.goalrec.app;

import com.dcruver.goalrec.config.RecognizerProperties;
import com.dcruver.goalrec.domain.RecognitionException;
import com.dcruver.goalrec.domain.ScoringComputationException;
import com.dcruver.goalrec.domain.model.GroundedModel;
import com.dcruver.goalrec.domain.model.Task;
import com.dcruver.goalrec.domain.posterior.PosteriorAccumulator;
import com.dcruver.goalrec.domain.posterior.PosteriorTable;
import com.dcruver.goalrec.domain.scoring.ObservabilityMode;
import com.dcruver.goalrec.io.BatchManifest;
import com.dcruver.goalrec.io.BatchManifestReader;
import com.dcruver.goalrec.io.GroundedModelLoader;
import com.dcruver.goalrec.io.LikelihoodFileReader;
import com.dcruver.goalrec.recognition.GoalRecognitionService;
import com.dcruver.goalrec.recognition.HypothesisOutcome;
import com.dcruver.goalrec.recognition.HypothesisRequest;
import com.dcruver.goalrec.recognition.ParallelHypothesisScorer;
import com.dcruver.goalrec.recognition.ScoringOptions;
import com.dcruver.goalrec.reporting.PosteriorReportWriter;
import com.dcruver.goalrec.reporting.ScoreReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Spring Shell commands for scoring goal hypotheses.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class RecognizerShellCommands {

    private final RecognizerProperties properties;
    private final GroundedModelLoader modelLoader;
    private final GoalRecognitionService recognitionService;
    private final ParallelHypothesisScorer parallelScorer;
    private final BatchManifestReader manifestReader;
    private final LikelihoodFileReader likelihoodReader;
    private final ScoreReportFormatter scoreFormatter;
    private final PosteriorReportWriter posteriorWriter;

    @ShellMethod(key = "score", value = "Compute the normalized likelihood of one hypothesis")
    public String score(
            @ShellOption(help = "Grounded model (JSON)") String model,
            @ShellOption(value = "--observation-log", help = "Planner log of the observation-consistent plan") String observationLog,
            @ShellOption(value = "--baseline-log", help = "Planner log of the unconstrained plan") String baselineLog,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Hypothesis name, read from the log if omitted") String hypothesis,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Observation file, one action per line") String observations,
            @ShellOption(value = "--num-obs", defaultValue = ShellOption.NULL, help = "Use the first N actions of the observed plan") Integer numObs,
            @ShellOption(defaultValue = ShellOption.NULL, help = "FULL or PARTIAL") String observability,
            @ShellOption(value = "--p-det", defaultValue = ShellOption.NULL, help = "Detection probability for PARTIAL") Double pDet) {
        log.info("Scoring hypothesis from {} against baseline {}", observationLog, baselineLog);

        try {
            ScoringOptions options = options(observability, pDet);
            GroundedModel groundedModel = modelLoader.load(Path.of(model));

            HypothesisRequest request = HypothesisRequest.builder()
                .hypothesis(hypothesis)
                .observationLog(Path.of(observationLog))
                .baselineLog(Path.of(baselineLog))
                .observationFile(observations != null ? Path.of(observations) : null)
                .observationCount(numObs)
                .build();

            HypothesisOutcome outcome = recognitionService.score(groundedModel, request, options, 1);
            return scoreFormatter.format(outcome);

        } catch (RecognitionException | IllegalArgumentException e) {
            log.error("Scoring failed", e);
            return "Scoring failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "score-batch", value = "Score every hypothesis of a manifest and compute posteriors")
    public String scoreBatch(
            @ShellOption(help = "Batch manifest (JSON)") String manifest,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Report file, defaults to <report-dir>/posterior.txt") String report,
            @ShellOption(defaultValue = ShellOption.NULL, help = "CSV file, defaults to <report-dir>/posterior.csv") String csv) {
        log.info("Running batch from {}", manifest);

        try {
            Path manifestPath = Path.of(manifest);
            BatchManifest batch = manifestReader.read(manifestPath);
            ScoringOptions options = options(batch.getObservability(), batch.getDetectionProbability());
            GroundedModel groundedModel = modelLoader.load(manifestReader.resolve(manifestPath, batch.getModel()));

            List<HypothesisRequest> requests = batch.getHypotheses().stream()
                .map(entry -> HypothesisRequest.builder()
                    .hypothesis(entry.getHypothesis())
                    .observationLog(manifestReader.resolve(manifestPath, entry.getObservationLog()))
                    .baselineLog(manifestReader.resolve(manifestPath, entry.getBaselineLog()))
                    .observationFile(manifestReader.resolve(manifestPath, batch.getObservationFile()))
                    .observationCount(batch.getObservationCount())
                    .build())
                .toList();

            List<HypothesisOutcome> outcomes = parallelScorer.scoreAll(groundedModel, requests, options);

            StringBuilder sb = new StringBuilder();
            PosteriorAccumulator accumulator = new PosteriorAccumulator();
            for (HypothesisOutcome outcome : outcomes) {
                sb.append(scoreFormatter.format(outcome)).append("\n");
                outcome.recordInto(accumulator);
            }

            PosteriorTable table;
            try {
                table = accumulator.snapshot();
            } catch (ScoringComputationException e) {
                log.error("No posterior for batch {}: {}", manifest, e.getMessage());
                sb.append(posteriorWriter.renderUnavailable(e));
                return sb.toString();
            }

            Path reportPath = report != null ? Path.of(report) : Path.of(properties.getReportDir(), "posterior.txt");
            Path csvPath = csv != null ? Path.of(csv) : Path.of(properties.getReportDir(), "posterior.csv");
            posteriorWriter.write(table, reportPath, csvPath);

            sb.append(posteriorWriter.render(table));
            sb.append("\nReport written to ").append(reportPath).append("\n");
            return sb.toString();

        } catch (Exception e) {
            log.error("Batch failed", e);
            return "Batch failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "posterior", value = "Normalize a file of hypothesis likelihoods into posteriors")
    public String posterior(
            @ShellOption(help = "Likelihood file: 'name,likelihood' or 'name likelihood' per line") String input,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Report file") String output,
            @ShellOption(defaultValue = ShellOption.NULL, help = "CSV file") String csv) {
        log.info("Computing posteriors from {}", input);

        try {
            PosteriorAccumulator accumulator = new PosteriorAccumulator();
            likelihoodReader.read(Path.of(input))
                .forEach(row -> accumulator.record(row.getHypothesis(), row.getLikelihood()));

            PosteriorTable table = accumulator.snapshot();
            if (output != null) {
                posteriorWriter.write(table, Path.of(output), csv != null ? Path.of(csv) : null);
            }
            return posteriorWriter.render(table);

        } catch (Exception e) {
            log.error("Posterior computation failed", e);
            return "Posterior computation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "extract-hypothesis", value = "Show the hypothesis an observation-constrained plan committed to")
    public String extractHypothesis(@ShellOption(value = "--log", help = "Planner log") String logFile) {
        try {
            return recognitionService.identifyHypothesis(Path.of(logFile));
        } catch (RecognitionException | IllegalStateException e) {
            log.error("Hypothesis extraction failed", e);
            return "Hypothesis extraction failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "model-info", value = "Summarize a grounded model")
    public String modelInfo(@ShellOption(help = "Grounded model (JSON)") String model) {
        try {
            GroundedModel groundedModel = modelLoader.load(Path.of(model));
            long actions = groundedModel.getTasks().stream().filter(Task::isPrimitive).count();

            StringBuilder sb = new StringBuilder();
            sb.append("Model: ").append(model).append("\n");
            sb.append(String.format("- Tasks: %d (%d actions, %d compound)\n",
                groundedModel.getTaskCount(), actions, groundedModel.getTaskCount() - actions));
            sb.append(String.format("- Methods: %d\n", groundedModel.getMethodCount()));
            sb.append(String.format("- Initial facts: %d\n", groundedModel.getInitialState().size()));
            return sb.toString();

        } catch (RecognitionException e) {
            log.error("Cannot load model", e);
            return "Cannot load model: " + e.getMessage();
        }
    }

    private ScoringOptions options(String observability, Double detectionProbability) {
        ObservabilityMode mode = observability != null
            ? ObservabilityMode.valueOf(observability.toUpperCase(Locale.ROOT))
            : properties.getObservability();
        double pDet = detectionProbability != null ? detectionProbability : properties.getDetectionProbability();
        return new ScoringOptions(mode, pDet);
    }
}

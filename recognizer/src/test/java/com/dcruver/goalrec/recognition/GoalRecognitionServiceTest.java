package com.dcruver.goalrec.recognition;

import com.dcruver.goalrec.domain.ErrorKind;
import com.dcruver.goalrec.domain.model.InMemoryGroundedModel;
import com.dcruver.goalrec.domain.model.Plan;
import com.dcruver.goalrec.domain.posterior.PosteriorAccumulator;
import com.dcruver.goalrec.domain.posterior.PosteriorTable;
import com.dcruver.goalrec.domain.scoring.DecompositionScorer;
import com.dcruver.goalrec.domain.scoring.HypothesisScore;
import com.dcruver.goalrec.domain.scoring.LikelihoodCombiner;
import com.dcruver.goalrec.domain.scoring.LinearizationScorer;
import com.dcruver.goalrec.domain.scoring.ObservabilityMode;
import com.dcruver.goalrec.domain.scoring.ObservationAlignmentScorer;
import com.dcruver.goalrec.domain.scoring.OrderingConstraintResolver;
import com.dcruver.goalrec.io.HypothesisIdentifier;
import com.dcruver.goalrec.io.ObservationFileReader;
import com.dcruver.goalrec.io.PlannerTraceReader;
import com.dcruver.goalrec.io.TraceExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scoring from planner logs on disk.
 */
class GoalRecognitionServiceTest {

    static final String SINGLE_ACTION_LOG = """
        ==>
        0 a
        root 1
        1 t1 -> m1 0
        <==
        """;

    private InMemoryGroundedModel model;
    private GoalRecognitionService service;
    private ScoringOptions fullObservability;

    private int a;
    private int b;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        model = singleTaskModel();
        a = model.findTaskId("a").getAsInt();
        b = model.findTaskId("b").getAsInt();
        service = newService();
        fullObservability = new ScoringOptions(ObservabilityMode.FULL, 0.9);
    }

    /**
     * Compound task t1 with two single-action methods; b is an unrelated action
     */
    static InMemoryGroundedModel singleTaskModel() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int a = builder.primitive("a");
        builder.primitive("b");
        int t1 = builder.compound("t1");
        builder.method("m1", t1, List.of(a), List.of());
        builder.method("m2", t1, List.of(a), List.of());
        return builder.build();
    }

    static GoalRecognitionService newService() {
        PlannerTraceReader reader = new PlannerTraceReader();
        HypothesisScorer scorer = new HypothesisScorer(new OrderingConstraintResolver(), new DecompositionScorer(),
            new LinearizationScorer(), new ObservationAlignmentScorer(), new LikelihoodCombiner());
        return new GoalRecognitionService(reader, new TraceExtractor(reader), new HypothesisIdentifier(),
            new ObservationFileReader(), scorer);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testSingleActionScenario() throws Exception {
        HypothesisRequest request = HypothesisRequest.builder()
            .hypothesis("h1")
            .observationLog(write("h1-obs.log", SINGLE_ACTION_LOG))
            .baselineLog(write("h1-base.log", SINGLE_ACTION_LOG))
            .build();

        HypothesisOutcome outcome = service.score(model, request, fullObservability, 1);

        assertTrue(outcome.isScored());
        HypothesisScore score = outcome.getScore();
        assertEquals(0.5, score.getObservedStage1(), 1e-12);
        assertEquals(1.0, score.getObservedStage2(), 1e-12);
        assertEquals(0.5, score.getObservedStage3(), 1e-12);
        assertEquals(0.25, score.getNumerator(), 1e-12);
        assertEquals(0.5, score.getDenominator(), 1e-12);
        assertEquals(0.5, score.getNormalizedLikelihood(), 1e-12);
        assertEquals(1, score.getObservationCount());
    }

    @Test
    void testHypothesisNameFromLog() throws Exception {
        String log = """
            ==>
            0 a
            root 1
            1 mtlt[] -> goal-a 2
            2 t1 -> m2 0
            <==
            """;
        HypothesisRequest request = HypothesisRequest.builder()
            .observationLog(write("run-7.log", log))
            .baselineLog(write("base.log", SINGLE_ACTION_LOG))
            .build();

        HypothesisOutcome outcome = service.score(model, request, fullObservability, 1);

        assertEquals("goal-a", outcome.getHypothesis());
        assertEquals("goal-a", service.identifyHypothesis(request.getObservationLog()));
    }

    @Test
    void testFormatErrorIsContained() throws Exception {
        HypothesisRequest request = HypothesisRequest.builder()
            .hypothesis("h2")
            .observationLog(write("h2-obs.log", "Problem was proven unsolvable\n"))
            .baselineLog(write("h2-base.log", SINGLE_ACTION_LOG))
            .build();

        HypothesisOutcome outcome = service.score(model, request, fullObservability, 2);

        assertFalse(outcome.isScored());
        assertEquals("h2", outcome.getHypothesis());
        assertEquals(ErrorKind.FORMAT, outcome.getErrorKind());
    }

    @Test
    void testUnnamedFailureFallsBackToFileName() {
        HypothesisRequest request = HypothesisRequest.builder()
            .observationLog(tempDir.resolve("missing-goal.log"))
            .baselineLog(tempDir.resolve("missing-base.log"))
            .build();

        HypothesisOutcome outcome = service.score(model, request, fullObservability, 1);

        assertEquals(tempDir.getFileName() + "/missing-goal", outcome.getHypothesis());
        assertEquals(ErrorKind.FORMAT, outcome.getErrorKind());
    }

    @Test
    void testSameLogNameInDifferentDirectoriesStaysDistinct() throws Exception {
        Files.createDirectories(tempDir.resolve("h1"));
        Files.createDirectories(tempDir.resolve("h2"));
        Path baseline = write("base.log", SINGLE_ACTION_LOG);
        HypothesisRequest first = HypothesisRequest.builder()
            .observationLog(write("h1/obs_pgr.log", SINGLE_ACTION_LOG))
            .baselineLog(baseline)
            .build();
        HypothesisRequest second = HypothesisRequest.builder()
            .hypothesis("  ")
            .observationLog(write("h2/obs_pgr.log", SINGLE_ACTION_LOG))
            .baselineLog(baseline)
            .build();

        PosteriorAccumulator accumulator = new PosteriorAccumulator();
        String firstName = service.score(model, first, fullObservability, 1).recordInto(accumulator);
        String secondName = service.score(model, second, fullObservability, 2).recordInto(accumulator);
        PosteriorTable table = accumulator.snapshot();

        assertEquals("h1/obs_pgr", firstName);
        assertEquals("h2/obs_pgr", secondName);
        assertEquals(2, table.size());
        assertEquals(0.5, table.find("h2/obs_pgr").orElseThrow().getPosterior(), 1e-12);
    }

    @Test
    void testDuplicateNameIsRecordedAsFailure() throws Exception {
        String log = """
            ==>
            0 a
            root 1
            1 mtlt[] -> goal-a 2
            2 t1 -> m1 0
            <==
            """;
        Path baseline = write("base.log", SINGLE_ACTION_LOG);
        HypothesisRequest first = HypothesisRequest.builder()
            .observationLog(write("run-1.log", log))
            .baselineLog(baseline)
            .build();
        HypothesisRequest second = HypothesisRequest.builder()
            .observationLog(write("run-2.log", log))
            .baselineLog(baseline)
            .build();

        PosteriorAccumulator accumulator = new PosteriorAccumulator();
        service.score(model, first, fullObservability, 1).recordInto(accumulator);
        String secondName = service.score(model, second, fullObservability, 2).recordInto(accumulator);
        PosteriorTable table = accumulator.snapshot();

        assertEquals("goal-a#2", secondName);
        assertEquals(1.0, table.find("goal-a").orElseThrow().getPosterior(), 1e-12);
        assertEquals(1, table.getFailures().size());
        assertEquals("goal-a#2", table.getFailures().get(0).getHypothesis());
        assertEquals(ErrorKind.FORMAT, table.getFailures().get(0).getKind());
    }

    @Test
    void testTaskWithSingleMethodCarriesNoChoice() throws Exception {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int a = builder.primitive("a");
        int t1 = builder.compound("t1");
        builder.method("m1", t1, List.of(a), List.of());
        InMemoryGroundedModel degenerate = builder.build();

        HypothesisRequest request = HypothesisRequest.builder()
            .hypothesis("h3")
            .observationLog(write("h3-obs.log", SINGLE_ACTION_LOG))
            .baselineLog(write("h3-base.log", SINGLE_ACTION_LOG))
            .build();

        HypothesisOutcome outcome = service.score(degenerate, request,
            new ScoringOptions(ObservabilityMode.FULL, 0.9), 1);
        assertTrue(outcome.isScored());
        assertEquals(1.0, outcome.getScore().getObservedStage1(), 1e-12);
        assertEquals(1.0, outcome.getScore().getDenominator(), 1e-12);
        assertEquals(0.5, outcome.getScore().getNormalizedLikelihood(), 1e-12);
    }

    @Test
    void testObservationFileWithPartialObservability() throws Exception {
        String log = """
            ==>
            0 a
            1 b
            root 2
            2 t1 -> m1 0
            <==
            """;
        HypothesisRequest request = HypothesisRequest.builder()
            .hypothesis("h1")
            .observationLog(write("obs.log", log))
            .baselineLog(write("base.log", SINGLE_ACTION_LOG))
            .observationFile(write("observations.txt", "# observed\nb\nunknown\n"))
            .build();

        HypothesisOutcome outcome = service.score(model, request,
            new ScoringOptions(ObservabilityMode.PARTIAL, 0.5), 1);

        // b seen after a was missed: 0.5 * 0.5, prior 1/3
        assertTrue(outcome.isScored());
        assertEquals(1, outcome.getScore().getObservationCount());
        assertEquals(0.25 / 3.0, outcome.getScore().getObservedStage3(), 1e-12);
    }

    @Test
    void testObservationCountTakesPlanPrefix() {
        Plan plan = Plan.of(List.of(a, b));

        HypothesisRequest prefixed = HypothesisRequest.builder().observationCount(1).build();
        HypothesisRequest whole = HypothesisRequest.builder().build();
        HypothesisRequest tooMany = HypothesisRequest.builder().observationCount(5).build();

        assertEquals(List.of(a), service.observations(model, prefixed, plan));
        assertEquals(List.of(a, b), service.observations(model, whole, plan));
        assertEquals(List.of(a, b), service.observations(model, tooMany, plan));
    }

    @Test
    void testOutcomesFeedThePosterior() throws Exception {
        HypothesisRequest good = HypothesisRequest.builder()
            .hypothesis("h1")
            .observationLog(write("h1-obs.log", SINGLE_ACTION_LOG))
            .baselineLog(write("h1-base.log", SINGLE_ACTION_LOG))
            .build();
        HypothesisRequest broken = HypothesisRequest.builder()
            .hypothesis("h2")
            .observationLog(write("h2-obs.log", "==>\n<==\n"))
            .baselineLog(write("h2-base.log", SINGLE_ACTION_LOG))
            .build();

        PosteriorAccumulator accumulator = new PosteriorAccumulator();
        service.score(model, good, fullObservability, 1).recordInto(accumulator);
        service.score(model, broken, fullObservability, 2).recordInto(accumulator);
        PosteriorTable table = accumulator.snapshot();

        assertEquals(1, table.size());
        assertEquals(1.0, table.find("h1").orElseThrow().getPosterior(), 1e-12);
        assertEquals(ErrorKind.FORMAT, table.getFailures().get(0).getKind());
    }
}

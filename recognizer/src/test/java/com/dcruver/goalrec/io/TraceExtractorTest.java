package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import com.dcruver.goalrec.domain.model.InMemoryGroundedModel;
import com.dcruver.goalrec.domain.model.SubtaskOrdering;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests resolving planner logs against a small delivery model.
 */
class TraceExtractorTest {

    private InMemoryGroundedModel model;
    private TraceExtractor extractor;

    private int drive;
    private int load;
    private int mDeliverDriveLoad;
    private int mTop;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        drive = builder.primitive("drive[a,b]");
        load = builder.primitive("load[p]");
        int deliver = builder.compound("deliver[p]");
        int top = builder.compound("top[]");
        mDeliverDriveLoad = builder.method("m-deliver-1", deliver, List.of(drive, load),
            List.of(new SubtaskOrdering(0, 1)));
        builder.method("m-deliver-2", deliver, List.of(load), List.of());
        mTop = builder.method("m-top", top, List.of(deliver), List.of());
        model = builder.build();

        extractor = new TraceExtractor(new PlannerTraceReader());
    }

    @Test
    void testExtractsPlanAndMethodChoices() throws Exception {
        String log = """
            ==>
            0 drive[a,b]
            1 LOAD[P]
            2 unknown[z]
            root 3
            3 top[] -> m-top 4
            4 deliver[p] -> m-deliver-1 0 1
            0 drive[a,b]
            5 drive[a,b] -> leaf
            <==
            """;
        Path logFile = tempDir.resolve("obs.log");
        Files.writeString(logFile, log);

        ExtractedTrace trace = extractor.extract(logFile, model);

        assertEquals(List.of(drive, load), trace.getPlan().getActions());
        assertEquals(Map.of("deliver[p]", 2, "top[]", 1), trace.getDecomposition().getMethodCounts());
        assertEquals(Set.of(mDeliverDriveLoad, mTop), trace.getDecomposition().getUsedMethodIds());
        assertEquals(List.of("unknown[z]"), trace.getUnresolvedNames());
    }

    @Test
    void testRepeatedTaskCountedOnce() {
        List<String> lines = List.of(
            "==>",
            "0 load[p]",
            "1 load[p]",
            "root 2",
            "2 deliver[p] -> m-deliver-2 0",
            "3 deliver[p] -> m-deliver-2 1",
            "<==");

        ExtractedTrace trace = extractor.extract(new PlannerTraceReader().parse(lines, "inline"), model);

        assertEquals(Map.of("deliver[p]", 2), trace.getDecomposition().getMethodCounts());
        assertEquals(2, trace.getPlan().size());
    }

    @Test
    void testUnknownMethodIsRecordedButTaskStillCounts() {
        List<String> lines = List.of("==>", "0 load[p]", "root 1", "1 deliver[p] -> m-unknown 0", "<==");

        ExtractedTrace trace = extractor.extract(new PlannerTraceReader().parse(lines, "inline"), model);

        assertEquals(Map.of("deliver[p]", 2), trace.getDecomposition().getMethodCounts());
        assertTrue(trace.getDecomposition().getUsedMethodIds().isEmpty());
        assertTrue(trace.getUnresolvedNames().contains("m-unknown"));
    }

    @Test
    void testLogWithoutDecompositionSection() {
        PlannerTrace trace = new PlannerTraceReader().parse(List.of("==>", "0 load[p]", "<=="), "flat.log");

        ExtractedTrace extracted = extractor.extract(trace, model);

        assertFalse(trace.isDecompositionSectionFound());
        assertTrue(extracted.getDecomposition().isEmpty());
        assertEquals(List.of(load), extracted.getPlan().getActions());
    }

    @Test
    void testMissingPlanSectionIsAFormatError() {
        List<String> lines = List.of("Problem unsolvable");

        PlannerTrace trace = new PlannerTraceReader().parse(lines, "failed.log");

        InputFormatException e = assertThrows(InputFormatException.class,
            () -> extractor.extract(trace, model));
        assertTrue(e.getMessage().contains("failed.log"));
    }

    @Test
    void testEmptyPlanSectionIsAFormatError() {
        PlannerTrace trace = new PlannerTraceReader().parse(List.of("==>", "<=="), "empty.log");

        assertThrows(InputFormatException.class, () -> extractor.extract(trace, model));
    }

    @Test
    void testMissingFileIsAFormatError() {
        assertThrows(InputFormatException.class,
            () -> extractor.extract(tempDir.resolve("missing.log"), model));
    }

    @Test
    void testCompoundNamesInPlanAreDropped() {
        List<String> unresolved = new ArrayList<>();

        List<Integer> actions = extractor.resolveActions(
            List.of("drive[a,b]", "deliver[p]"), model, unresolved, "inline");

        assertEquals(List.of(drive), actions);
        assertEquals(List.of("deliver[p]"), unresolved);
    }
}

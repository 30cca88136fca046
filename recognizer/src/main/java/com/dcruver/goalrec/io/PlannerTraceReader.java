package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads planner logs into a {@link PlannerTrace}.
 * Runs a small state machine over classified lines: the plan section opens at
 * "==>" and closes at the decomposition root or "<==", the decomposition section
 * opens at "root" and closes at "<==".
 */
@Component
@Slf4j
public class PlannerTraceReader {

    private enum Section {
        OUTSIDE,
        IN_PLAN,
        IN_DECOMPOSITION,
        DONE
    }

    private final TraceLineClassifier classifier = new TraceLineClassifier();

    /**
     * Read and parse a planner log file
     */
    public PlannerTrace read(Path logFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile);
        } catch (IOException e) {
            throw new InputFormatException("Cannot read planner log " + logFile + ": " + e.getMessage(), e);
        }
        return parse(lines, logFile.toString());
    }

    public PlannerTrace parse(List<String> lines, String source) {
        List<TraceLine> classified = new ArrayList<>(lines.size());
        List<String> planSteps = new ArrayList<>();
        List<TraceLine> records = new ArrayList<>();
        boolean planFound = false;
        boolean decompositionFound = false;

        Section section = Section.OUTSIDE;
        for (int i = 0; i < lines.size(); i++) {
            TraceLine line = classifier.classify(lines.get(i), i + 1);
            classified.add(line);

            if (line.getKind() == TraceLineKind.PSEUDO_RECORD) {
                continue;
            }

            switch (section) {
                case OUTSIDE -> {
                    if (line.getKind() == TraceLineKind.PLAN_START) {
                        planFound = true;
                        section = Section.IN_PLAN;
                    } else if (line.getKind() == TraceLineKind.DECOMPOSITION_ROOT) {
                        decompositionFound = true;
                        section = Section.IN_DECOMPOSITION;
                    }
                }
                case IN_PLAN -> {
                    switch (line.getKind()) {
                        case STEP -> planSteps.add(line.getName());
                        case DECOMPOSITION_ROOT -> {
                            decompositionFound = true;
                            section = Section.IN_DECOMPOSITION;
                        }
                        case PLAN_END -> section = Section.DONE;
                        default -> log.trace("{}:{} ignored in plan section: {}",
                            source, line.getLineNumber(), line.getRaw());
                    }
                }
                case IN_DECOMPOSITION -> {
                    if (line.getKind() == TraceLineKind.DECOMPOSITION_RECORD) {
                        records.add(line);
                    } else if (line.getKind() == TraceLineKind.PLAN_END) {
                        section = Section.DONE;
                    }
                }
                case DONE -> {
                    // Trailing output is kept in the classified lines only
                }
            }
        }

        log.debug("Parsed {}: {} lines, {} plan steps, {} decomposition records",
            source, classified.size(), planSteps.size(), records.size());

        return PlannerTrace.builder()
            .source(source)
            .planSectionFound(planFound)
            .decompositionSectionFound(decompositionFound)
            .planSteps(List.copyOf(planSteps))
            .decompositionRecords(List.copyOf(records))
            .lines(List.copyOf(classified))
            .build();
    }
}

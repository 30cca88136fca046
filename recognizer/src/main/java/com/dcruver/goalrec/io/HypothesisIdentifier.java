package com.dcruver.goalrec.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Names the goal hypothesis an observation-constrained plan committed to.
 * Scans the whole log in line order and returns the first match: either the
 * method of a top-level wrapper task (mtlt/tlt) inside a decomposition tree,
 * or an abstract-task record anywhere in the log. A tree opens at "root" and
 * closes at "<==" or a "===" banner.
 */
@Component
@Slf4j
public class HypothesisIdentifier {

    private static final String MULTI_TOP_LEVEL_TASK = "mtlt[]";
    private static final String TOP_LEVEL_TASK = "tlt[]";
    private static final String BANNER_PREFIX = "===";

    public Optional<String> identify(PlannerTrace trace) {
        boolean inTree = false;

        for (TraceLine line : trace.getLines()) {
            Optional<String> hypothesis = inTree ? fromTopLevelRecord(line) : Optional.empty();
            if (hypothesis.isEmpty()) {
                hypothesis = fromAbstractRecord(line);
            }
            if (hypothesis.isPresent()) {
                log.debug("{}: hypothesis {} at line {}", trace.getSource(), hypothesis.get(), line.getLineNumber());
                return hypothesis;
            }

            if (line.getKind() == TraceLineKind.DECOMPOSITION_ROOT) {
                inTree = true;
            } else if (line.getKind() == TraceLineKind.PLAN_END || line.getRaw().strip().startsWith(BANNER_PREFIX)) {
                inTree = false;
            }
        }
        return Optional.empty();
    }

    private Optional<String> fromTopLevelRecord(TraceLine line) {
        if (line.getTarget() == null) {
            return Optional.empty();
        }
        String task = line.getName();
        if (!task.contains(MULTI_TOP_LEVEL_TASK) && !task.contains(TOP_LEVEL_TASK)) {
            return Optional.empty();
        }
        String hypothesis = firstToken(stripMethodEncoding(line.getTarget()));
        if (hypothesis.isEmpty() || hypothesis.startsWith("__")) {
            return Optional.empty();
        }
        return Optional.of(hypothesis);
    }

    private Optional<String> fromAbstractRecord(TraceLine line) {
        if (line.getKind() != TraceLineKind.PSEUDO_RECORD || !line.getRaw().contains(TraceLineClassifier.ABSTRACT_MARKER)) {
            return Optional.empty();
        }
        String task = line.getName();
        if (task.isEmpty() || task.startsWith("__") || task.startsWith("_!") || task.contains("[")) {
            return Optional.empty();
        }
        return Optional.of(task);
    }

    /**
     * "<<hyp;..." and "<hyp;..." encode the method by its subtasks; keep the first entry
     */
    private String stripMethodEncoding(String target) {
        String text = target.strip();
        int prefix = text.startsWith("<<") ? 2 : text.startsWith("<") ? 1 : 0;
        if (prefix == 0) {
            return text;
        }
        int end = text.indexOf(';');
        return end < 0 ? text : text.substring(prefix, end).strip();
    }

    private String firstToken(String text) {
        String stripped = text.strip();
        int space = stripped.indexOf(' ');
        return space < 0 ? stripped : stripped.substring(0, space);
    }
}

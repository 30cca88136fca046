package com.dcruver.goalrec.io;

/**
 * Decides what a single planner log line means.
 * Matching is purely textual; the reader decides what to do with each kind.
 */
public class TraceLineClassifier {

    static final String PLAN_START_MARKER = "==>";
    static final String END_MARKER = "<==";
    static final String ROOT_PREFIX = "root ";
    static final String ARROW = "->";
    static final String RECORD_ARROW = " -> ";
    static final String ABSTRACT_MARKER = "<abs>";
    static final String METHOD_PRECONDITION_PREFIX = "__method_precondition";

    public TraceLine classify(String rawLine, int lineNumber) {
        String line = rawLine.strip();
        TraceLine.TraceLineBuilder builder = TraceLine.builder()
            .lineNumber(lineNumber)
            .raw(rawLine);

        if (line.isEmpty()) {
            return builder.kind(TraceLineKind.BLANK).build();
        }
        if (line.contains(END_MARKER)) {
            return builder.kind(TraceLineKind.PLAN_END).build();
        }
        if (line.contains(PLAN_START_MARKER)) {
            return builder.kind(TraceLineKind.PLAN_START).build();
        }
        if (line.startsWith(ROOT_PREFIX)) {
            return builder.kind(TraceLineKind.DECOMPOSITION_ROOT).build();
        }

        int firstSpace = line.indexOf(' ');
        if (line.contains(ARROW)) {
            return classifyRecord(line, firstSpace, builder);
        }
        if (line.contains(ABSTRACT_MARKER) || firstSpace < 0) {
            return builder.kind(TraceLineKind.OTHER).build();
        }

        String action = line.substring(firstSpace + 1).strip();
        if (action.isEmpty()) {
            return builder.kind(TraceLineKind.OTHER).build();
        }
        return builder.kind(TraceLineKind.STEP)
            .recordId(line.substring(0, firstSpace))
            .name(action)
            .build();
    }

    private TraceLine classifyRecord(String line, int firstSpace, TraceLine.TraceLineBuilder builder) {
        int arrow = line.indexOf(RECORD_ARROW);
        if (firstSpace < 0 || arrow < 0 || arrow <= firstSpace) {
            return builder.kind(TraceLineKind.OTHER).build();
        }

        String task = line.substring(firstSpace + 1, arrow).strip();
        String target = line.substring(arrow + RECORD_ARROW.length()).strip();
        builder.recordId(line.substring(0, firstSpace)).target(target);

        if (task.startsWith(ABSTRACT_MARKER)) {
            return builder.kind(TraceLineKind.PSEUDO_RECORD)
                .name(task.substring(ABSTRACT_MARKER.length()).strip())
                .build();
        }
        if (task.startsWith(METHOD_PRECONDITION_PREFIX)) {
            return builder.kind(TraceLineKind.PSEUDO_RECORD).name(task).build();
        }
        return builder.kind(TraceLineKind.DECOMPOSITION_RECORD).name(task).build();
    }
}

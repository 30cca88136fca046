package com.dcruver.goalrec.io;

import lombok.Builder;
import lombok.Data;

/**
 * A classified planner log line.
 * {@code name} is the action of a step or the task of a record,
 * {@code target} is the text after the arrow of a record.
 */
@Data
@Builder
public class TraceLine {
    private final TraceLineKind kind;
    private final int lineNumber;
    private final String raw;
    private final String recordId;
    private final String name;
    private final String target;

    /**
     * First token of the record target, usually the method name
     */
    public String getTargetHead() {
        if (target == null || target.isEmpty()) {
            return "";
        }
        int space = target.indexOf(' ');
        return space < 0 ? target : target.substring(0, space);
    }
}

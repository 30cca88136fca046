package com.dcruver.goalrec.domain.scoring;

import lombok.Data;

/**
 * Task {@code before} must be executed before task {@code after}.
 */
@Data
public class Precedence {
    private final int before;
    private final int after;

    public boolean isSelfLoop() {
        return before == after;
    }
}

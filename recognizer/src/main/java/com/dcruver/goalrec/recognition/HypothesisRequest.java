package com.dcruver.goalrec.recognition;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Inputs for scoring one hypothesis.
 * Without a hypothesis name, the name is taken from the observation log.
 * Observations come from {@code observationFile} when set, otherwise from the first
 * {@code observationCount} actions of the observation-consistent plan (all of them when null).
 */
@Value
@Builder
public class HypothesisRequest {
    String hypothesis;
    Path observationLog;
    Path baselineLog;
    Path observationFile;
    Integer observationCount;
}

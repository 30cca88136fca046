package com.dcruver.goalrec.domain.scoring;

/**
 * How observations relate to the executed plan.
 */
public enum ObservabilityMode {
    FULL,     // Observations are exactly the executed prefix
    PARTIAL   // Observations are a noisy subsequence of the executed prefix
}

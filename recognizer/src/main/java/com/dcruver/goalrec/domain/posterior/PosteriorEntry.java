package com.dcruver.goalrec.domain.posterior;

import lombok.Value;

/**
 * Posterior of one scored hypothesis.
 */
@Value
public class PosteriorEntry {
    String hypothesis;
    double likelihood;
    double posterior;
    int discoveryIndex;  // 0-based position in scoring order
}

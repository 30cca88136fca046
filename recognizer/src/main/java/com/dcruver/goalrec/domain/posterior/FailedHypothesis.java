package com.dcruver.goalrec.domain.posterior;

import com.dcruver.goalrec.domain.ErrorKind;
import lombok.Value;

/**
 * A hypothesis that could not be scored. Excluded from normalization.
 */
@Value
public class FailedHypothesis {
    String hypothesis;
    ErrorKind kind;
    String message;
    int discoveryIndex;
}

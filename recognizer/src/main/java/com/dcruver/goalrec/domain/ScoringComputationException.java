package com.dcruver.goalrec.domain;

/**
 * A likelihood or posterior cannot be computed from the given probabilities.
 */
public class ScoringComputationException extends RecognitionException {

    public ScoringComputationException(String message) {
        super(ErrorKind.COMPUTATION, message);
    }
}

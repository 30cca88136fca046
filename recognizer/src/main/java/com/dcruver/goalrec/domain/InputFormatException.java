package com.dcruver.goalrec.domain;

/**
 * A planner trace, model or other input file is missing required content
 * or cannot be read.
 */
public class InputFormatException extends RecognitionException {

    public InputFormatException(String message) {
        super(ErrorKind.FORMAT, message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(ErrorKind.FORMAT, message, cause);
    }
}

package com.dcruver.goalrec.domain;

import lombok.Getter;

/**
 * Base class for errors that make a hypothesis (or a posterior step) unscorable.
 */
@Getter
public abstract class RecognitionException extends RuntimeException {

    private final ErrorKind kind;

    protected RecognitionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RecognitionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

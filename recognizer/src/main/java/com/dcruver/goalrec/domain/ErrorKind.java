package com.dcruver.goalrec.domain;

/**
 * Tag attached to a hypothesis that could not be scored.
 */
public enum ErrorKind {
    FORMAT,       // Missing or malformed plan section, unreadable input
    COMPUTATION,  // Zero or non-finite denominator, unnormalizable posterior
    INTERNAL      // Unexpected failure while scoring
}

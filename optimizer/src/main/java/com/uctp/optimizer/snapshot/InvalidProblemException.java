package com.uctp.optimizer.snapshot;

/**
 * Thrown when an optimization request refers to something it does not define,
 * such as a batch requiring an unknown subject.
 */
public class InvalidProblemException extends RuntimeException {
    public InvalidProblemException(String message) {
        super(message);
    }
}

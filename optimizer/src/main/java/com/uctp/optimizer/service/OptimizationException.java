package com.uctp.optimizer.service;

/** A worker task of the search failed; the run cannot continue. */
public class OptimizationException extends RuntimeException {

    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}

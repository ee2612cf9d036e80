package com.whodunit.logic;

/**
 * The solver could not decide a query.
 */
public class SatisfiabilityException extends RuntimeException {

    public SatisfiabilityException(String message) {
        super(message);
    }

    public SatisfiabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}

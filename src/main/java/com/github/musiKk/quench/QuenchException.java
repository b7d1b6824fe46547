package com.github.musiKk.quench;

/**
 * Base of all failures the tooling reports to its callers.
 */
public class QuenchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public QuenchException(String message) {
        super(message);
    }

    public QuenchException(String message, Throwable cause) {
        super(message, cause);
    }
}

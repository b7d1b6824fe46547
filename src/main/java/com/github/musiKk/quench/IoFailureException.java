package com.github.musiKk.quench;

/**
 * Reading a source file, writing generated code or running it failed. The
 * message names the path or command involved.
 */
public class IoFailureException extends QuenchException {

    private static final long serialVersionUID = 1L;

    public IoFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.deepansh.lineage.exception;

/**
 * Base unchecked exception for failures the service cannot recover from locally.
 */
public class LineageAgentException extends RuntimeException {

    public LineageAgentException(String message) {
        super(message);
    }

    public LineageAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.phodal.tracegen.exception;

/**
 * Base class of every error raised while generating or exporting traces.
 */
public abstract class TracingException extends RuntimeException {

    protected TracingException(String message) {
        super(message);
    }

    protected TracingException(String message, Throwable cause) {
        super(message, cause);
    }
}

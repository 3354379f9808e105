package com.phodal.tracegen.exception;

/**
 * Malformed generator input: negative sizes or counts, bad IDs, unsupported attribute values.
 */
public class InvalidParameterException extends TracingException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public static InvalidParameterException forTrace(int traceIndex, String message) {
        return new InvalidParameterException("trace params[" + traceIndex + "] invalid: " + message);
    }
}

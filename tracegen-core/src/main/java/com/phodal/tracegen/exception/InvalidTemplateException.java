package com.phodal.tracegen.exception;

import lombok.Getter;

/**
 * A trace template that cannot be turned into a consistent trace tree.
 */
@Getter
public class InvalidTemplateException extends TracingException {

    /**
     * Index of the offending span template, or -1 when the problem is not tied to one span.
     */
    private final int spanIndex;

    public InvalidTemplateException(String message) {
        this(-1, message);
    }

    public InvalidTemplateException(int spanIndex, String message) {
        super(spanIndex < 0
                ? "trace template invalid: " + message
                : "trace template invalid: spans[" + spanIndex + "]: " + message);
        this.spanIndex = spanIndex;
    }
}

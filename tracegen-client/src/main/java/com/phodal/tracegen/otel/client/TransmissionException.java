package com.phodal.tracegen.otel.client;

import com.phodal.tracegen.exception.TracingException;
import lombok.Getter;

/**
 * A connected send that failed: rejected by the collector, timed out or not encodable.
 */
@Getter
public class TransmissionException extends TracingException {

    private final String endpoint;
    private final String exporter;
    private final int spanCount;
    private final int traceCount;

    public TransmissionException(String endpoint, String exporter, int spanCount, int traceCount,
                                 String message, Throwable cause) {
        super("failed to send " + spanCount + " spans of " + traceCount + " traces via " + exporter
                + " to " + endpoint + ": " + message, cause);
        this.endpoint = endpoint;
        this.exporter = exporter;
        this.spanCount = spanCount;
        this.traceCount = traceCount;
    }
}

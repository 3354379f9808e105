package com.phodal.tracegen.otel.client;

import com.phodal.tracegen.exception.TracingException;
import lombok.Getter;

/**
 * The collector could not be reached: refused or reset connections, DNS failures, TLS handshake
 * errors.
 */
@Getter
public class ConnectionException extends TracingException {

    private final String endpoint;
    private final String exporter;
    private final int spanCount;
    private final int traceCount;

    public ConnectionException(String endpoint, String exporter, int spanCount, int traceCount,
                               String message, Throwable cause) {
        super("cannot connect to " + endpoint + " via " + exporter + " (" + spanCount + " spans of "
                + traceCount + " traces not sent): " + message, cause);
        this.endpoint = endpoint;
        this.exporter = exporter;
        this.spanCount = spanCount;
        this.traceCount = traceCount;
    }
}

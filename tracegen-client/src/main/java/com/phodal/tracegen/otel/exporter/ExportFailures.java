package com.phodal.tracegen.otel.exporter;

import com.phodal.tracegen.exception.TracingException;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.otel.client.ConnectionException;
import com.phodal.tracegen.otel.client.TransmissionException;

import java.io.IOException;
import java.util.List;

/**
 * Maps transport errors onto the client's exception types.
 */
final class ExportFailures {

    private ExportFailures() {
    }

    /**
     * An {@link IOException} anywhere in the cause chain means the request never reached the
     * collector; everything else is a failed transmission.
     */
    static TracingException classify(String endpoint, String exporter, List<Span> spans, Throwable error) {
        if (error instanceof TracingException tracingException) {
            return tracingException;
        }
        String message = error != null && error.getMessage() != null ? error.getMessage() : "export failed";
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return new ConnectionException(endpoint, exporter, spans.size(), traceCount(spans), message, error);
            }
        }
        return transmission(endpoint, exporter, spans, message, error);
    }

    static TransmissionException transmission(String endpoint, String exporter, List<Span> spans,
                                              String message, Throwable cause) {
        return new TransmissionException(endpoint, exporter, spans.size(), traceCount(spans), message, cause);
    }

    static int traceCount(List<Span> spans) {
        return (int) spans.stream().map(Span::getTraceId).distinct().count();
    }
}

package com.phodal.tracegen.otel.exporter;

import com.phodal.tracegen.model.Span;

import java.util.List;

/**
 * One wire protocol towards a trace collector.
 */
public interface WireExporter {

    /**
     * Encodes and sends the spans, blocking until the collector answered or the configured
     * timeout elapsed.
     *
     * @throws com.phodal.tracegen.otel.client.ConnectionException   if the collector is unreachable
     * @throws com.phodal.tracegen.otel.client.TransmissionException if the send failed otherwise
     */
    void export(List<Span> spans);

    /**
     * Get exporter name
     */
    String getName();

    /**
     * Flushes and releases the transport. Called once.
     */
    void shutdown();
}

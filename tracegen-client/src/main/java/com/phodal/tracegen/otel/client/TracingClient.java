package com.phodal.tracegen.otel.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracegen.exception.TracingException;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.otel.config.TracingClientProperties;
import com.phodal.tracegen.otel.exporter.JaegerWireExporter;
import com.phodal.tracegen.otel.exporter.OtlpWireExporter;
import com.phodal.tracegen.otel.exporter.WireExporter;
import com.phodal.tracegen.random.RandomSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe client pushing generated traces to a collector.
 * <p>
 * The transport is created on the first send. Sends run concurrently; {@link #shutdown()} waits
 * for in-flight sends, closes the transport once and makes every later send fail with
 * {@link ClientClosedException}.
 */
@Slf4j
public class TracingClient {

    public enum State {
        CREATED,
        CONNECTED,
        SHUT_DOWN
    }

    /**
     * Creates the transport for a configuration and the resolved request headers.
     */
    @FunctionalInterface
    public interface ExporterFactory {
        WireExporter create(TracingClientProperties properties, Map<String, String> headers) throws IOException;
    }

    public static final String SPANS_METRIC = "tracegen.client.spans";
    public static final String REQUESTS_METRIC = "tracegen.client.requests";

    private final TracingClientProperties properties;
    private final ExporterFactory exporterFactory;
    private final MeterRegistry meterRegistry;
    private final RandomSource random;
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object connectLock = new Object();
    private volatile WireExporter exporter;

    public TracingClient(TracingClientProperties properties, MeterRegistry meterRegistry, ObjectMapper objectMapper) {
        this(properties, meterRegistry, defaultFactory(objectMapper), RandomSource.create());
    }

    public TracingClient(TracingClientProperties properties,
                         MeterRegistry meterRegistry,
                         ExporterFactory exporterFactory,
                         RandomSource random) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.exporterFactory = exporterFactory;
        this.random = random;
    }

    static ExporterFactory defaultFactory(ObjectMapper objectMapper) {
        return (properties, headers) -> {
            switch (properties.getExporter()) {
                case JAEGER:
                    return new JaegerWireExporter(properties, headers, objectMapper);
                case OTLP_HTTP:
                case OTLP:
                default:
                    return new OtlpWireExporter(properties, headers);
            }
        };
    }

    /**
     * Sends all spans of the given traces as one batch.
     *
     * @throws ConnectionException   if the collector cannot be reached
     * @throws TransmissionException if the collector rejected or did not acknowledge the batch
     * @throws ClientClosedException if the client has been shut down
     */
    public void push(List<Trace> traces) {
        List<Span> spans = new ArrayList<>();
        for (Trace trace : traces) {
            spans.addAll(trace.getSpans());
        }
        send(spans);
    }

    /**
     * Sends spans without any assumption about the traces they belong to.
     */
    public void send(List<Span> spans) {
        lock.readLock().lock();
        try {
            if (state.get() == State.SHUT_DOWN) {
                throw new ClientClosedException(properties.getEndpoint());
            }
            if (spans.isEmpty()) {
                return;
            }
            WireExporter wire = connect();
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "success";
            try {
                wire.export(spans);
            } catch (TracingException e) {
                outcome = "failure";
                log.warn("Failed to send {} spans: {}", spans.size(), e.getMessage());
                throw e;
            } finally {
                sample.stop(Timer.builder(REQUESTS_METRIC)
                        .description("Export requests sent to the collector")
                        .tag("exporter", wire.getName())
                        .tag("outcome", outcome)
                        .register(meterRegistry));
                Counter.builder(SPANS_METRIC)
                        .description("Spans handed to the collector")
                        .tag("exporter", wire.getName())
                        .tag("outcome", outcome)
                        .register(meterRegistry)
                        .increment(spans.size());
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Generates and sends a small built-in trace.
     */
    public Trace sendFake() {
        Trace trace = FakeTraces.trace(random);
        push(List.of(trace));
        log.info("Sent smoke test trace {} to {}", trace.getTraceId(), properties.getEndpoint());
        return trace;
    }

    /**
     * Closes the transport. Waits for in-flight sends, never throws, and does nothing when called
     * again.
     */
    public void shutdown() {
        lock.writeLock().lock();
        try {
            State previous = state.getAndSet(State.SHUT_DOWN);
            if (previous == State.SHUT_DOWN) {
                log.debug("Tracing client for {} already shut down", properties.getEndpoint());
                return;
            }
            WireExporter wire = exporter;
            if (wire == null) {
                return;
            }
            try {
                wire.shutdown();
            } catch (RuntimeException e) {
                log.warn("Error while shutting down {} exporter: {}", wire.getName(), e.getMessage(), e);
            }
            log.info("Tracing client for {} shut down", properties.getEndpoint());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public State getState() {
        return state.get();
    }

    private WireExporter connect() {
        WireExporter wire = exporter;
        if (wire != null) {
            return wire;
        }
        synchronized (connectLock) {
            if (exporter == null) {
                try {
                    exporter = exporterFactory.create(properties, headers());
                } catch (IOException e) {
                    throw new ConnectionException(properties.getEndpoint(), properties.getExporter().value(), 0, 0,
                            "cannot set up transport: " + e.getMessage(), e);
                }
                state.compareAndSet(State.CREATED, State.CONNECTED);
                log.info("Tracing client connected to {} using {}", properties.getEndpoint(),
                        properties.getExporter().value());
            }
            return exporter;
        }
    }

    /**
     * Configured headers plus basic authentication; configured headers win.
     */
    Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        TracingClientProperties.Authentication authentication = properties.getAuthentication();
        if (authentication.isEnabled()) {
            String password = authentication.getPassword() != null ? authentication.getPassword() : "";
            String credentials = authentication.getUser() + ":" + password;
            headers.put("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        headers.putAll(properties.getHeaders());
        return headers;
    }
}

package com.phodal.tracegen.otel.client;

import com.phodal.tracegen.exception.TracingException;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.otel.SampleTraces;
import com.phodal.tracegen.otel.config.TracingClientProperties;
import com.phodal.tracegen.otel.exporter.WireExporter;
import com.phodal.tracegen.random.RandomSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TracingClientTest {

    private TracingClientProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RecordingExporter exporter;
    private AtomicInteger created;

    @BeforeEach
    void setUp() {
        properties = new TracingClientProperties();
        properties.setEndpoint("localhost:4317");
        properties.setInsecure(true);
        meterRegistry = new SimpleMeterRegistry();
        exporter = new RecordingExporter();
        created = new AtomicInteger();
    }

    private TracingClient client() {
        return new TracingClient(properties, meterRegistry, (props, headers) -> {
            created.incrementAndGet();
            exporter.headers = headers;
            return exporter;
        }, RandomSource.seeded(42));
    }

    @Test
    void shouldConnectLazilyOnFirstSend() {
        TracingClient client = client();
        assertEquals(TracingClient.State.CREATED, client.getState());
        assertEquals(0, created.get(), "Exporter should not be created before the first send");

        client.push(List.of(SampleTraces.checkout()));
        client.push(List.of(SampleTraces.checkout()));

        assertEquals(TracingClient.State.CONNECTED, client.getState());
        assertEquals(1, created.get(), "Exporter should be created once");
        assertEquals(4, exporter.spans.size());
    }

    @Test
    void shouldFlattenTracesIntoOneBatch() {
        TracingClient client = client();
        client.push(List.of(SampleTraces.checkout(), SampleTraces.checkout()));

        assertEquals(1, exporter.batches.get(), "All traces of a push should go out in one call");
        assertEquals(4, exporter.spans.size());
    }

    @Test
    void shouldSkipEmptyBatches() {
        TracingClient client = client();
        client.send(List.of());

        assertEquals(0, created.get());
        assertEquals(TracingClient.State.CREATED, client.getState());
    }

    @Test
    void shouldShutDownOnlyOnce() {
        TracingClient client = client();
        client.push(List.of(SampleTraces.checkout()));

        client.shutdown();
        client.shutdown();

        assertEquals(1, exporter.shutdowns.get(), "Exporter should be closed exactly once");
        assertEquals(TracingClient.State.SHUT_DOWN, client.getState());
    }

    @Test
    void shouldRejectSendsAfterShutdown() {
        TracingClient client = client();
        client.shutdown();

        ClientClosedException error = assertThrows(ClientClosedException.class,
                () -> client.push(List.of(SampleTraces.checkout())));
        assertTrue(error.getMessage().contains("localhost:4317"));
        assertThrows(ClientClosedException.class, client::sendFake);
        assertEquals(0, created.get(), "Shutdown before the first send should not create an exporter");
    }

    @Test
    void shouldNotThrowWhenExporterFailsToShutDown() {
        exporter.failOnShutdown = true;
        TracingClient client = client();
        client.push(List.of(SampleTraces.checkout()));

        assertDoesNotThrow(client::shutdown);
        assertEquals(TracingClient.State.SHUT_DOWN, client.getState());
    }

    @Test
    void shouldWaitForInFlightSendsBeforeShuttingDown() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        exporter.entered = entered;
        exporter.release = release;
        TracingClient client = client();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> send = executor.submit(() -> client.push(List.of(SampleTraces.checkout())));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<?> shutdown = executor.submit(client::shutdown);
            Thread.sleep(100);
            assertFalse(shutdown.isDone(), "Shutdown should wait for the running send");

            release.countDown();
            send.get(5, TimeUnit.SECONDS);
            shutdown.get(5, TimeUnit.SECONDS);
            assertEquals(2, exporter.spans.size());
            assertEquals(1, exporter.shutdowns.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldSupportConcurrentPushes() throws Exception {
        TracingClient client = client();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(CompletableFuture.runAsync(() -> client.push(List.of(SampleTraces.checkout())), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
        }

        assertEquals(1, created.get());
        assertEquals(400, exporter.spans.size());
        assertEquals(200, exporter.batches.get());
        assertEquals(400.0, meterRegistry.get(TracingClient.SPANS_METRIC)
                .tag("outcome", "success").counter().count());
    }

    @Test
    void shouldRethrowExportFailuresAndCountThem() {
        exporter.failure = new TransmissionException("localhost:4317", "otlp", 2, 1, "boom", null);
        TracingClient client = client();

        TransmissionException error = assertThrows(TransmissionException.class,
                () -> client.push(List.of(SampleTraces.checkout())));
        assertEquals(2, error.getSpanCount());
        assertEquals(1, error.getTraceCount());
        assertEquals(2.0, meterRegistry.get(TracingClient.SPANS_METRIC)
                .tag("outcome", "failure").counter().count());
        assertEquals(1, meterRegistry.get(TracingClient.REQUESTS_METRIC)
                .tag("outcome", "failure").timer().count());
    }

    @Test
    void shouldReportTransportSetupFailureAsConnectionError() {
        TracingClient client = new TracingClient(properties, meterRegistry, (props, headers) -> {
            throw new IOException("ca.pem not found");
        }, RandomSource.seeded(1));

        ConnectionException error = assertThrows(ConnectionException.class,
                () -> client.push(List.of(SampleTraces.checkout())));
        assertEquals("localhost:4317", error.getEndpoint());
        assertTrue(error.getMessage().contains("ca.pem not found"));
        assertInstanceOf(TracingException.class, error);
    }

    @Test
    void shouldAddBasicAuthenticationHeader() {
        properties.getAuthentication().setUser("user");
        properties.getAuthentication().setPassword("pass");
        properties.getHeaders().put("X-Scope-OrgID", "tenant-1");

        TracingClient client = client();
        client.push(List.of(SampleTraces.checkout()));

        assertEquals("Basic dXNlcjpwYXNz", exporter.headers.get("Authorization"));
        assertEquals("tenant-1", exporter.headers.get("X-Scope-OrgID"));
    }

    @Test
    void shouldLetConfiguredHeadersOverrideAuthentication() {
        properties.getAuthentication().setUser("user");
        properties.getHeaders().put("Authorization", "Bearer token");

        Map<String, String> headers = client().headers();

        assertEquals("Bearer token", headers.get("Authorization"));
    }

    @Test
    void shouldNotAddAuthenticationWithoutUser() {
        assertFalse(client().headers().containsKey("Authorization"));
    }

    @Test
    void shouldSendFakeTrace() {
        TracingClient client = client();
        Trace trace = client.sendFake();

        assertEquals(3, trace.getSpanCount());
        assertEquals(3, exporter.spans.size());
        assertTrue(exporter.spans.stream().allMatch(span -> span.getTraceId().equals(trace.getTraceId())));
        assertEquals(FakeTraces.SERVICE, trace.getRootSpan().orElseThrow().getServiceName());
    }

    private static class RecordingExporter implements WireExporter {
        private final List<Span> spans = new CopyOnWriteArrayList<>();
        private final AtomicInteger batches = new AtomicInteger();
        private final AtomicInteger shutdowns = new AtomicInteger();
        private volatile Map<String, String> headers;
        private volatile TracingException failure;
        private volatile boolean failOnShutdown;
        private volatile CountDownLatch entered;
        private volatile CountDownLatch release;

        @Override
        public void export(List<Span> batch) {
            if (entered != null) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) {
                throw failure;
            }
            batches.incrementAndGet();
            spans.addAll(batch);
        }

        @Override
        public String getName() {
            return "recording";
        }

        @Override
        public void shutdown() {
            shutdowns.incrementAndGet();
            if (failOnShutdown) {
                throw new IllegalStateException("flush failed");
            }
        }
    }
}

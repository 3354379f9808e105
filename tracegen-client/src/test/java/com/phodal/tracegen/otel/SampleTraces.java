package com.phodal.tracegen.otel;

import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Resource;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.model.Trace;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Hand-built two-service trace shared by the exporter tests.
 */
public final class SampleTraces {

    public static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    public static final String ROOT_SPAN_ID = "00f067aa0ba902b7";
    public static final String CHILD_SPAN_ID = "53995c3f42cd8ad8";
    public static final String LINKED_TRACE_ID = "0af7651916cd43dd8448eb211c80319c";
    public static final String LINKED_SPAN_ID = "b7ad6b7169203331";
    public static final Instant START = Instant.parse("2024-05-01T10:00:00.123456Z");

    private SampleTraces() {
    }

    public static Trace checkout() {
        Span root = Span.builder()
                .traceId(TRACE_ID)
                .spanId(ROOT_SPAN_ID)
                .name("GET /checkout")
                .kind(SpanKind.SERVER)
                .startTime(START)
                .duration(Duration.ofMillis(120))
                .status(new SpanStatus(SpanStatus.StatusCode.OK, "all good"))
                .attributes(AttributeSet.builder()
                        .put("http.request.method", "GET")
                        .put("http.response.status_code", 200L)
                        .put("sampling.ratio", 0.25)
                        .put("cache.hit", true)
                        .put("tags", List.of("a", "b"))
                        .put("retries", List.of(1L, 2L))
                        .build())
                .resource(Resource.of("frontend", AttributeSet.builder().put("host.name", "frontend.local").build()))
                .build();

        Span child = Span.builder()
                .traceId(TRACE_ID)
                .spanId(CHILD_SPAN_ID)
                .parentSpanId(ROOT_SPAN_ID)
                .name("SELECT orders")
                .kind(SpanKind.CLIENT)
                .startTime(START.plusMillis(10))
                .duration(Duration.ofMillis(50))
                .status(SpanStatus.error("deadlock detected"))
                .attributes(AttributeSet.builder().put("db.system", "postgresql").build())
                .event(Event.builder()
                        .name("retry")
                        .timestamp(START.plusMillis(20))
                        .attributes(AttributeSet.builder().put("attempt", 2L).build())
                        .build())
                .link(Link.builder()
                        .traceId(LINKED_TRACE_ID)
                        .spanId(LINKED_SPAN_ID)
                        .attributes(AttributeSet.builder().put("link.reason", "batch").build())
                        .build())
                .resource(Resource.forService("orders-db"))
                .build();

        return Trace.of(TRACE_ID, List.of(root, child));
    }
}

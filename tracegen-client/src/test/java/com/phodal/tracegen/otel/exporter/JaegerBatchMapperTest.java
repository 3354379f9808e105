package com.phodal.tracegen.otel.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracegen.otel.SampleTraces;
import io.jaegertracing.thriftjava.Batch;
import io.jaegertracing.thriftjava.Log;
import io.jaegertracing.thriftjava.Span;
import io.jaegertracing.thriftjava.SpanRef;
import io.jaegertracing.thriftjava.SpanRefType;
import io.jaegertracing.thriftjava.Tag;
import io.jaegertracing.thriftjava.TagType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JaegerBatchMapperTest {

    private List<Batch> batches;

    @BeforeEach
    void setUp() {
        batches = new JaegerBatchMapper(new ObjectMapper()).map(SampleTraces.checkout().getSpans());
    }

    @Test
    void shouldGroupSpansByProcess() {
        assertEquals(2, batches.size());
        Batch frontend = batch("frontend");
        assertEquals(1, frontend.getSpansSize());
        assertTrue(frontend.getProcess().getTags().stream().noneMatch(tag -> tag.getKey().equals("service.name")),
                "service.name travels as the process name only");
        assertEquals("frontend.local", tag(frontend.getProcess().getTags(), "host.name").getVStr());
    }

    @Test
    void shouldSplitTraceIdAndConvertTimes() {
        Span root = batch("frontend").getSpans().get(0);

        assertEquals(Long.parseUnsignedLong("4bf92f3577b34da6", 16), root.getTraceIdHigh());
        assertEquals(Long.parseUnsignedLong("a3ce929d0e0e4736", 16), root.getTraceIdLow());
        assertEquals(Long.parseUnsignedLong(SampleTraces.ROOT_SPAN_ID, 16), root.getSpanId());
        assertEquals(0, root.getParentSpanId());
        assertEquals(SampleTraces.START.getEpochSecond() * 1_000_000 + 123_456, root.getStartTime());
        assertEquals(120_000, root.getDuration());
        assertTrue(root.getReferences().isEmpty());
    }

    @Test
    void shouldMapAttributeTypesToTags() {
        List<Tag> tags = batch("frontend").getSpans().get(0).getTags();

        assertEquals(TagType.STRING, tag(tags, "http.request.method").getVType());
        assertEquals(200L, tag(tags, "http.response.status_code").getVLong());
        assertEquals(0.25, tag(tags, "sampling.ratio").getVDouble());
        assertTrue(tag(tags, "cache.hit").isVBool());
        assertEquals("[\"a\",\"b\"]", tag(tags, "tags").getVStr());
        assertEquals("[1,2]", tag(tags, "retries").getVStr());
        assertEquals("server", tag(tags, "span.kind").getVStr());
        assertEquals("OK", tag(tags, "otel.status_code").getVStr());
        assertTrue(tags.stream().noneMatch(tag -> tag.getKey().equals("error")));
    }

    @Test
    void shouldMapErrorsEventsAndReferences() {
        Span child = batch("orders-db").getSpans().get(0);

        assertEquals(Long.parseUnsignedLong(SampleTraces.ROOT_SPAN_ID, 16), child.getParentSpanId());
        assertTrue(tag(child.getTags(), "error").isVBool());
        assertEquals("ERROR", tag(child.getTags(), "otel.status_code").getVStr());
        assertEquals("deadlock detected", tag(child.getTags(), "otel.status_description").getVStr());

        List<SpanRef> references = child.getReferences();
        assertEquals(2, references.size());
        assertEquals(SpanRefType.CHILD_OF, references.get(0).getRefType());
        assertEquals(SpanRefType.FOLLOWS_FROM, references.get(1).getRefType());
        assertEquals(Long.parseUnsignedLong(SampleTraces.LINKED_SPAN_ID, 16), references.get(1).getSpanId());

        Log log = child.getLogs().get(0);
        assertEquals("retry", tag(log.getFields(), "event").getVStr());
        assertEquals(2L, tag(log.getFields(), "attempt").getVLong());
    }

    private Batch batch(String service) {
        return batches.stream()
                .filter(batch -> batch.getProcess().getServiceName().equals(service))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no batch for " + service));
    }

    private static Tag tag(List<Tag> tags, String key) {
        return tags.stream()
                .filter(tag -> tag.getKey().equals(key))
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing tag " + key));
    }
}

package com.phodal.tracegen.generator;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.exception.InvalidTemplateException;
import com.phodal.tracegen.generator.template.TraceTemplate;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.random.RandomSource;
import com.phodal.tracegen.semantics.AttributeSemantics;
import com.phodal.tracegen.semantics.DatabaseSemanticConventions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateLoaderTest {

    private final TemplateLoader loader = new TemplateLoader();

    @Test
    void shouldLoadJsonTemplate() throws Exception {
        TraceTemplate template = loader.loadTemplate(resource("/templates/checkout.json"));

        assertEquals(6, template.getSpans().size());
        assertEquals(AttributeSemantics.HTTP, template.getDefaults().getAttributeSemantics());
        assertTrue(template.getDefaults().getRandomEvents().isExceptionOnError(),
                "generateExceptionOnError should be accepted as alias");
        assertEquals(AttributeSemantics.DATABASE, template.getSpans().get(5).getAttributeSemantics());

        Trace trace = new TemplatedGenerator(template, RandomSource.seeded(8)).trace();
        List<Span> spans = trace.getSpans();

        assertEquals(6, spans.size());
        for (Span span : spans) {
            assertEquals("three", span.getAttributes().getString("one").orElseThrow());
            assertEquals(2L, span.getAttributes().getLong("retries").orElseThrow());
            assertEquals(0.25, span.getAttributes().get("ratio").orElseThrow());
            assertEquals(false, span.getAttributes().get("cached").orElseThrow());
            assertEquals("load-test",
                    span.getResource().getAttributes().getString("deployment.environment").orElseThrow());
        }
        assertEquals(List.of("a", "b"), spans.get(3).getAttributes().get("tags").orElseThrow());

        Span denied = spans.get(2);
        assertEquals(SpanKind.SERVER, denied.getKind());
        assertEquals(SpanStatus.StatusCode.ERROR, denied.getStatus().getCode());
        assertEquals("denied", denied.getStatus().getMessage());

        Link retry = spans.get(4).getLinks().get(0);
        assertEquals(spans.get(3).getSpanId(), retry.getSpanId());
        assertEquals("retry", retry.getAttributes().getString("reason").orElseThrow());

        Span query = spans.get(5);
        assertEquals("postgresql",
                query.getAttributes().getString(DatabaseSemanticConventions.DB_SYSTEM).orElseThrow());
        assertEquals(1, query.getLinks().size());
        assertEquals(spans.get(4).getSpanId(), query.getLinks().get(0).getSpanId());
    }

    @Test
    void shouldLoadYamlTemplate() throws Exception {
        TraceTemplate template = loader.loadTemplate(resource("/templates/messaging.yaml"));

        Trace trace = new TemplatedGenerator(template, RandomSource.seeded(8)).trace();
        Span producer = trace.getSpans().get(0);
        Span consumer = trace.getSpans().get(1);

        assertEquals(SpanKind.PRODUCER, producer.getKind());
        assertEquals(SpanKind.CONSUMER, consumer.getKind());
        assertEquals(SpanStatus.StatusCode.OK, consumer.getStatus().getCode());
        assertEquals("2.1.0", producer.getResource().getAttributes().getString("service.version").orElseThrow());
        assertEquals(8, producer.getResource().getAttributes().size(),
                "Marker, service name, host, random and explicit attributes: " + producer.getResource());

        assertEquals("order-received", consumer.getEvents().get(0).getName());
        assertEquals(42L, consumer.getEvents().get(0).getAttributes().getLong("order.id").orElseThrow());
        assertEquals(3, consumer.getEvents().size(), "Explicit event plus two random events");
    }

    @Test
    void shouldLoadParams() throws Exception {
        List<TraceParams> params = loader.loadParams(resource("/templates/params.json"));

        assertEquals(2, params.size());
        assertEquals("acme", params.get(0).getSpans().getFixedAttributes().get("tenant"));
        assertEquals("0af7651916cd43dd8448eb211c80319c", params.get(1).getId());
        assertTrue(params.get(1).isRandomServiceName());
        assertTrue(params.get(1).getSpans().isRandomName());

        List<Trace> traces = ParameterizedGenerator.generate(params, RandomSource.seeded(3));
        assertEquals(5, traces.get(0).getSpanCount());
        assertEquals(ParameterizedGenerator.DEFAULT_SPAN_COUNT, traces.get(1).getSpanCount());
    }

    @Test
    void shouldAcceptSingleParamsObject() {
        List<TraceParams> params = loader.parseParams("{\"service\": \"single\"}", false);
        assertEquals(1, params.size());
        assertEquals("single", params.get(0).getService());
    }

    @Test
    void shouldWrapParseErrors(@TempDir Path dir) throws Exception {
        Path broken = dir.resolve("broken.yml");
        Files.writeString(broken, "spans: [ {service: a, attributeSemantics: grpc} ]", StandardCharsets.UTF_8);

        assertThrows(InvalidTemplateException.class, () -> loader.loadTemplate(broken));
        assertThrows(InvalidTemplateException.class, () -> loader.parseTemplate("{\"spans\": [", false));
        assertThrows(InvalidParameterException.class, () -> loader.parseParams("[{\"spans\": {\"count\": \"many\"}}]", false));
    }

    private Path resource(String name) throws Exception {
        return Path.of(getClass().getResource(name).toURI());
    }
}

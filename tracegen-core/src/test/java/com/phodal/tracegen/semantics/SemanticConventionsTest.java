package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.random.RandomData;
import com.phodal.tracegen.random.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SemanticConventionsTest {

    private static final String TRACE_ID = "0af7651916cd43dd8448eb211c80319c";

    private SemanticConventions semantics;
    private RandomData random;

    @BeforeEach
    void setUp() {
        semantics = new SemanticConventions();
        random = new RandomData(RandomSource.seeded(17));
    }

    @Test
    void shouldFillHttpServerAttributes() {
        SpanDraft server = draft(0, null, "frontend", "get-orders", SpanKind.SERVER);

        semantics.apply(AttributeSemantics.HTTP, server, random);

        AttributeSet attributes = server.getAttributes().build();
        assertTrue(attributes.containsKey(HttpSemanticConventions.HTTP_REQUEST_METHOD));
        long status = HttpSemanticConventions.httpStatusCode(attributes).orElseThrow();
        assertTrue(status >= 200 && status < 300, "Default status should be a success code");
        assertEquals("https", attributes.getString("url.scheme").orElseThrow());
        assertEquals("/get-orders", attributes.getString("url.path").orElseThrow());
        assertEquals("tcp", attributes.getString("network.transport").orElseThrow());
        assertEquals("frontend.local", attributes.getString("server.address").orElseThrow());
        assertFalse(server.getStatus().isError());
    }

    @Test
    void shouldNotOverrideExplicitAttributes() {
        SpanDraft server = draft(0, null, "frontend", "get-orders", SpanKind.SERVER);
        server.getAttributes().put(HttpSemanticConventions.HTTP_REQUEST_METHOD, "OPTIONS");
        server.getAttributes().put("url.full", "http://example.com/custom");

        semantics.apply(AttributeSemantics.HTTP, server, random);

        AttributeSet attributes = server.getAttributes().build();
        assertEquals("OPTIONS", attributes.getString(HttpSemanticConventions.HTTP_REQUEST_METHOD).orElseThrow());
        assertEquals("http://example.com/custom", attributes.getString("url.full").orElseThrow());
        assertEquals("/custom", attributes.getString("url.path").orElseThrow());
    }

    @Test
    void shouldKeepExplicitUrlSchemeAndPath() {
        SpanDraft server = draft(0, null, "frontend", "get-orders", SpanKind.SERVER);
        server.getAttributes().put("url.scheme", "ftp");
        server.getAttributes().put("url.path", "/mine");

        semantics.apply(AttributeSemantics.HTTP, server, random);

        AttributeSet attributes = server.getAttributes().build();
        assertEquals("ftp", attributes.getString("url.scheme").orElseThrow());
        assertEquals("/mine", attributes.getString("url.path").orElseThrow());
    }

    @Test
    void shouldAcceptOpaqueUrlWithoutPath() {
        SpanDraft server = draft(0, null, "frontend", "notify", SpanKind.SERVER);
        server.getAttributes().put("url.full", "mailto:ops@example.com");

        assertDoesNotThrow(() -> semantics.apply(AttributeSemantics.HTTP, server, random));

        AttributeSet attributes = server.getAttributes().build();
        assertEquals("mailto", attributes.getString("url.scheme").orElseThrow());
        assertFalse(attributes.containsKey("url.path"));
    }

    @Test
    void shouldMarkServerErrorAndPropagateToClientParent() {
        SpanDraft client = draft(0, null, "frontend", "call-backend", SpanKind.CLIENT);
        SpanDraft server = draft(1, client, "backend", "handle", SpanKind.SERVER);
        server.getAttributes().put(HttpSemanticConventions.HTTP_RESPONSE_STATUS_CODE, 503);

        semantics.apply(AttributeSemantics.HTTP, client, random);
        semantics.apply(AttributeSemantics.HTTP, server, random);

        assertTrue(server.getStatus().isError());
        assertEquals("Service Unavailable", server.getStatus().getMessage());
        assertTrue(client.getStatus().isError(), "Client parent should fail with the server");
        AttributeSet parentAttributes = client.getAttributes().build();
        assertEquals(503L, parentAttributes.getLong(HttpSemanticConventions.HTTP_RESPONSE_STATUS_CODE).orElseThrow());
        assertEquals("backend.local", parentAttributes.getString("server.address").orElseThrow());
        assertTrue(parentAttributes.containsKey("network.peer.address"));
    }

    @Test
    void shouldKeepFixedStatus() {
        SpanDraft server = draft(0, null, "frontend", "handle", SpanKind.SERVER);
        server.setStatusFixed(true);
        server.getAttributes().put(HttpSemanticConventions.HTTP_STATUS_CODE_OLD, "500");

        semantics.apply(AttributeSemantics.HTTP, server, random);

        assertFalse(server.getStatus().isError(), "Explicit status should win over the HTTP status");
    }

    @Test
    void shouldSkipInternalSpans() {
        SpanDraft internal = draft(0, null, "frontend", "compute", SpanKind.INTERNAL);

        semantics.apply(AttributeSemantics.HTTP, internal, random);
        semantics.apply(AttributeSemantics.DATABASE, internal, random);

        assertTrue(internal.getAttributes().build().isEmpty());
    }

    @Test
    void shouldFillDatabaseAttributes() {
        SpanDraft client = draft(0, null, "postgres-orders", "insert-articles", SpanKind.CLIENT);

        semantics.apply(AttributeSemantics.DATABASE, client, random);

        AttributeSet attributes = client.getAttributes().build();
        assertEquals("postgresql", attributes.getString(DatabaseSemanticConventions.DB_SYSTEM).orElseThrow());
        assertEquals("INSERT", attributes.getString(DatabaseSemanticConventions.DB_OPERATION_NAME).orElseThrow());
        assertEquals("INSERT INTO articles VALUES (?)",
                attributes.getString(DatabaseSemanticConventions.DB_QUERY_TEXT).orElseThrow());
        assertEquals(5432L, attributes.getLong("server.port").orElseThrow());
    }

    @Test
    void shouldIgnoreMissingSemantics() {
        SpanDraft server = draft(0, null, "frontend", "handle", SpanKind.SERVER);
        semantics.apply(null, server, random);
        assertTrue(server.getAttributes().build().isEmpty());
    }

    @Test
    void shouldParseSemanticsNames() {
        assertEquals(AttributeSemantics.HTTP, AttributeSemantics.fromString("HTTP"));
        assertEquals(AttributeSemantics.DATABASE, AttributeSemantics.fromString("database"));
        assertThrows(IllegalArgumentException.class, () -> AttributeSemantics.fromString("grpc"));
    }

    private static SpanDraft draft(int index, SpanDraft parent, String service, String name, SpanKind kind) {
        SpanDraft draft = new SpanDraft(index, TRACE_ID, "000000000000000" + (index + 1), parent,
                new SpanDraft.HostInfo(service + ".local", "192.168.1." + (index + 1), 8080 + index));
        draft.setServiceName(service);
        draft.setName(name);
        draft.setKind(kind);
        draft.setStartTime(Instant.now());
        draft.setDuration(Duration.ofMillis(100));
        draft.setStatus(SpanStatus.ok());
        return draft;
    }
}

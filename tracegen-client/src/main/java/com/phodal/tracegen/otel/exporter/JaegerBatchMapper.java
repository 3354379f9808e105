package com.phodal.tracegen.otel.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Resource;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import io.jaegertracing.thriftjava.Batch;
import io.jaegertracing.thriftjava.Log;
import io.jaegertracing.thriftjava.Process;
import io.jaegertracing.thriftjava.SpanRef;
import io.jaegertracing.thriftjava.SpanRefType;
import io.jaegertracing.thriftjava.Tag;
import io.jaegertracing.thriftjava.TagType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Converts generated spans into Jaeger Thrift batches, one batch per emitting process.
 */
public class JaegerBatchMapper {

    static final String SPAN_KIND_TAG = "span.kind";
    static final String STATUS_CODE_TAG = "otel.status_code";
    static final String STATUS_DESCRIPTION_TAG = "otel.status_description";
    static final String ERROR_TAG = "error";
    static final String EVENT_FIELD = "event";

    private final ObjectMapper objectMapper;

    public JaegerBatchMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Batch> map(List<Span> spans) {
        Map<Resource, Batch> batches = new LinkedHashMap<>();
        for (Span span : spans) {
            Batch batch = batches.computeIfAbsent(span.getResource(), this::newBatch);
            batch.addToSpans(map(span));
        }
        return new ArrayList<>(batches.values());
    }

    private Batch newBatch(Resource resource) {
        Process process = new Process(resource.getServiceName());
        List<Tag> tags = new ArrayList<>();
        resource.getAttributes().forEach((key, value) -> {
            if (!Resource.SERVICE_NAME.equals(key)) {
                tags.add(tag(key, value));
            }
        });
        process.setTags(tags);
        return new Batch(process, new ArrayList<>());
    }

    io.jaegertracing.thriftjava.Span map(Span span) {
        long traceIdHigh = traceIdHigh(span.getTraceId());
        long traceIdLow = traceIdLow(span.getTraceId());
        long parentId = span.isRoot() ? 0 : spanId(span.getParentSpanId());

        io.jaegertracing.thriftjava.Span jaegerSpan = new io.jaegertracing.thriftjava.Span(
                traceIdLow,
                traceIdHigh,
                spanId(span.getSpanId()),
                parentId,
                span.getName(),
                1,
                epochMicros(span.getStartTime()),
                TimeUnit.NANOSECONDS.toMicros(span.getDuration().toNanos()));

        List<SpanRef> references = new ArrayList<>();
        if (!span.isRoot()) {
            references.add(new SpanRef(SpanRefType.CHILD_OF, traceIdLow, traceIdHigh, parentId));
        }
        for (Link link : span.getLinks()) {
            references.add(new SpanRef(SpanRefType.FOLLOWS_FROM,
                    traceIdLow(link.getTraceId()), traceIdHigh(link.getTraceId()), spanId(link.getSpanId())));
        }
        jaegerSpan.setReferences(references);

        List<Tag> tags = tags(span.getAttributes());
        if (span.getKind() != SpanKind.INTERNAL) {
            tags.add(tag(SPAN_KIND_TAG, span.getKind().name().toLowerCase(Locale.ROOT)));
        }
        SpanStatus status = span.getStatus();
        if (status.getCode() != SpanStatus.StatusCode.UNSET) {
            tags.add(tag(STATUS_CODE_TAG, status.getCode().name()));
        }
        if (status.isError()) {
            tags.add(tag(ERROR_TAG, true));
            if (!status.getMessage().isEmpty()) {
                tags.add(tag(STATUS_DESCRIPTION_TAG, status.getMessage()));
            }
        }
        jaegerSpan.setTags(tags);

        List<Log> logs = new ArrayList<>(span.getEvents().size());
        for (Event event : span.getEvents()) {
            List<Tag> fields = new ArrayList<>();
            fields.add(tag(EVENT_FIELD, event.getName()));
            fields.addAll(tags(event.getAttributes()));
            logs.add(new Log(epochMicros(event.getTimestamp()), fields));
        }
        jaegerSpan.setLogs(logs);
        return jaegerSpan;
    }

    private List<Tag> tags(AttributeSet attributes) {
        List<Tag> tags = new ArrayList<>(attributes.size() + 4);
        attributes.forEach((key, value) -> tags.add(tag(key, value)));
        return tags;
    }

    /**
     * Jaeger has no array tags; arrays travel as their JSON text.
     */
    Tag tag(String key, Object value) {
        if (value instanceof Long l) {
            return new Tag(key, TagType.LONG).setVLong(l);
        }
        if (value instanceof Double d) {
            return new Tag(key, TagType.DOUBLE).setVDouble(d);
        }
        if (value instanceof Boolean b) {
            return new Tag(key, TagType.BOOL).setVBool(b);
        }
        if (value instanceof List<?> list) {
            try {
                return new Tag(key, TagType.STRING).setVStr(objectMapper.writeValueAsString(list));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("cannot encode attribute " + key, e);
            }
        }
        return new Tag(key, TagType.STRING).setVStr(String.valueOf(value));
    }

    static long traceIdHigh(String traceId) {
        return Long.parseUnsignedLong(traceId.substring(0, 16), 16);
    }

    static long traceIdLow(String traceId) {
        return Long.parseUnsignedLong(traceId.substring(16), 16);
    }

    static long spanId(String spanId) {
        return Long.parseUnsignedLong(spanId, 16);
    }

    private static long epochMicros(Instant instant) {
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(instant.getNano());
    }
}

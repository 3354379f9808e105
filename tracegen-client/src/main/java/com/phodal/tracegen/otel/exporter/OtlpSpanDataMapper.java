package com.phodal.tracegen.otel.exporter;

import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanStatus;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Maps generated spans onto OpenTelemetry SDK {@link SpanData}.
 */
public class OtlpSpanDataMapper {

    /**
     * Maps a batch; spans sharing a resource share one SDK {@link Resource} instance so the
     * exporter groups them into one {@code ResourceSpans}.
     */
    public List<SpanData> map(List<Span> spans) {
        Map<com.phodal.tracegen.model.Resource, Resource> resources = new HashMap<>();
        List<SpanData> result = new ArrayList<>(spans.size());
        for (Span span : spans) {
            Resource resource = resources.computeIfAbsent(span.getResource(),
                    r -> Resource.create(attributes(r.getAttributes())));
            result.add(map(span, resource));
        }
        return result;
    }

    SpanData map(Span span, Resource resource) {
        List<EventData> events = new ArrayList<>(span.getEvents().size());
        for (Event event : span.getEvents()) {
            events.add(EventData.create(epochNanos(event.getTimestamp()), event.getName(),
                    attributes(event.getAttributes())));
        }
        List<LinkData> links = new ArrayList<>(span.getLinks().size());
        for (Link link : span.getLinks()) {
            links.add(LinkData.create(spanContext(link.getTraceId(), link.getSpanId()),
                    attributes(link.getAttributes())));
        }

        long start = epochNanos(span.getStartTime());
        return GeneratedSpanData.builder()
                .name(span.getName())
                .kind(SpanKind.valueOf(span.getKind().name()))
                .spanContext(spanContext(span.getTraceId(), span.getSpanId()))
                .parentSpanContext(span.isRoot()
                        ? SpanContext.getInvalid()
                        : spanContext(span.getTraceId(), span.getParentSpanId()))
                .status(status(span.getStatus()))
                .startEpochNanos(start)
                .endEpochNanos(start + span.getDuration().toNanos())
                .attributes(attributes(span.getAttributes()))
                .events(events)
                .links(links)
                .resource(resource)
                .build();
    }

    static Attributes attributes(AttributeSet attributes) {
        if (attributes.isEmpty()) {
            return Attributes.empty();
        }
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach((key, value) -> put(builder, key, value));
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static void put(AttributesBuilder builder, String key, Object value) {
        if (value instanceof String s) {
            builder.put(AttributeKey.stringKey(key), s);
        } else if (value instanceof Long l) {
            builder.put(AttributeKey.longKey(key), l);
        } else if (value instanceof Double d) {
            builder.put(AttributeKey.doubleKey(key), d);
        } else if (value instanceof Boolean b) {
            builder.put(AttributeKey.booleanKey(key), b);
        } else if (value instanceof List<?> list) {
            Object first = list.isEmpty() ? "" : list.get(0);
            if (first instanceof Long) {
                builder.put(AttributeKey.longArrayKey(key), (List<Long>) list);
            } else if (first instanceof Double) {
                builder.put(AttributeKey.doubleArrayKey(key), (List<Double>) list);
            } else if (first instanceof Boolean) {
                builder.put(AttributeKey.booleanArrayKey(key), (List<Boolean>) list);
            } else {
                builder.put(AttributeKey.stringArrayKey(key), (List<String>) list);
            }
        } else {
            builder.put(AttributeKey.stringKey(key), String.valueOf(value));
        }
    }

    private static StatusData status(SpanStatus status) {
        switch (status.getCode()) {
            case OK:
                return StatusData.create(StatusCode.OK, status.getMessage());
            case ERROR:
                return StatusData.create(StatusCode.ERROR, status.getMessage());
            default:
                return StatusData.unset();
        }
    }

    private static SpanContext spanContext(String traceId, String spanId) {
        return SpanContext.create(traceId, spanId, TraceFlags.getSampled(), TraceState.getDefault());
    }

    private static long epochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }
}

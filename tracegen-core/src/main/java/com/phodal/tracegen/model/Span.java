package com.phodal.tracegen.model;

import com.phodal.tracegen.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One timed unit of work within a trace. Instances are immutable hand-off objects.
 */
@Value
public class Span {

    String traceId;
    String spanId;
    /**
     * {@code null} for root spans.
     */
    String parentSpanId;
    String serviceName;
    String name;
    SpanKind kind;
    Instant startTime;
    Duration duration;
    SpanStatus status;
    AttributeSet attributes;
    List<Event> events;
    List<Link> links;
    Resource resource;

    @Builder(toBuilder = true)
    private Span(String traceId,
                 String spanId,
                 String parentSpanId,
                 String serviceName,
                 String name,
                 SpanKind kind,
                 Instant startTime,
                 Duration duration,
                 SpanStatus status,
                 AttributeSet attributes,
                 @Singular List<Event> events,
                 @Singular List<Link> links,
                 Resource resource) {
        this.traceId = Ids.normalizeTraceId(traceId);
        this.spanId = Ids.normalizeSpanId(spanId);
        this.parentSpanId = Ids.isEmpty(parentSpanId) ? null : Ids.normalizeSpanId(parentSpanId);
        if (this.spanId.equals(this.parentSpanId)) {
            throw new InvalidParameterException("span " + spanId + " is its own parent");
        }
        if (name == null) {
            throw new InvalidParameterException("span " + spanId + " has no name");
        }
        if (duration != null && duration.isNegative()) {
            throw new InvalidParameterException("span " + spanId + " has negative duration " + duration);
        }
        this.name = name;
        this.kind = kind != null ? kind : SpanKind.INTERNAL;
        this.startTime = startTime != null ? startTime : Instant.now();
        this.duration = duration != null ? duration : Duration.ZERO;
        this.status = status != null ? status : SpanStatus.unset();
        this.attributes = attributes != null ? attributes : AttributeSet.empty();
        this.events = List.copyOf(events);
        this.links = List.copyOf(links);
        if (resource != null) {
            this.resource = resource;
            this.serviceName = serviceName != null ? serviceName : resource.getServiceName();
        } else {
            this.serviceName = serviceName != null ? serviceName : "unknown_service";
            this.resource = Resource.forService(this.serviceName);
        }
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public Instant getEndTime() {
        return startTime.plus(duration);
    }
}

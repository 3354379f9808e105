package com.phodal.tracegen.generator;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Ids;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Resource;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.random.RandomData;
import com.phodal.tracegen.random.RandomSource;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds deep, narrow traces from coarse numeric parameters: every span is the child of the span
 * generated before it.
 */
@Slf4j
public class ParameterizedGenerator implements Generator {

    public static final int DEFAULT_SPAN_COUNT = 10;
    public static final int DEFAULT_SPAN_SIZE = 1000;
    public static final String PAYLOAD_ATTRIBUTE = "tracegen.payload";

    private static final Duration TRACE_START_OFFSET = Duration.ofSeconds(5);

    private final List<ResolvedParams> traceParams;
    private final RandomSource random;
    private final RandomData data;

    public ParameterizedGenerator(List<TraceParams> traceParams) {
        this(traceParams, RandomSource.create());
    }

    /**
     * @throws InvalidParameterException if any entry has a negative span count or size or a
     *                                   malformed trace ID; nothing is generated in that case
     */
    public ParameterizedGenerator(List<TraceParams> traceParams, RandomSource random) {
        if (traceParams == null) {
            throw new InvalidParameterException("trace params must not be null");
        }
        List<ResolvedParams> resolved = new ArrayList<>(traceParams.size());
        for (int i = 0; i < traceParams.size(); i++) {
            resolved.add(resolve(i, traceParams.get(i)));
        }
        this.traceParams = List.copyOf(resolved);
        this.random = random;
        this.data = new RandomData(random);
    }

    public static List<Trace> generate(List<TraceParams> traceParams, RandomSource random) {
        return new ParameterizedGenerator(traceParams, random).traces();
    }

    @Override
    public List<Trace> traces() {
        List<Trace> traces = new ArrayList<>(traceParams.size());
        for (ResolvedParams params : traceParams) {
            traces.add(generateTrace(params));
        }
        log.debug("Generated {} parameterized traces", traces.size());
        return traces;
    }

    private Trace generateTrace(ResolvedParams params) {
        String traceId = params.traceId() != null ? params.traceId() : Ids.traceId(random);
        String traceService = params.service() != null ? params.service() : data.service();
        String traceOperation = data.operation();

        Set<String> spanIds = new HashSet<>();
        List<Span> spans = new ArrayList<>(params.count());
        Span previous = null;
        for (int i = 0; i < params.count(); i++) {
            Instant start = previous == null
                    ? Instant.now().minus(TRACE_START_OFFSET)
                    : previous.getStartTime().plus(random.duration(Duration.ofMillis(1), Duration.ofMillis(10)));

            String service = params.randomServiceName() ? data.service() + "." + random.string(5) : traceService;
            String name = params.randomName() ? data.operation() + "." + random.string(5) : traceOperation;

            String spanId;
            do {
                spanId = Ids.spanId(random);
            } while (!spanIds.add(spanId));

            Span span = Span.builder()
                    .traceId(traceId)
                    .spanId(spanId)
                    .parentSpanId(previous != null ? previous.getSpanId() : null)
                    .serviceName(service)
                    .name(name)
                    .kind(SpanKind.CLIENT)
                    .startTime(start)
                    .duration(Duration.ofMillis(random.intBetween(10, 510)))
                    .status(SpanStatus.ok())
                    .attributes(attributes(params))
                    .event(Event.builder()
                            .name(data.prefixed(12))
                            .timestamp(start)
                            .attributes(AttributeSet.builder().put(data.prefixed(5), data.prefixed(12)).build())
                            .build())
                    .link(Link.builder()
                            .traceId(Ids.traceId(random))
                            .spanId(Ids.spanId(random))
                            .attributes(AttributeSet.builder().put(data.prefixed(12), data.prefixed(12)).build())
                            .build())
                    .resource(Resource.forService(service))
                    .build();
            spans.add(span);
            previous = span;
        }
        return Trace.of(traceId, spans);
    }

    /**
     * Fixed attributes plus one random payload attribute that brings the attribute size up to the
     * requested number of bytes.
     */
    private AttributeSet attributes(ResolvedParams params) {
        AttributeSet.Builder attributes = AttributeSet.builder().putAll(params.fixedAttributes());
        int used = byteSize(params.fixedAttributes());
        int remaining = params.size() - used - PAYLOAD_ATTRIBUTE.length();
        if (remaining > 0) {
            attributes.put(PAYLOAD_ATTRIBUTE, random.string(remaining));
        }
        return attributes.build();
    }

    static int byteSize(AttributeSet attributes) {
        int[] size = {0};
        attributes.forEach((key, value) -> size[0] += key.getBytes(StandardCharsets.UTF_8).length
                + String.valueOf(value).getBytes(StandardCharsets.UTF_8).length);
        return size[0];
    }

    private static ResolvedParams resolve(int index, TraceParams params) {
        if (params == null) {
            throw InvalidParameterException.forTrace(index, "entry must not be null");
        }
        SpanParams spans = params.getSpans() != null ? params.getSpans() : new SpanParams();
        int count = spans.getCount() != null ? spans.getCount() : 0;
        int size = spans.getSize() != null ? spans.getSize() : 0;
        if (count < 0) {
            throw InvalidParameterException.forTrace(index, "span count must not be negative, got " + count);
        }
        if (size < 0) {
            throw InvalidParameterException.forTrace(index, "span size must not be negative, got " + size);
        }

        String traceId = null;
        if (params.getId() != null && !params.getId().isBlank()) {
            try {
                traceId = Ids.normalizeTraceId(params.getId());
            } catch (InvalidParameterException e) {
                throw InvalidParameterException.forTrace(index, e.getMessage());
            }
        }

        AttributeSet fixed;
        try {
            fixed = AttributeSet.of(spans.getFixedAttributes());
        } catch (InvalidParameterException e) {
            throw InvalidParameterException.forTrace(index, e.getMessage());
        }

        String service = params.getService() != null && !params.getService().isBlank() ? params.getService() : null;
        return new ResolvedParams(traceId, service, params.isRandomServiceName(),
                count == 0 ? DEFAULT_SPAN_COUNT : count,
                size == 0 ? DEFAULT_SPAN_SIZE : size,
                spans.isRandomName(), fixed);
    }

    private record ResolvedParams(String traceId,
                                  String service,
                                  boolean randomServiceName,
                                  int count,
                                  int size,
                                  boolean randomName,
                                  AttributeSet fixedAttributes) {
    }
}

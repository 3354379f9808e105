package com.phodal.tracegen.generator;

import com.phodal.tracegen.exception.InvalidTemplateException;
import com.phodal.tracegen.generator.template.AttributeParams;
import com.phodal.tracegen.generator.template.EventParams;
import com.phodal.tracegen.generator.template.EventTemplate;
import com.phodal.tracegen.generator.template.LinkParams;
import com.phodal.tracegen.generator.template.LinkTemplate;
import com.phodal.tracegen.generator.template.Range;
import com.phodal.tracegen.generator.template.ResourceTemplate;
import com.phodal.tracegen.generator.template.SpanDefaults;
import com.phodal.tracegen.generator.template.SpanTemplate;
import com.phodal.tracegen.generator.template.TraceTemplate;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Ids;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Resource;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.random.AttributeCardinalityEngine;
import com.phodal.tracegen.random.AttributePool;
import com.phodal.tracegen.random.RandomData;
import com.phodal.tracegen.random.RandomSource;
import com.phodal.tracegen.semantics.AttributeSemantics;
import com.phodal.tracegen.semantics.HttpSemanticConventions;
import com.phodal.tracegen.semantics.SemanticConventions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A trace generator that creates randomized traces based on a given {@link TraceTemplate}.
 * <p>
 * The template is validated and compiled once on construction: span names, random attribute keys
 * and host identities stay stable across generated traces, while IDs, timings, sampled attribute
 * values, events and links are drawn anew for every trace. Spans are built in template order, so
 * {@code parentIdx} and {@code linkToPreviousSpanIndex} always refer to spans that already exist.
 */
@Slf4j
public class TemplatedGenerator implements Generator {

    public static final String SPAN_KIND_ATTRIBUTE = "span.kind";

    static final Duration DEFAULT_MIN_DURATION = Duration.ofMillis(500);
    static final Duration DEFAULT_MAX_DURATION = Duration.ofMillis(800);
    private static final Duration TRACE_START_OFFSET = Duration.ofSeconds(5);

    private final RandomSource random;
    private final RandomData data;
    private final AttributeCardinalityEngine cardinality;
    private final SemanticConventions semantics;
    private final EmissionPolicy emissionPolicy;

    private final AttributePool traceAttributes;
    private final Map<String, CompiledResource> resources = new LinkedHashMap<>();
    private final List<CompiledSpan> spans = new ArrayList<>();

    public TemplatedGenerator(TraceTemplate template) {
        this(template, RandomSource.create());
    }

    public TemplatedGenerator(TraceTemplate template, RandomSource random) {
        this(template, random, EmissionPolicy.FRACTIONAL_REMAINDER);
    }

    public TemplatedGenerator(TraceTemplate template, RandomSource random, EmissionPolicy emissionPolicy) {
        this(template, random, emissionPolicy, new SemanticConventions());
    }

    /**
     * @throws InvalidTemplateException if the template has no spans, a span without service, a
     *                                  parent index that is not smaller than the span's own index,
     *                                  negative counts or rates, or an invalid duration range
     */
    public TemplatedGenerator(TraceTemplate template,
                              RandomSource random,
                              EmissionPolicy emissionPolicy,
                              SemanticConventions semantics) {
        this.random = random;
        this.data = new RandomData(random);
        this.cardinality = new AttributeCardinalityEngine(random);
        this.semantics = semantics;
        this.emissionPolicy = emissionPolicy;

        if (template == null || template.getSpans() == null || template.getSpans().isEmpty()) {
            throw new InvalidTemplateException("template must contain at least one span");
        }
        SpanDefaults defaults = template.getDefaults() != null ? template.getDefaults() : new SpanDefaults();
        TemplateResolver.checkAttributeParams(-1, defaults.getRandomAttributes(), "defaults.randomAttributes");
        TemplateResolver.checkRange(-1, defaults.getDuration(), "defaults.duration");
        this.traceAttributes = pool(defaults.getRandomAttributes());

        List<SpanTemplate> templates = template.getSpans();
        for (int i = 0; i < templates.size(); i++) {
            spans.add(compileSpan(i, templates, defaults));
        }
        log.debug("Compiled trace template with {} spans across {} services", spans.size(), resources.size());
    }

    /**
     * Generates one trace per template. All templates are validated before any trace is built.
     */
    public static List<Trace> generate(List<TraceTemplate> templates, RandomSource random) {
        List<TemplatedGenerator> generators = new ArrayList<>(templates.size());
        for (TraceTemplate template : templates) {
            generators.add(new TemplatedGenerator(template, random));
        }
        List<Trace> traces = new ArrayList<>(generators.size());
        for (TemplatedGenerator generator : generators) {
            traces.add(generator.trace());
        }
        return traces;
    }

    @Override
    public List<Trace> traces() {
        return List.of(trace());
    }

    public Trace trace() {
        String traceId = Ids.traceId(random);
        Instant traceStart = Instant.now().minus(TRACE_START_OFFSET);
        AttributeSet sharedAttributes = traceAttributes.sample(random);

        Map<String, Resource> traceResources = new HashMap<>();
        resources.forEach((service, resource) -> traceResources.put(service,
                Resource.of(service, resource.attributes.merge(resource.randomAttributes.sample(random)))));

        Set<String> spanIds = new HashSet<>();
        List<SpanDraft> drafts = new ArrayList<>(spans.size());
        for (CompiledSpan tmpl : spans) {
            SpanDraft parent = tmpl.parentIndex >= 0 ? drafts.get(tmpl.parentIndex) : null;
            String spanId;
            do {
                spanId = Ids.spanId(random);
            } while (!spanIds.add(spanId));

            SpanDraft span = new SpanDraft(tmpl.index, traceId, spanId, parent, resources.get(tmpl.service).host);
            span.setServiceName(tmpl.service);
            span.setName(tmpl.name);
            span.setKind(tmpl.kind);
            span.setResource(traceResources.get(tmpl.service));
            span.setStatus(tmpl.status);
            span.setStatusFixed(tmpl.statusFixed);
            applyTiming(span, tmpl, traceStart);

            span.getAttributes()
                    .putAll(tmpl.attributes)
                    .putAll(tmpl.randomAttributes.sample(random))
                    .putAllIfAbsent(sharedAttributes);
            semantics.apply(tmpl.semantics, span, data);
            drafts.add(span);
        }

        // events and links depend on the final error state, which child spans may still change
        for (int i = 0; i < drafts.size(); i++) {
            addEvents(drafts.get(i), spans.get(i));
            addLinks(drafts, i, spans.get(i));
        }

        List<Span> result = new ArrayList<>(drafts.size());
        for (SpanDraft draft : drafts) {
            result.add(draft.toSpan());
        }
        return Trace.of(traceId, result);
    }

    public int getSpanCount() {
        return spans.size();
    }

    private void applyTiming(SpanDraft span, CompiledSpan tmpl, Instant traceStart) {
        SpanDraft parent = span.getParent();
        Duration duration;
        if (parent == null) {
            span.setStartTime(traceStart);
            duration = random.duration(DEFAULT_MIN_DURATION, DEFAULT_MAX_DURATION);
        } else {
            Duration parentDuration = parent.getDuration();
            span.setStartTime(parent.getStartTime()
                    .plus(random.duration(parentDuration.dividedBy(20), parentDuration.dividedBy(10))));
            duration = random.duration(parentDuration.dividedBy(2), parentDuration.minus(parentDuration.dividedBy(10)));
        }
        if (tmpl.duration != null) {
            duration = random.duration(Duration.ofMillis(tmpl.duration.getMin()), Duration.ofMillis(tmpl.duration.getMax()));
        }
        span.setDuration(duration);
    }

    private void addEvents(SpanDraft span, CompiledSpan tmpl) {
        for (CompiledEvent event : tmpl.events) {
            span.getEvents().add(Event.builder()
                    .name(event.name)
                    .timestamp(eventTime(span))
                    .attributes(event.attributes.merge(event.randomAttributes.sample(random)))
                    .build());
        }

        CompiledRandomEvents randomEvents = tmpl.randomEvents;
        if (randomEvents == null) {
            return;
        }
        int count = emissionPolicy.sample(randomEvents.count, random);
        for (int i = 0; i < count; i++) {
            span.getEvents().add(Event.builder()
                    .name(data.eventName())
                    .timestamp(eventTime(span))
                    .attributes(randomEvents.randomAttributes.sample(random))
                    .build());
        }

        int exceptions = emissionPolicy.sample(randomEvents.exceptionCount, random);
        if (randomEvents.exceptionOnError) {
            exceptions = isError(span) ? Math.max(exceptions, 1) : 0;
        }
        for (int i = 0; i < exceptions; i++) {
            span.getEvents().add(Event.builder()
                    .name(Event.EXCEPTION_EVENT_NAME)
                    .exception(true)
                    .timestamp(eventTime(span))
                    .attributes(AttributeSet.builder()
                            .put("exception.escaped", false)
                            .put("exception.message", data.exceptionMessage())
                            .put("exception.stacktrace", data.exceptionStackTrace())
                            .put("exception.type", data.exceptionType())
                            .putAll(randomEvents.randomAttributes.sample(random))
                            .build())
                    .build());
        }
    }

    private void addLinks(List<SpanDraft> drafts, int index, CompiledSpan tmpl) {
        SpanDraft span = drafts.get(index);
        for (CompiledLink link : tmpl.links) {
            SpanDraft target = link.toPreviousSpan ? drafts.get(Math.max(index - 1, 0)) : span.getParent();
            span.getLinks().add(link(span, target, link.attributes.merge(link.randomAttributes.sample(random))));
        }

        CompiledRandomLinks randomLinks = tmpl.randomLinks;
        if (randomLinks == null) {
            return;
        }
        int count = emissionPolicy.sample(randomLinks.count, random);
        for (int i = 0; i < count; i++) {
            span.getLinks().add(link(span, span.getParent(), randomLinks.randomAttributes.sample(random)));
        }
    }

    /**
     * Links to {@code target}, or to a random span of another trace when there is no target.
     */
    private Link link(SpanDraft span, SpanDraft target, AttributeSet attributes) {
        if (target != null) {
            return Link.builder()
                    .traceId(span.getTraceId())
                    .spanId(target.getSpanId())
                    .attributes(attributes)
                    .build();
        }
        return Link.builder()
                .traceId(Ids.traceId(random))
                .spanId(Ids.spanId(random))
                .attributes(attributes)
                .build();
    }

    private Instant eventTime(SpanDraft span) {
        return span.getStartTime().plus(random.duration(Duration.ZERO, span.getDuration()));
    }

    private static boolean isError(SpanDraft span) {
        if (span.getStatus().isError()) {
            return true;
        }
        return HttpSemanticConventions.httpStatusCode(span.getAttributes().build())
                .map(status -> status >= 400)
                .orElse(false);
    }

    private CompiledSpan compileSpan(int index, List<SpanTemplate> templates, SpanDefaults defaults) {
        SpanTemplate tmpl = templates.get(index);
        if (tmpl == null) {
            throw new InvalidTemplateException(index, "span template must not be null");
        }
        if (tmpl.getService() == null || tmpl.getService().isBlank()) {
            throw new InvalidTemplateException(index, "span template must have a service");
        }
        Integer parentIdx = tmpl.getParentIdx();
        if (parentIdx != null && (parentIdx < 0 || parentIdx >= index)) {
            throw new InvalidTemplateException(index, "parentIdx " + parentIdx
                    + " must reference a previous span (0 <= parentIdx < " + index + ")");
        }
        TemplateResolver.checkRange(index, tmpl.getDuration(), "duration");
        TemplateResolver.checkAttributeParams(index, tmpl.getRandomAttributes(), "randomAttributes");

        compileResource(index, tmpl, defaults.getResource());

        CompiledSpan span = new CompiledSpan();
        span.index = index;
        span.parentIndex = parentIdx != null ? parentIdx : -1;
        span.service = tmpl.getService();
        span.name = tmpl.getName() != null ? tmpl.getName() : data.operation();
        span.duration = TemplateResolver.resolve(tmpl.getDuration(), defaults.getDuration(), null);
        span.semantics = TemplateResolver.resolve(tmpl.getAttributeSemantics(), defaults.getAttributeSemantics(), null);
        span.statusFixed = tmpl.getStatus() != null || defaults.getStatus() != null;
        span.status = TemplateResolver.resolve(tmpl.getStatus(), defaults.getStatus(), SpanStatus.ok());

        AttributeSet attributes = TemplateResolver.mergeAttributes(index, defaults.getAttributes(), tmpl.getAttributes());
        span.kind = compileKind(index, tmpl, attributes, templates);
        span.attributes = attributes.containsKey(SPAN_KIND_ATTRIBUTE)
                ? attributes.toBuilder().remove(SPAN_KIND_ATTRIBUTE).build()
                : attributes;
        span.randomAttributes = pool(tmpl.getRandomAttributes());

        span.events = new ArrayList<>();
        if (tmpl.getEvents() != null) {
            for (EventTemplate event : tmpl.getEvents()) {
                TemplateResolver.checkAttributeParams(index, event.getRandomAttributes(), "events.randomAttributes");
                CompiledEvent compiled = new CompiledEvent();
                compiled.name = event.getName() != null ? event.getName() : data.eventName();
                compiled.attributes = TemplateResolver.attributes(index, event.getAttributes());
                compiled.randomAttributes = pool(event.getRandomAttributes());
                span.events.add(compiled);
            }
        }
        EventParams randomEvents = TemplateResolver.resolve(tmpl.getRandomEvents(), defaults.getRandomEvents(), null);
        if (randomEvents != null) {
            TemplateResolver.checkRate(index, randomEvents.getCount(), "randomEvents.count");
            TemplateResolver.checkRate(index, randomEvents.getExceptionCount(), "randomEvents.exceptionCount");
            TemplateResolver.checkAttributeParams(index, randomEvents.getRandomAttributes(), "randomEvents.randomAttributes");
            CompiledRandomEvents compiled = new CompiledRandomEvents();
            compiled.count = TemplateResolver.countOrOne(randomEvents.getCount());
            compiled.exceptionCount = randomEvents.getExceptionCount();
            compiled.exceptionOnError = randomEvents.isExceptionOnError();
            compiled.randomAttributes = pool(randomEvents.getRandomAttributes());
            span.randomEvents = compiled;
        }

        span.links = new ArrayList<>();
        if (tmpl.getLinks() != null) {
            for (LinkTemplate link : tmpl.getLinks()) {
                TemplateResolver.checkAttributeParams(index, link.getRandomAttributes(), "links.randomAttributes");
                CompiledLink compiled = new CompiledLink();
                compiled.toPreviousSpan = link.isLinkToPreviousSpanIndex();
                compiled.attributes = TemplateResolver.attributes(index, link.getAttributes());
                compiled.randomAttributes = pool(link.getRandomAttributes());
                span.links.add(compiled);
            }
        }
        LinkParams randomLinks = TemplateResolver.resolve(tmpl.getRandomLinks(), defaults.getRandomLinks(), null);
        if (randomLinks != null) {
            TemplateResolver.checkRate(index, randomLinks.getCount(), "randomLinks.count");
            TemplateResolver.checkAttributeParams(index, randomLinks.getRandomAttributes(), "randomLinks.randomAttributes");
            CompiledRandomLinks compiled = new CompiledRandomLinks();
            compiled.count = TemplateResolver.countOrOne(randomLinks.getCount());
            compiled.randomAttributes = pool(randomLinks.getRandomAttributes());
            span.randomLinks = compiled;
        }
        return span;
    }

    /**
     * Spans of one service share a resource; every span's resource template is merged into it.
     */
    private void compileResource(int index, SpanTemplate tmpl, ResourceTemplate defaults) {
        CompiledResource resource = resources.get(tmpl.getService());
        if (resource == null) {
            resource = new CompiledResource();
            resource.host = new SpanDraft.HostInfo(tmpl.getService() + ".local", random.ipAddress(), random.port());
            resource.attributes = AttributeSet.builder()
                    .put("host.name", resource.host.hostName())
                    .put("host.ip", resource.host.hostIp())
                    .build();
            resource.randomAttributes = AttributePool.empty();
            if (defaults != null) {
                TemplateResolver.checkAttributeParams(index, defaults.getRandomAttributes(), "defaults.resource.randomAttributes");
                resource.attributes = resource.attributes.merge(TemplateResolver.attributes(index, defaults.getAttributes()));
                resource.randomAttributes = pool(defaults.getRandomAttributes());
            }
            resources.put(tmpl.getService(), resource);
        }
        ResourceTemplate own = tmpl.getResource();
        if (own != null) {
            TemplateResolver.checkAttributeParams(index, own.getRandomAttributes(), "resource.randomAttributes");
            resource.attributes = resource.attributes.merge(TemplateResolver.attributes(index, own.getAttributes()));
            resource.randomAttributes = resource.randomAttributes.merge(pool(own.getRandomAttributes()));
        }
    }

    private SpanKind compileKind(int index, SpanTemplate tmpl, AttributeSet attributes, List<SpanTemplate> templates) {
        if (tmpl.getKind() != null) {
            return tmpl.getKind();
        }
        if (attributes.containsKey(SPAN_KIND_ATTRIBUTE)) {
            return attributes.getString(SPAN_KIND_ATTRIBUTE)
                    .map(SpanKind::fromString)
                    .orElseThrow(() -> new InvalidTemplateException(index,
                            "attribute span.kind expected to be a string"));
        }

        SpanTemplate child = null;
        for (int j = index + 1; j < templates.size(); j++) {
            SpanTemplate candidate = templates.get(j);
            if (candidate != null && candidate.getParentIdx() != null && candidate.getParentIdx() == index) {
                child = candidate;
                break;
            }
        }
        boolean childInOtherService = child != null && !tmpl.getService().equals(child.getService());

        if (tmpl.getParentIdx() == null) {
            return childInOtherService ? SpanKind.CLIENT : SpanKind.SERVER;
        }
        String parentService = spans.get(tmpl.getParentIdx()).service;
        if (!tmpl.getService().equals(parentService)) {
            return SpanKind.SERVER;
        }
        return childInOtherService ? SpanKind.CLIENT : SpanKind.INTERNAL;
    }

    private AttributePool pool(AttributeParams params) {
        if (params == null || params.getCount() == 0) {
            return AttributePool.empty();
        }
        Integer cardinalityLimit = params.getCardinality() != null
                ? params.getCardinality()
                : AttributeParams.DEFAULT_CARDINALITY;
        return cardinality.pool(params.getCount(), cardinalityLimit, RandomData.KEY_PREFIX);
    }

    private static final class CompiledResource {
        SpanDraft.HostInfo host;
        AttributeSet attributes;
        AttributePool randomAttributes;
    }

    private static final class CompiledSpan {
        int index;
        int parentIndex;
        String service;
        String name;
        SpanKind kind;
        Range duration;
        AttributeSemantics semantics;
        SpanStatus status;
        boolean statusFixed;
        AttributeSet attributes;
        AttributePool randomAttributes;
        List<CompiledEvent> events;
        CompiledRandomEvents randomEvents;
        List<CompiledLink> links;
        CompiledRandomLinks randomLinks;
    }

    private static final class CompiledEvent {
        String name;
        AttributeSet attributes;
        AttributePool randomAttributes;
    }

    private static final class CompiledRandomEvents {
        double count;
        double exceptionCount;
        boolean exceptionOnError;
        AttributePool randomAttributes;
    }

    private static final class CompiledLink {
        boolean toPreviousSpan;
        AttributeSet attributes;
        AttributePool randomAttributes;
    }

    private static final class CompiledRandomLinks {
        double count;
        AttributePool randomAttributes;
    }
}

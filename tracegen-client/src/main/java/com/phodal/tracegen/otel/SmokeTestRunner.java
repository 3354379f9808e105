package com.phodal.tracegen.otel;

import com.phodal.tracegen.generator.EmissionPolicy;
import com.phodal.tracegen.generator.TemplateLoader;
import com.phodal.tracegen.generator.TemplatedGenerator;
import com.phodal.tracegen.generator.template.TraceTemplate;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.otel.client.TracingClient;
import com.phodal.tracegen.otel.config.SmokeTestProperties;
import com.phodal.tracegen.otel.config.TracingClientProperties;
import com.phodal.tracegen.random.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pushes traces once at startup to check that the collector accepts them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracegen.smoke-test", name = "enabled", havingValue = "true")
public class SmokeTestRunner implements ApplicationRunner {

    private final TracingClient tracingClient;
    private final TemplateLoader templateLoader;
    private final TracingClientProperties clientProperties;
    private final SmokeTestProperties properties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (properties.getTemplate() == null || properties.getTemplate().isBlank()) {
            tracingClient.sendFake();
            return;
        }
        TraceTemplate template = templateLoader.loadTemplate(Path.of(properties.getTemplate()));
        EmissionPolicy policy = clientProperties.getEmissionPolicy();
        TemplatedGenerator generator = new TemplatedGenerator(template, RandomSource.create(), policy);
        List<Trace> traces = new ArrayList<>(properties.getTraces());
        for (int i = 0; i < properties.getTraces(); i++) {
            traces.add(generator.trace());
        }
        tracingClient.push(traces);
        log.info("Sent {} traces ({} spans each) from template {}",
                traces.size(), generator.getSpanCount(), properties.getTemplate());
    }
}

package com.phodal.tracegen.otel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracegen.generator.TemplateLoader;
import com.phodal.tracegen.otel.client.TracingClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the tracing client from {@code tracegen.client.*}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({TracingClientProperties.class, SmokeTestProperties.class})
public class TracingClientConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean(destroyMethod = "shutdown")
    public TracingClient tracingClient(TracingClientProperties properties,
                                       MeterRegistry meterRegistry,
                                       ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Creating tracing client: endpoint={}, exporter={}, plaintext={}",
                properties.getEndpoint(), properties.getExporter().value(), properties.isPlaintext());
        return new TracingClient(properties, meterRegistry, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public TemplateLoader templateLoader() {
        return new TemplateLoader();
    }
}

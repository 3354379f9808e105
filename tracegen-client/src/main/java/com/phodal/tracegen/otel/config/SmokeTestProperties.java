package com.phodal.tracegen.otel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the connectivity check run at startup.
 */
@Data
@ConfigurationProperties(prefix = "tracegen.smoke-test")
public class SmokeTestProperties {

    /**
     * Whether to push traces once the application has started.
     */
    private boolean enabled = false;

    /**
     * Optional JSON or YAML trace template; the built-in trace is sent when unset.
     */
    private String template;

    /**
     * Number of traces to generate from the template.
     */
    private int traces = 1;
}

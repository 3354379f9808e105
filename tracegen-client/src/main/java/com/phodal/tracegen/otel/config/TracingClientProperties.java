package com.phodal.tracegen.otel.config;

import com.phodal.tracegen.generator.EmissionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of the trace export client.
 * Maps to tracegen.client.* in application.yml
 */
@Data
@ConfigurationProperties(prefix = "tracegen.client")
public class TracingClientProperties {

    public static final String DEFAULT_ENDPOINT = "0.0.0.0:4317";

    /**
     * Collector address as {@code host:port}. Values with a scheme are used as given.
     */
    private String endpoint = DEFAULT_ENDPOINT;

    /**
     * Wire protocol: otlp (gRPC), otlphttp (HTTP/protobuf) or jaeger (Thrift over HTTP).
     */
    private ExporterType exporter = ExporterType.OTLP;

    /**
     * Send over plaintext instead of TLS.
     */
    private boolean insecure = false;

    private Tls tls = new Tls();

    private Authentication authentication = new Authentication();

    /**
     * Headers sent with every request (e.g. X-Scope-OrgID for multi-tenant backends).
     */
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Per-call transport timeout.
     */
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Rounding of fractional event and link rates in templates.
     */
    private EmissionPolicy emissionPolicy = EmissionPolicy.FRACTIONAL_REMAINDER;

    public boolean isPlaintext() {
        return insecure || tls.isInsecure();
    }

    @Data
    public static class Tls {
        /**
         * Same as the top level insecure flag.
         */
        private boolean insecure = false;

        /**
         * Use TLS but accept any server certificate.
         */
        private boolean insecureSkipVerify = false;

        /**
         * PEM file with the CA certificates to trust.
         */
        private String caFile;

        /**
         * PEM client certificate for mutual TLS.
         */
        private String certFile;

        /**
         * PEM private key of the client certificate.
         */
        private String keyFile;

        /**
         * Expected name of the server certificate.
         */
        private String serverName;
    }

    @Data
    public static class Authentication {
        private String user;
        private String password;

        public boolean isEnabled() {
            return user != null && !user.isEmpty();
        }
    }

    public enum ExporterType {
        OTLP("otlp"),
        OTLP_HTTP("otlphttp"),
        JAEGER("jaeger");

        private final String value;

        ExporterType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}

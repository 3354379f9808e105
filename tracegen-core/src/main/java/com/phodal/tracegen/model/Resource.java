package com.phodal.tracegen.model;

import lombok.Value;

/**
 * Attributes describing the entity that emitted a span.
 */
@Value
public class Resource {

    public static final String SERVICE_NAME = "service.name";
    public static final String GENERATOR_MARKER = "tracegen";

    AttributeSet attributes;

    private Resource(AttributeSet attributes) {
        this.attributes = attributes;
    }

    /**
     * Resource of a generated span, tagged with the service name and the generator marker.
     */
    public static Resource forService(String serviceName) {
        return new Resource(AttributeSet.builder()
                .put(GENERATOR_MARKER, "true")
                .put(SERVICE_NAME, serviceName)
                .build());
    }

    public static Resource of(String serviceName, AttributeSet attributes) {
        return forService(serviceName).merge(attributes);
    }

    public String getServiceName() {
        return attributes.getString(SERVICE_NAME).orElse("unknown_service");
    }

    /**
     * Additive merge; later attributes win. The service name survives unless overridden explicitly.
     */
    public Resource merge(AttributeSet other) {
        return new Resource(attributes.merge(other));
    }
}

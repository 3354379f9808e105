package com.phodal.tracegen.random;

import java.util.List;

/**
 * Pools of realistic looking names and values.
 */
public final class RandomData {

    public static final String KEY_PREFIX = "tracegen.";

    static final List<Long> HTTP_STATUS_SUCCESS = List.of(200L, 201L, 202L, 204L);
    static final List<Long> HTTP_STATUS_ERROR = List.of(400L, 401L, 403L, 404L, 405L, 406L, 408L, 409L, 410L,
            411L, 412L, 413L, 414L, 415L, 417L, 428L, 427L, 500L, 501L, 502L);
    static final List<String> HTTP_METHODS = List.of("GET", "DELETE", "POST", "PUT", "PATCH");
    static final List<String> HTTP_CONTENT_TYPES = List.of("application/json", "application/xml",
            "application/x-www-form-urlencoded", "text/plain", "text/html");
    static final List<String> OPERATIONS = List.of("get", "list", "query", "search", "set", "add", "create",
            "update", "send", "remove", "delete");
    static final List<String> SERVICE_SUFFIXES = List.of("", "", "service", "backend", "api", "proxy", "engine");
    public static final List<String> DB_SYSTEMS = List.of("redis", "mysql", "postgresql", "memcached", "mongodb",
            "elasticsearch");
    static final List<String> RESOURCES = List.of("order", "payment", "customer", "product", "stock", "inventory",
            "shipping", "billing", "checkout", "cart", "search", "analytics");
    private static final List<String> PANICS = List.of("runtime error: index out of range",
            "runtime error: can't divide by 0");
    private static final List<String> FUNCTIONS = List.of("main.main()", "trace.makespan()", "account.login()",
            "payment.collect()");

    private final RandomSource random;

    public RandomData(RandomSource random) {
        this.random = random;
    }

    public RandomSource source() {
        return random;
    }

    public long httpStatusSuccess() {
        return random.select(HTTP_STATUS_SUCCESS);
    }

    public long httpStatusError() {
        return random.select(HTTP_STATUS_ERROR);
    }

    public String httpMethod() {
        return random.select(HTTP_METHODS);
    }

    public String httpContentType() {
        return random.select(HTTP_CONTENT_TYPES);
    }

    public String dbSystem() {
        return random.select(DB_SYSTEMS);
    }

    public String resourceName() {
        return random.select(RESOURCES);
    }

    public String service() {
        return serviceForResource(resourceName());
    }

    public String serviceForResource(String resource) {
        String suffix = random.select(SERVICE_SUFFIXES);
        return suffix.isEmpty() ? resource : resource + "-" + suffix;
    }

    public String operation() {
        return operationForResource(resourceName());
    }

    public String operationForResource(String resource) {
        return random.select(OPERATIONS) + "-" + resource;
    }

    /**
     * Random string carrying the generator key prefix.
     */
    public String prefixed(int length) {
        return KEY_PREFIX + random.string(length);
    }

    public String eventName() {
        return "event_" + prefixed(10);
    }

    public String exceptionType() {
        return "error.type_" + prefixed(10);
    }

    public String exceptionMessage() {
        return "error: " + prefixed(20);
    }

    public String exceptionStackTrace() {
        return "panic: " + random.select(PANICS) + "\n" + random.select(FUNCTIONS);
    }
}

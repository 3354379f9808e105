package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.random.RandomData;
import io.opentelemetry.semconv.ServerAttributes;

import java.util.Locale;
import java.util.Map;

/**
 * Database client attributes. Operation and table are derived from span names such as
 * {@code select-articles}.
 */
public class DatabaseSemanticConventions implements SemanticConventionPack {

    public static final String DB_SYSTEM = "db.system";
    public static final String DB_NAMESPACE = "db.namespace";
    public static final String DB_OPERATION_NAME = "db.operation.name";
    public static final String DB_QUERY_TEXT = "db.query.text";

    private static final Map<String, String> SYSTEM_ALIASES = Map.of(
            "postgres", "postgresql",
            "pg", "postgresql",
            "mongo", "mongodb",
            "elastic", "elasticsearch");

    private static final Map<String, Integer> DEFAULT_PORTS = Map.of(
            "redis", 6379,
            "mysql", 3306,
            "postgresql", 5432,
            "memcached", 11211,
            "mongodb", 27017,
            "elasticsearch", 9200);

    private static final Map<String, String> OPERATIONS = Map.of(
            "select", "SELECT",
            "query", "SELECT",
            "get", "SELECT",
            "list", "SELECT",
            "insert", "INSERT",
            "create", "INSERT",
            "update", "UPDATE",
            "delete", "DELETE",
            "remove", "DELETE");

    @Override
    public AttributeSemantics semantics() {
        return AttributeSemantics.DATABASE;
    }

    @Override
    public void apply(SpanDraft span, RandomData random) {
        if (span.getKind() == SpanKind.INTERNAL) {
            return;
        }
        NetworkConventions.apply(span, random);

        AttributeSet.Builder attributes = span.getAttributes();
        String system = attributes.get(DB_SYSTEM) instanceof String s ? s : systemFor(span.getServiceName(), random);
        attributes.putIfAbsent(DB_SYSTEM, system);

        String[] nameParts = span.getName().split("[-_. ]", 2);
        String operation = OPERATIONS.getOrDefault(nameParts[0].toLowerCase(Locale.ROOT), "SELECT");
        String table = nameParts.length > 1 ? nameParts[1] : random.resourceName();

        attributes.putIfAbsent(DB_NAMESPACE, span.getServiceName());
        attributes.putIfAbsent(DB_OPERATION_NAME, operation);
        attributes.putIfAbsent(DB_QUERY_TEXT, queryText(operation, table));
        attributes.putIfAbsent(ServerAttributes.SERVER_ADDRESS.getKey(), span.getHost().hostName());
        attributes.putIfAbsent(ServerAttributes.SERVER_PORT.getKey(),
                DEFAULT_PORTS.getOrDefault(system, span.getHost().hostPort()));
    }

    private static String systemFor(String service, RandomData random) {
        String name = service.toLowerCase(Locale.ROOT);
        for (String system : RandomData.DB_SYSTEMS) {
            if (name.contains(system)) {
                return system;
            }
        }
        for (Map.Entry<String, String> alias : SYSTEM_ALIASES.entrySet()) {
            if (name.contains(alias.getKey())) {
                return alias.getValue();
            }
        }
        return random.dbSystem();
    }

    private static String queryText(String operation, String table) {
        switch (operation) {
            case "INSERT":
                return "INSERT INTO " + table + " VALUES (?)";
            case "UPDATE":
                return "UPDATE " + table + " SET value = ? WHERE id = ?";
            case "DELETE":
                return "DELETE FROM " + table + " WHERE id = ?";
            default:
                return "SELECT * FROM " + table + " WHERE id = ?";
        }
    }
}

package com.phodal.tracegen.model;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.random.RandomSource;

import java.util.HexFormat;
import java.util.Locale;

/**
 * Trace and span identifiers in their lower case hex form.
 */
public final class Ids {

    public static final int TRACE_ID_BYTES = 16;
    public static final int SPAN_ID_BYTES = 8;

    private static final HexFormat HEX = HexFormat.of();
    private static final String INVALID_TRACE_ID = "0".repeat(TRACE_ID_BYTES * 2);
    private static final String INVALID_SPAN_ID = "0".repeat(SPAN_ID_BYTES * 2);

    private Ids() {
    }

    public static String traceId(RandomSource random) {
        String id;
        do {
            id = HEX.formatHex(random.bytes(TRACE_ID_BYTES));
        } while (INVALID_TRACE_ID.equals(id));
        return id;
    }

    public static String spanId(RandomSource random) {
        String id;
        do {
            id = HEX.formatHex(random.bytes(SPAN_ID_BYTES));
        } while (INVALID_SPAN_ID.equals(id));
        return id;
    }

    /**
     * Validates and lower-cases a trace ID. Shorter IDs are left-padded with zeros.
     */
    public static String normalizeTraceId(String traceId) {
        return normalize(traceId, TRACE_ID_BYTES, "trace ID");
    }

    public static String normalizeSpanId(String spanId) {
        return normalize(spanId, SPAN_ID_BYTES, "span ID");
    }

    public static boolean isEmpty(String id) {
        return id == null || id.isEmpty() || id.chars().allMatch(c -> c == '0');
    }

    public static byte[] toBytes(String hexId) {
        return HEX.parseHex(hexId);
    }

    public static String fromBytes(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    private static String normalize(String id, int bytes, String what) {
        if (id == null || id.isBlank()) {
            throw new InvalidParameterException(what + " must not be empty");
        }
        String value = id.trim().toLowerCase(Locale.ROOT);
        if (value.length() > bytes * 2) {
            throw new InvalidParameterException(what + " '" + id + "' is longer than " + bytes + " bytes");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                throw new InvalidParameterException(what + " '" + id + "' is not hex encoded");
            }
        }
        if (value.length() < bytes * 2) {
            value = "0".repeat(bytes * 2 - value.length()) + value;
        }
        if (isEmpty(value)) {
            throw new InvalidParameterException(what + " must not be all zeros");
        }
        return value;
    }
}

package com.phodal.tracegen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * OTEL Span Status
 */
@Value
public class SpanStatus {

    private static final SpanStatus OK = new SpanStatus(StatusCode.OK, "");
    private static final SpanStatus UNSET = new SpanStatus(StatusCode.UNSET, "");

    StatusCode code;
    String message;

    @Builder
    @JsonCreator
    public SpanStatus(@JsonProperty("code") StatusCode code, @JsonProperty("message") String message) {
        this.code = code != null ? code : StatusCode.UNSET;
        this.message = message != null ? message : "";
    }

    /**
     * Status codes as per OTEL specification, numbered like the OTLP wire enum.
     */
    public enum StatusCode {
        /**
         * The default status (unset)
         */
        UNSET(0),

        /**
         * The operation completed successfully
         */
        OK(1),

        /**
         * The operation contains an error
         */
        ERROR(2);

        private final int number;

        StatusCode(int number) {
            this.number = number;
        }

        public int number() {
            return number;
        }

        /**
         * Accepts the enum name, its lower case form or the OTLP number.
         */
        @JsonCreator
        public static StatusCode parse(Object raw) {
            if (raw instanceof Number n) {
                return fromNumber(n.intValue());
            }
            String value = String.valueOf(raw).trim().toUpperCase(Locale.ROOT);
            if (value.startsWith("STATUS_CODE_")) {
                value = value.substring("STATUS_CODE_".length());
            }
            try {
                return fromNumber(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                return StatusCode.valueOf(value);
            }
        }

        public static StatusCode fromNumber(int number) {
            for (StatusCode code : values()) {
                if (code.number == number) {
                    return code;
                }
            }
            throw new IllegalArgumentException("unknown status code " + number);
        }
    }

    @JsonIgnore
    public boolean isError() {
        return code == StatusCode.ERROR;
    }

    public static SpanStatus ok() {
        return OK;
    }

    public static SpanStatus error(String message) {
        return new SpanStatus(StatusCode.ERROR, message);
    }

    public static SpanStatus unset() {
        return UNSET;
    }
}

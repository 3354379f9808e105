package com.phodal.tracegen.generator;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.exception.InvalidTemplateException;
import com.phodal.tracegen.generator.template.AttributeParams;
import com.phodal.tracegen.generator.template.Range;
import com.phodal.tracegen.model.AttributeSet;

import java.util.Map;

/**
 * Three-tier resolution of template values: span value, then template default, then built-in
 * default. Attribute maps are merged key by key instead of replaced.
 */
final class TemplateResolver {

    private TemplateResolver() {
    }

    static <T> T resolve(T spanValue, T defaultValue, T builtin) {
        if (spanValue != null) {
            return spanValue;
        }
        return defaultValue != null ? defaultValue : builtin;
    }

    /**
     * {@code defaults ∪ span}; span entries win on key collision.
     */
    static AttributeSet mergeAttributes(int spanIndex, Map<String, Object> defaults, Map<String, Object> span) {
        return attributes(spanIndex, defaults).merge(attributes(spanIndex, span));
    }

    static AttributeSet attributes(int spanIndex, Map<String, Object> raw) {
        try {
            return AttributeSet.of(raw);
        } catch (InvalidParameterException e) {
            throw new InvalidTemplateException(spanIndex, e.getMessage());
        }
    }

    static void checkAttributeParams(int spanIndex, AttributeParams params, String field) {
        if (params != null && params.getCount() < 0) {
            throw new InvalidTemplateException(spanIndex, field + ".count must not be negative");
        }
    }

    static void checkRate(int spanIndex, double rate, String field) {
        if (rate < 0 || Double.isNaN(rate) || Double.isInfinite(rate)) {
            throw new InvalidTemplateException(spanIndex, field + " must be a finite, non-negative number");
        }
    }

    static void checkRange(int spanIndex, Range range, String field) {
        if (range == null) {
            return;
        }
        if (range.getMin() < 0 || range.getMax() < range.getMin()) {
            throw new InvalidTemplateException(spanIndex, field + " must satisfy 0 <= min <= max, got ["
                    + range.getMin() + ", " + range.getMax() + "]");
        }
    }

    /**
     * A random event or link object without count emits once per span.
     */
    static double countOrOne(double count) {
        return count == 0 ? 1 : count;
    }
}

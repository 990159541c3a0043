package com.globalnewsbrief.formatter.normalize;

import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Total readers over untyped mappings: every value either becomes a field value or is reported
 * absent. No reflection, no implicit coercion beyond the rules stated per method.
 */
final class RawFields {
    private RawFields() {
    }

    /**
     * Strings as-is, numbers and booleans by their text form, anything else absent.
     */
    static String scalar(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    /**
     * First non-blank scalar among {@code keys}, trimmed.
     */
    static String text(Map<?, ?> raw, String... keys) {
        for (String key : keys) {
            String value = scalar(raw.get(key));
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Reads a token count. Missing or null counts are zero; integral numbers and integral numeric
     * strings are accepted; anything else is recorded as a violation on {@code field}.
     */
    static long count(Map<?, ?> raw, String key, Violations violations) {
        Object value = raw.get(key);
        if (value == null) {
            return 0;
        }
        BigDecimal number;
        try {
            if (value instanceof Number numeric) {
                number = new BigDecimal(numeric.toString());
            } else if (value instanceof String text && !text.isBlank()) {
                number = new BigDecimal(text.trim());
            } else {
                violations.add(key, Violation.Rule.FORMAT, "must be an integer (was " + value + ")");
                return 0;
            }
        } catch (NumberFormatException e) {
            violations.add(key, Violation.Rule.FORMAT, "must be an integer (was '" + value + "')");
            return 0;
        }
        try {
            return number.longValueExact();
        } catch (ArithmeticException e) {
            violations.add(key, Violation.Rule.FORMAT, "must be an integer (was " + value + ")");
            return 0;
        }
    }
}

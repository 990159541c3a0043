package com.globalnewsbrief.core.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Collects every broken constraint of a value before failing, so callers see the complete
 * violation set instead of the first one.
 */
public final class Violations {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<Violation> items = new ArrayList<>();

    public Violations add(String field, Violation.Rule rule, String message) {
        items.add(new Violation(field, rule, message));
        return this;
    }

    public Violations addAll(List<Violation> violations, String prefix) {
        for (Violation violation : violations) {
            items.add(violation.prefixed(prefix));
        }
        return this;
    }

    public boolean required(String field, Object value) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            add(field, Violation.Rule.REQUIRED, "is required");
            return false;
        }
        return true;
    }

    public void length(String field, String value, int min, int max) {
        if (!required(field, value)) {
            return;
        }
        int length = value.length();
        if (length < min || length > max) {
            add(field, Violation.Rule.LENGTH,
                    "length must be between " + min + " and " + max + " characters (was " + length + ")");
        }
    }

    public void wordCount(String field, String value, int min, int max) {
        if (value == null || value.isBlank()) {
            return;
        }
        int words = countWords(value);
        if (words < min || words > max) {
            add(field, Violation.Rule.WORD_COUNT,
                    "must contain between " + min + " and " + max + " words (was " + words + ")");
        }
    }

    public void range(String field, long value, long min, long max) {
        if (value < min || value > max) {
            add(field, Violation.Rule.RANGE, "must be between " + min + " and " + max + " (was " + value + ")");
        }
    }

    public void nonNegative(String field, double value) {
        if (Double.isNaN(value) || value < 0) {
            add(field, Violation.Rule.RANGE, "must not be negative (was " + value + ")");
        }
    }

    public void size(String field, List<?> values, int min, int max) {
        if (!required(field, values)) {
            return;
        }
        if (values.size() < min || values.size() > max) {
            add(field, Violation.Rule.RANGE,
                    "must contain between " + min + " and " + max + " entries (was " + values.size() + ")");
        }
    }

    public void matches(String field, String value, Pattern pattern, String expected) {
        if (!required(field, value)) {
            return;
        }
        if (!pattern.matcher(value).matches()) {
            add(field, Violation.Rule.FORMAT, "must match " + expected + " (was '" + value + "')");
        }
    }

    public void httpUrl(String field, String value) {
        if (!required(field, value)) {
            return;
        }
        if (!isHttpUrl(value)) {
            add(field, Violation.Rule.FORMAT, "must be an absolute http(s) URL (was '" + value + "')");
        }
    }

    /**
     * Runs a nested constructor, recording its violations under {@code prefix} instead of failing.
     *
     * @return the constructed value, or {@code null} when it was invalid
     */
    public <T> T capture(String prefix, Supplier<T> factory) {
        try {
            return factory.get();
        } catch (ValidationException e) {
            addAll(e.violations(), prefix);
            return null;
        }
    }

    public boolean isValid() {
        return items.isEmpty();
    }

    public List<Violation> asList() {
        return List.copyOf(items);
    }

    public void throwIfAny(String subject) {
        if (!items.isEmpty()) {
            throw new ValidationException(subject, items);
        }
    }

    public static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    public static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null || uri.getHost().isBlank()) {
                return false;
            }
            String lowered = scheme.toLowerCase(Locale.ROOT);
            return lowered.equals("http") || lowered.equals("https");
        } catch (URISyntaxException e) {
            return false;
        }
    }
}

package com.globalnewsbrief.core.validation;

/**
 * A single broken constraint.
 *
 * @param field   dotted path of the offending field, e.g. {@code articles[2].summary}
 * @param rule    the kind of constraint that was broken
 * @param message human-readable description including the offending value where useful
 */
public record Violation(String field, Rule rule, String message) {
    public enum Rule {
        REQUIRED,
        LENGTH,
        WORD_COUNT,
        RANGE,
        FORMAT,
        ENUM,
        UNIQUE,
        CONSISTENCY
    }

    public Violation prefixed(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return this;
        }
        String path = field == null || field.isEmpty() ? prefix : prefix + "." + field;
        return new Violation(path, rule, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}

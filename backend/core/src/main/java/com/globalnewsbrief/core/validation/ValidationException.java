package com.globalnewsbrief.core.validation;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends IllegalArgumentException {
    private final transient List<Violation> violations;

    public ValidationException(String subject, List<Violation> violations) {
        super(describe(subject, violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    public boolean hasViolationOn(String field) {
        return violations.stream().anyMatch(v -> field.equals(v.field()));
    }

    private static String describe(String subject, List<Violation> violations) {
        return subject + " validation failed with " + violations.size() + " violation(s): "
                + violations.stream().map(Violation::toString).collect(Collectors.joining("; "));
    }
}

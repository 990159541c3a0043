package com.globalnewsbrief.service.retry;

public class RetriesExhaustedException extends RuntimeException {
    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Exception lastFailure) {
        super("Failed after " + attempts + " attempts calling " + operation + ": " + lastFailure.getMessage(), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}

package com.globalnewsbrief.formatter.extract;

/**
 * Raised when generated text cannot be turned into article mappings. Callers tell "nothing came
 * back" from "garbage came back" through {@link #kind()}.
 */
public abstract class ContentExtractionException extends IllegalArgumentException {
    public enum Kind {
        EMPTY_CONTENT,
        MALFORMED_CONTENT
    }

    protected ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();
}

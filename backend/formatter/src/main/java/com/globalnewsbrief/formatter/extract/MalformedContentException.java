package com.globalnewsbrief.formatter.extract;

public class MalformedContentException extends ContentExtractionException {
    public MalformedContentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.MALFORMED_CONTENT;
    }
}

package com.globalnewsbrief.formatter.extract;

public class EmptyContentException extends ContentExtractionException {
    public EmptyContentException(String message) {
        super(message, null);
    }

    @Override
    public Kind kind() {
        return Kind.EMPTY_CONTENT;
    }
}

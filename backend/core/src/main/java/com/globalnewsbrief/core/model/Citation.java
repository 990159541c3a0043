package com.globalnewsbrief.core.model;

import com.globalnewsbrief.core.validation.Violations;

public record Citation(String title, String url, String publisher) {
    public static final int MAX_TITLE_LENGTH = 150;
    public static final int MAX_PUBLISHER_LENGTH = 100;

    public Citation {
        Violations violations = new Violations();
        violations.length("title", title, 1, MAX_TITLE_LENGTH);
        violations.httpUrl("url", url);
        violations.length("publisher", publisher, 1, MAX_PUBLISHER_LENGTH);
        violations.throwIfAny("Citation");
    }
}

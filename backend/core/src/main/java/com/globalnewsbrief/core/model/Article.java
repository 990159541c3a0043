package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single validated news item. Length and word-count bounds on the summary are enforced
 * independently of each other.
 */
public record Article(
        String title,
        String summary,
        Category category,
        Source source,
        List<Citation> citations,
        @JsonProperty("article_id") String articleId
) {
    public static final int MIN_TITLE_LENGTH = 10;
    public static final int MAX_TITLE_LENGTH = 120;
    public static final int MIN_SUMMARY_LENGTH = 40;
    public static final int MAX_SUMMARY_LENGTH = 500;
    public static final int MIN_SUMMARY_WORDS = 20;
    public static final int MAX_SUMMARY_WORDS = 100;
    public static final int MIN_CITATIONS = 1;
    public static final int MAX_CITATIONS = 3;

    static final Pattern ARTICLE_ID = Pattern.compile("[a-z]+-\\d{4}-\\d{2}-\\d{2}-[a-z]+-\\d{3}");

    public Article {
        Violations violations = new Violations();
        violations.length("title", title, MIN_TITLE_LENGTH, MAX_TITLE_LENGTH);
        violations.length("summary", summary, MIN_SUMMARY_LENGTH, MAX_SUMMARY_LENGTH);
        violations.wordCount("summary", summary, MIN_SUMMARY_WORDS, MAX_SUMMARY_WORDS);
        violations.required("category", category);
        violations.required("source", source);
        violations.size("citations", citations, MIN_CITATIONS, MAX_CITATIONS);
        if (citations != null && citations.stream().anyMatch(Objects::isNull)) {
            violations.add("citations", Violation.Rule.REQUIRED, "must not contain null entries");
        }
        violations.matches("article_id", articleId, ARTICLE_ID, "{region}-{YYYY-MM-DD}-{period}-{NNN}");
        violations.throwIfAny("Article");
        citations = List.copyOf(citations);
    }

    /**
     * Derives the identifier of the article at 1-based {@code sequence} within a bulletin.
     */
    public static String idFor(Region region, String date, Period period, int sequence) {
        return Bulletin.idFor(region, date, period) + "-" + String.format(Locale.ROOT, "%03d", sequence);
    }
}

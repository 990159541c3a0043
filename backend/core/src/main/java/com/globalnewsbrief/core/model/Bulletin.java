package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One region, date and period worth of articles. Built once per formatting run and never
 * mutated afterwards.
 */
public record Bulletin(
        String id,
        Region region,
        String date,
        Period period,
        @JsonProperty("generated_at") Instant generatedAt,
        String version,
        List<Article> articles,
        Metadata metadata
) {
    public static final int MIN_ARTICLES = 5;
    public static final int MAX_ARTICLES = 10;

    public static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    static final Pattern BULLETIN_ID = Pattern.compile("[a-z]+-\\d{4}-\\d{2}-\\d{2}-[a-z]+");

    public Bulletin {
        Violations violations = new Violations();
        violations.matches("id", id, BULLETIN_ID, "{region}-{YYYY-MM-DD}-{period}");
        violations.required("region", region);
        violations.matches("date", date, DATE, "YYYY-MM-DD");
        violations.required("period", period);
        violations.required("generated_at", generatedAt);
        violations.required("version", version);
        violations.required("metadata", metadata);
        checkArticles(articles, violations);

        if (id != null && region != null && period != null && date != null) {
            String expected = idFor(region, date, period);
            if (!expected.equals(id)) {
                violations.add("id", Violation.Rule.CONSISTENCY, "must equal '" + expected + "' (was '" + id + "')");
            }
        }
        if (id != null && articles != null) {
            checkArticleIds(id, articles, violations);
        }
        if (metadata != null && articles != null && metadata.articleCount() != articles.size()) {
            violations.add("metadata.article_count", Violation.Rule.CONSISTENCY,
                    "must equal the number of articles " + articles.size() + " (was " + metadata.articleCount() + ")");
        }
        violations.throwIfAny("Bulletin");

        articles = List.copyOf(articles);
    }

    /**
     * Checks the article sequence on its own: count bounds, null entries and identifier uniqueness.
     */
    public static void checkArticles(List<Article> articles, Violations violations) {
        violations.size("articles", articles, MIN_ARTICLES, MAX_ARTICLES);
        if (articles == null) {
            return;
        }
        if (articles.stream().anyMatch(Objects::isNull)) {
            violations.add("articles", Violation.Rule.REQUIRED, "must not contain null entries");
            return;
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Article article : articles) {
            if (!seen.add(article.articleId())) {
                duplicates.add(article.articleId());
            }
        }
        if (!duplicates.isEmpty()) {
            violations.add("articles", Violation.Rule.UNIQUE, "article_id values must be unique, duplicated: " + duplicates);
        }
    }

    /**
     * Every article identifier must extend the bulletin identifier with its sequence suffix.
     */
    static void checkArticleIds(String bulletinId, List<Article> articles, Violations violations) {
        String prefix = bulletinId + "-";
        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);
            if (article != null && !article.articleId().startsWith(prefix)) {
                violations.add("articles[" + i + "].article_id", Violation.Rule.CONSISTENCY,
                        "must start with '" + prefix + "' (was '" + article.articleId() + "')");
            }
        }
    }

    public static String idFor(Region region, String date, Period period) {
        return region.value() + "-" + date + "-" + period.value();
    }
}

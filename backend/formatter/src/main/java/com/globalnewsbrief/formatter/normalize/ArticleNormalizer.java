package com.globalnewsbrief.formatter.normalize;

import com.globalnewsbrief.core.bus.EventBus;
import com.globalnewsbrief.core.events.FallbackApplied;
import com.globalnewsbrief.core.model.Article;
import com.globalnewsbrief.core.model.Bulletin;
import com.globalnewsbrief.core.model.BulletinWrapper;
import com.globalnewsbrief.core.model.Category;
import com.globalnewsbrief.core.model.Citation;
import com.globalnewsbrief.core.model.Metadata;
import com.globalnewsbrief.core.model.Source;
import com.globalnewsbrief.core.model.TokenUsage;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;
import com.globalnewsbrief.formatter.config.FormatterSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Maps raw article mappings, the shared citation pool and the usage record onto a validated
 * bulletin.
 *
 * <p>Non-authoritative metadata is repaired with fixed fallbacks: an unknown category becomes
 * {@link Category#DEFAULT}, a missing citation becomes an "Original Source" citation pointing at the
 * article's own source, a missing source is taken from the first assigned citation or the
 * configured default. Every repair is published as {@link FallbackApplied}. Authored content
 * (titles, summaries) and structural bounds are never repaired; all their violations are reported
 * together in one {@link com.globalnewsbrief.core.validation.ValidationException}.
 */
public class ArticleNormalizer {
    public static final String DEFAULT_CITATION_TITLE = "Original Source";

    private static final Logger LOGGER = Logger.getLogger(ArticleNormalizer.class.getName());

    private final FormatterSettings settings;
    private final Clock clock;
    private final EventBus eventBus;

    public ArticleNormalizer(FormatterSettings settings, Clock clock, EventBus eventBus) {
        this.settings = settings;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public BulletinWrapper normalize(
            List<Map<String, Object>> rawArticles,
            List<Object> rawCitations,
            Map<String, Object> rawUsage,
            BulletinContext context
    ) {
        String date = context.date() == null
                ? LocalDate.ofInstant(context.startedAt(), ZoneOffset.UTC).toString()
                : context.date();

        Violations dateCheck = new Violations();
        dateCheck.matches("date", date, Bulletin.DATE, "YYYY-MM-DD");
        dateCheck.throwIfAny("Bulletin");

        Violations violations = new Violations();
        List<Citation> pool = citationPool(rawCitations);
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < rawArticles.size(); i++) {
            String articleId = Article.idFor(context.region(), date, context.period(), i + 1);
            Article article = normalizeArticle(
                    rawArticles.get(i),
                    articleId,
                    CitationPartition.slice(pool, i, rawArticles.size()),
                    "articles[" + i + "]",
                    violations
            );
            if (article != null) {
                articles.add(article);
            }
        }
        if (articles.size() == rawArticles.size()) {
            Bulletin.checkArticles(articles, violations);
        } else {
            violations.size("articles", rawArticles, Bulletin.MIN_ARTICLES, Bulletin.MAX_ARTICLES);
        }
        TokenUsage usage = usage(rawUsage, violations);
        violations.throwIfAny("Bulletin");

        Instant generatedAt = clock.instant();
        double processingSeconds = Math.max(0L, Duration.between(context.startedAt(), generatedAt).toMillis()) / 1000.0;
        Metadata metadata = new Metadata(
                articles.size(),
                distribution(articles),
                usage,
                processingSeconds,
                settings.llmModel(),
                context.workflowRunId()
        );
        Bulletin bulletin = new Bulletin(
                Bulletin.idFor(context.region(), date, context.period()),
                context.region(),
                date,
                context.period(),
                generatedAt,
                settings.version(),
                articles,
                metadata
        );
        return new BulletinWrapper(bulletin);
    }

    private Article normalizeArticle(
            Map<String, Object> raw,
            String articleId,
            List<Citation> assigned,
            String path,
            Violations violations
    ) {
        Category category = category(raw, articleId);
        Violations sourceViolations = new Violations();
        Source source = sourceViolations.capture(path + ".source", () -> source(raw, assigned, articleId));
        List<Citation> citations = assigned.isEmpty() && source != null
                ? List.of(defaultCitation(source, articleId))
                : assigned;

        // content checks still run without a source; drop what only restates the source failure
        Violations articleViolations = new Violations();
        Article article = articleViolations.capture(path, () -> new Article(
                RawFields.text(raw, "title"),
                RawFields.text(raw, "summary"),
                category,
                source,
                citations,
                articleId
        ));
        violations.addAll(sourceViolations.asList(), "");
        for (Violation violation : articleViolations.asList()) {
            if (source == null && derivedFromSource(violation.field(), path, citations.isEmpty())) {
                continue;
            }
            violations.add(violation.field(), violation.rule(), violation.message());
        }
        return article;
    }

    private static boolean derivedFromSource(String field, String path, boolean citationsDerived) {
        return field.equals(path + ".source") || (citationsDerived && field.equals(path + ".citations"));
    }

    /**
     * Case-sensitive table lookup with {@link Category#DEFAULT} on any miss.
     */
    Category category(Map<String, Object> raw, String articleId) {
        String value = RawFields.scalar(raw.get("category"));
        Category category = Category.lookup(value).orElse(null);
        if (category != null) {
            return category;
        }
        fallback(articleId, "category", value == null
                ? "category missing, using '" + Category.DEFAULT.value() + "'"
                : "unknown category '" + value + "', using '" + Category.DEFAULT.value() + "'");
        return Category.DEFAULT;
    }

    private Source source(Map<String, Object> raw, List<Citation> assigned, String articleId) {
        Object rawSource = raw.get("source");
        String name = null;
        String url = null;
        String publishedAt = null;
        if (rawSource instanceof Map<?, ?> nested) {
            name = RawFields.text(nested, "name", "publisher");
            url = RawFields.text(nested, "url");
            publishedAt = RawFields.text(nested, "published_at");
        } else {
            name = RawFields.text(raw, "source");
        }
        url = RawFields.firstNonBlank(url, RawFields.text(raw, "source_url", "url"));
        publishedAt = RawFields.firstNonBlank(publishedAt, RawFields.text(raw, "published_at"));

        Citation lead = assigned.isEmpty() ? null : assigned.get(0);
        if (name == null) {
            name = lead == null ? settings.defaultSourceName() : lead.publisher();
            fallback(articleId, "source.name", "source name missing, using '" + name + "'");
        }
        if (url == null) {
            url = lead == null ? settings.defaultSourceUrl() : lead.url();
            fallback(articleId, "source.url", "source url missing, using '" + url + "'");
        }
        return Source.of(name, url, publishedAt);
    }

    private Citation defaultCitation(Source source, String articleId) {
        fallback(articleId, "citations", "citation pool empty, citing the article source");
        return new Citation(DEFAULT_CITATION_TITLE, source.url(), truncate(source.name(), Citation.MAX_PUBLISHER_LENGTH));
    }

    /**
     * Turns the raw pool into citations, dropping entries that cannot form a valid one.
     */
    List<Citation> citationPool(List<Object> rawCitations) {
        List<Citation> pool = new ArrayList<>();
        for (int i = 0; i < rawCitations.size(); i++) {
            Object entry = rawCitations.get(i);
            Violations entryViolations = new Violations();
            Citation citation = entryViolations.capture("", () -> citation(entry));
            if (citation != null) {
                pool.add(citation);
            } else {
                LOGGER.warning("Dropping citation " + i + " from pool: " + entryViolations.asList());
                fallback(null, "citations[" + i + "]", "dropped invalid citation: " + entryViolations.asList());
            }
        }
        return pool;
    }

    private static Citation citation(Object entry) {
        if (entry instanceof Map<?, ?> raw) {
            String url = RawFields.text(raw, "url");
            String host = host(url);
            return new Citation(
                    RawFields.firstNonBlank(RawFields.text(raw, "title"), host),
                    url,
                    RawFields.firstNonBlank(RawFields.text(raw, "publisher"), host)
            );
        }
        String url = RawFields.scalar(entry);
        String host = host(url);
        return new Citation(host, url == null ? null : url.trim(), host);
    }

    private static String host(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host != null && host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private TokenUsage usage(Map<String, Object> rawUsage, Violations violations) {
        Violations counts = new Violations();
        long prompt = RawFields.count(rawUsage, "prompt_tokens", counts);
        long completion = RawFields.count(rawUsage, "completion_tokens", counts);
        long total = RawFields.count(rawUsage, "total_tokens", counts);
        if (!counts.isValid()) {
            violations.addAll(counts.asList(), "metadata.llm_usage");
            return null;
        }
        return violations.capture("metadata.llm_usage", () -> new TokenUsage(prompt, completion, total));
    }

    /**
     * Counts the final, already-defaulted category of each article, in category declaration order.
     */
    static Map<String, Integer> distribution(List<Article> articles) {
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (Article article : articles) {
            counts.merge(article.category(), 1, Integer::sum);
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        counts.forEach((category, count) -> distribution.put(category.value(), count));
        return distribution;
    }

    private void fallback(String articleId, String field, String detail) {
        LOGGER.fine(() -> "Fallback on " + (articleId == null ? "" : articleId + " ") + field + ": " + detail);
        eventBus.publish(new FallbackApplied(clock.instant(), articleId, field, detail));
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}

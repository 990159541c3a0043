package com.globalnewsbrief.formatter.normalize;

import com.globalnewsbrief.core.bus.EventBus;
import com.globalnewsbrief.core.events.FallbackApplied;
import com.globalnewsbrief.core.model.Article;
import com.globalnewsbrief.core.model.Bulletin;
import com.globalnewsbrief.core.model.BulletinWrapper;
import com.globalnewsbrief.core.model.Category;
import com.globalnewsbrief.core.model.Citation;
import com.globalnewsbrief.core.model.Period;
import com.globalnewsbrief.core.model.Region;
import com.globalnewsbrief.core.validation.ValidationException;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.formatter.config.FormatterSettings;
import com.globalnewsbrief.formatter.support.EventCapture;
import com.globalnewsbrief.formatter.support.RawArticles;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArticleNormalizerTest {
    private static final Instant NOW = Instant.parse("2025-12-15T07:45:00Z");

    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final ArticleNormalizer normalizer = new ArticleNormalizer(
            FormatterSettings.defaults(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            bus
    );

    @Test
    void unknownOrMissingCategoryFallsBackToWorld() {
        assertEquals(Category.HEALTH, normalizer.category(Map.of("category", "health"), "id"));
        assertEquals(Category.WORLD, normalizer.category(Map.of("category", "invalid_category"), "id"));
        assertEquals(Category.WORLD, normalizer.category(Map.of("category", "Politics"), "id"));
        assertEquals(Category.WORLD, normalizer.category(Map.of(), "id"));
        assertEquals(Category.WORLD, normalizer.category(Map.of("category", List.of("politics")), "id"));

        assertEquals(4, capture.byType(FallbackApplied.class).stream()
                .filter(event -> event.field().equals("category"))
                .count());
    }

    @Test
    void derivesSequentialIdsAndDefaultsDateToUtcToday() {
        Bulletin bulletin = normalize(RawArticles.articles(6, "politics"), List.of(), null).bulletin();

        assertEquals("world-2025-12-15-evening", bulletin.id());
        assertEquals("2025-12-15", bulletin.date());
        for (int i = 0; i < 6; i++) {
            assertEquals(String.format("world-2025-12-15-evening-%03d", i + 1), bulletin.articles().get(i).articleId());
        }
        assertEquals(NOW, bulletin.generatedAt());
        assertEquals(0.0, bulletin.metadata().processingTimeSeconds());
    }

    @Test
    void emptyPoolSynthesizesOriginalSourceCitationFromArticleSource() {
        List<Map<String, Object>> raw = RawArticles.articles(5, "economy");
        raw.get(0).put("source", Map.of("name", "Market Ledger", "url", "https://marketledger.example.com/a"));

        List<Article> articles = normalize(raw, List.of(), null).bulletin().articles();

        Citation first = articles.get(0).citations().get(0);
        assertEquals(ArticleNormalizer.DEFAULT_CITATION_TITLE, first.title());
        assertEquals("https://marketledger.example.com/a", first.url());
        assertEquals("Market Ledger", first.publisher());

        Article second = articles.get(1);
        assertEquals(FormatterSettings.DEFAULT_SOURCE_NAME, second.source().name());
        assertEquals(FormatterSettings.DEFAULT_SOURCE_URL, second.source().url());
        assertEquals(1, second.citations().size());
        assertEquals(FormatterSettings.DEFAULT_SOURCE_URL, second.citations().get(0).url());
    }

    @Test
    void missingSourceIsTakenFromLeadCitation() {
        Article article = normalize(RawArticles.articles(5, "sports"), RawArticles.citations(5), null)
                .bulletin().articles().get(2);

        assertEquals("Pub 3", article.source().name());
        assertEquals("https://example.com/3", article.source().url());
        assertEquals("Citation 3", article.citations().get(0).title());
    }

    @Test
    void flatSourceFieldsAreRead() {
        List<Map<String, Object>> raw = RawArticles.articles(5, "technology");
        raw.get(0).put("source", "Tech Daily");
        raw.get(0).put("source_url", "https://techdaily.example.com/story");
        raw.get(0).put("published_at", "2025-12-15T05:00:00Z");

        Article article = normalize(raw, RawArticles.citations(5), null).bulletin().articles().get(0);

        assertEquals("Tech Daily", article.source().name());
        assertEquals("https://techdaily.example.com/story", article.source().url());
        assertEquals(Instant.parse("2025-12-15T05:00:00Z"), article.source().publishedAt());
    }

    @Test
    void bareUrlCitationsAreAcceptedAndInvalidEntriesDropped() {
        List<Object> pool = new ArrayList<>();
        pool.add("https://www.reuters.com/world/story");
        pool.add("not a url");
        pool.add(Map.of("title", "A".repeat(151), "url", "https://example.com/long", "publisher", "Pub"));
        pool.add(Map.of("url", "https://apnews.com/article/1"));

        List<Citation> citations = normalizer.citationPool(pool);

        assertEquals(2, citations.size());
        assertEquals(new Citation("reuters.com", "https://www.reuters.com/world/story", "reuters.com"), citations.get(0));
        assertEquals("apnews.com", citations.get(1).publisher());
        assertEquals(2, capture.byType(FallbackApplied.class).stream()
                .filter(event -> event.field().startsWith("citations["))
                .count());
    }

    @Test
    void distributionCountsFinalCategories() {
        List<Map<String, Object>> raw = new ArrayList<>();
        raw.add(RawArticles.article("Politics Article One", "politics"));
        raw.add(RawArticles.article("Mystery Article Two", "astrology"));
        raw.add(RawArticles.article("Politics Article Three", "politics"));
        raw.add(RawArticles.article("Science Article Four", "science"));
        raw.add(RawArticles.article("Missing Article Five", null));

        Map<String, Integer> distribution = normalize(raw, List.of(), null).bulletin().metadata().categoriesDistribution();

        assertEquals(Map.of("politics", 2, "science", 1, "world", 2), distribution);
        assertEquals(List.of("politics", "science", "world"), new ArrayList<>(distribution.keySet()));
    }

    @Test
    void usageCountsDefaultToZeroAndAcceptIntegralText() {
        assertEquals(0, normalize(RawArticles.articles(5, "world"), List.of(), Map.of())
                .bulletin().metadata().llmUsage().totalTokens());

        Map<String, Object> usage = Map.of("prompt_tokens", "120", "completion_tokens", 80.0, "total_tokens", 200);
        assertEquals(200, normalize(RawArticles.articles(5, "world"), List.of(), usage)
                .bulletin().metadata().llmUsage().totalTokens());
    }

    @Test
    void usageSumMismatchIsFatal() {
        ValidationException error = assertThrows(ValidationException.class, () -> normalize(
                RawArticles.articles(5, "world"), List.of(), RawArticles.usage(100, 200, 250)));

        assertTrue(error.hasViolationOn("metadata.llm_usage.total_tokens"));

        ValidationException textual = assertThrows(ValidationException.class, () -> normalize(
                RawArticles.articles(5, "world"), List.of(), Map.of("prompt_tokens", "lots")));
        assertEquals(Violation.Rule.FORMAT, textual.violations().get(0).rule());
        assertEquals("metadata.llm_usage.prompt_tokens", textual.violations().get(0).field());
    }

    @Test
    void authoredContentViolationsAreAggregatedAcrossArticles() {
        List<Map<String, Object>> raw = RawArticles.articles(5, "politics");
        raw.get(1).put("title", "Short");
        raw.get(3).put("summary", "Too short");

        ValidationException error = assertThrows(ValidationException.class,
                () -> normalize(raw, List.of(), RawArticles.usage(1, 1, 3)));

        assertTrue(error.hasViolationOn("articles[1].title"));
        assertTrue(error.hasViolationOn("articles[3].summary"));
        assertTrue(error.hasViolationOn("metadata.llm_usage.total_tokens"));
        assertFalse(error.hasViolationOn("articles"));
    }

    @Test
    void invalidSourceDoesNotHideContentViolations() {
        List<Map<String, Object>> raw = RawArticles.articles(5, "politics");
        raw.get(0).put("title", "short");
        raw.get(0).put("source", Map.of("name", "Wire", "url", "not a url"));

        ValidationException error = assertThrows(ValidationException.class,
                () -> normalize(raw, List.of(), null));

        assertTrue(error.hasViolationOn("articles[0].source.url"));
        assertTrue(error.hasViolationOn("articles[0].title"));
        assertFalse(error.hasViolationOn("articles[0].source"));
        assertFalse(error.hasViolationOn("articles[0].citations"));
        assertEquals(2, error.violations().size());
    }

    @Test
    void zeroArticlesReportsTooFewArticles() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> normalize(List.of(), List.of(), null));

        assertTrue(error.hasViolationOn("articles"));
        assertTrue(error.getMessage().contains("was 0"));
    }

    @Test
    void malformedCallerDateIsRejectedUpFront() {
        BulletinContext context = new BulletinContext(Region.USA, Period.MORNING, "12/15/2025", NOW, null);

        ValidationException error = assertThrows(ValidationException.class,
                () -> normalizer.normalize(RawArticles.articles(5, "world"), List.of(), Map.of(), context));

        assertEquals(1, error.violations().size());
        assertTrue(error.hasViolationOn("date"));
    }

    private BulletinWrapper normalize(
            List<Map<String, Object>> raw,
            List<Object> citations,
            Map<String, Object> usage
    ) {
        BulletinContext context = new BulletinContext(Region.WORLD, Period.EVENING, null, NOW, null);
        return normalizer.normalize(raw, citations, usage == null ? Map.of() : usage, context);
    }
}

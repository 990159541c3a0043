package com.globalnewsbrief.core.model;

import com.globalnewsbrief.core.support.ModelFixtures;
import com.globalnewsbrief.core.validation.ValidationException;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulletinTest {
    @Test
    void validBulletinKeepsArticleOrder() {
        Bulletin bulletin = ModelFixtures.bulletin(ModelFixtures.articles(5));

        assertEquals("usa-2025-12-15-morning", bulletin.id());
        assertEquals(Region.USA, bulletin.region());
        assertEquals(Period.MORNING, bulletin.period());
        assertEquals(5, bulletin.articles().size());
        assertEquals("usa-2025-12-15-morning-005", bulletin.articles().get(4).articleId());
        assertEquals(bulletin, new BulletinWrapper(bulletin).bulletin());
    }

    @Test
    void idMustMatchRegionDatePeriod() {
        List<Article> articles = ModelFixtures.articles(5);
        ValidationException malformed = assertThrows(ValidationException.class, () -> new Bulletin(
                "invalid-id-format", Region.USA, "2025-12-15", Period.MORNING,
                ModelFixtures.GENERATED_AT, "1.0", articles, ModelFixtures.metadata(5)));
        assertTrue(malformed.hasViolationOn("id"));

        ValidationException inconsistent = assertThrows(ValidationException.class, () -> new Bulletin(
                "usa-2025-12-15-evening", Region.USA, "2025-12-15", Period.MORNING,
                ModelFixtures.GENERATED_AT, "1.0", articles, ModelFixtures.metadata(5)));
        assertEquals(Violation.Rule.CONSISTENCY, inconsistent.violations().get(0).rule());
    }

    @Test
    void dateMustFollowPattern() {
        ValidationException error = assertThrows(ValidationException.class, () -> new Bulletin(
                "usa-12/15/2025-morning", Region.USA, "12/15/2025", Period.MORNING,
                ModelFixtures.GENERATED_AT, "1.0", ModelFixtures.articles(5), ModelFixtures.metadata(5)));

        assertTrue(error.hasViolationOn("date"));
        assertTrue(error.hasViolationOn("id"));
    }

    @Test
    void articleCountMustBeBetweenFiveAndTen() {
        ValidationException tooFew = assertThrows(ValidationException.class,
                () -> ModelFixtures.bulletin(ModelFixtures.articles(4)));
        assertTrue(tooFew.hasViolationOn("articles"));

        assertEquals(10, ModelFixtures.bulletin(ModelFixtures.articles(10)).articles().size());

        List<Article> eleven = new ArrayList<>(ModelFixtures.articles(10));
        eleven.add(ModelFixtures.article(11, Category.HEALTH));
        Violations violations = new Violations();
        Bulletin.checkArticles(eleven, violations);
        assertEquals(1, violations.asList().size());
        assertEquals(Violation.Rule.RANGE, violations.asList().get(0).rule());
    }

    @Test
    void articleIdsMustBeUnique() {
        List<Article> articles = new ArrayList<>(ModelFixtures.articles(4));
        articles.add(ModelFixtures.article(1, Category.ECONOMY));

        ValidationException error = assertThrows(ValidationException.class, () -> ModelFixtures.bulletin(articles));

        Violation unique = error.violations().stream()
                .filter(v -> v.rule() == Violation.Rule.UNIQUE)
                .findFirst()
                .orElseThrow();
        assertEquals("articles", unique.field());
        assertTrue(unique.message().contains("usa-2025-12-15-morning-001"));
    }

    @Test
    void metadataArticleCountMustMatchArticles() {
        ValidationException error = assertThrows(ValidationException.class, () -> new Bulletin(
                "usa-2025-12-15-morning", Region.USA, "2025-12-15", Period.MORNING,
                ModelFixtures.GENERATED_AT, "1.0", ModelFixtures.articles(6), ModelFixtures.metadata(5)));

        assertTrue(error.hasViolationOn("metadata.article_count"));
    }

    @Test
    void missingFieldsAreAllReported() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> new Bulletin(null, null, null, null, null, " ", null, null));

        for (String field : List.of("id", "region", "date", "period", "generated_at", "version", "articles", "metadata")) {
            assertTrue(error.hasViolationOn(field), "expected violation on " + field);
        }
        assertThrows(ValidationException.class, () -> new BulletinWrapper(null));
    }

    @Test
    void acceptsImmutableListsAndRejectsNullEntries() {
        Citation citation = ModelFixtures.citation();
        Article article = new Article(
                "Immutable Citation List",
                ModelFixtures.SUMMARY,
                Category.SCIENCE,
                ModelFixtures.source(),
                List.of(citation),
                "usa-2025-12-15-morning-001"
        );
        List<Article> articles = List.of(
                article,
                ModelFixtures.article(2, Category.POLITICS),
                ModelFixtures.article(3, Category.POLITICS),
                ModelFixtures.article(4, Category.POLITICS),
                ModelFixtures.article(5, Category.POLITICS)
        );

        assertEquals(5, ModelFixtures.bulletin(articles).articles().size());

        List<Article> withNull = new ArrayList<>(articles);
        withNull.set(2, null);
        ValidationException error = assertThrows(ValidationException.class, () -> ModelFixtures.bulletin(withNull));
        assertTrue(error.hasViolationOn("articles"));
    }

    @Test
    void articleIdsMustBelongToTheBulletin() {
        List<Article> articles = new ArrayList<>(ModelFixtures.articles(4));
        articles.add(new Article(
                "Article From Another Bulletin",
                ModelFixtures.SUMMARY,
                Category.WORLD,
                ModelFixtures.source(),
                List.of(ModelFixtures.citation()),
                "india-2025-12-14-evening-001"
        ));

        ValidationException error = assertThrows(ValidationException.class, () -> ModelFixtures.bulletin(articles));

        assertTrue(error.hasViolationOn("articles[4].article_id"));
        assertEquals(1, error.violations().size());
        assertEquals(Violation.Rule.CONSISTENCY, error.violations().get(0).rule());
    }
}

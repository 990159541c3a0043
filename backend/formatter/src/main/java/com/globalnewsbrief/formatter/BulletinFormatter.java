package com.globalnewsbrief.formatter;

import com.globalnewsbrief.core.bus.EventBus;
import com.globalnewsbrief.core.events.BulletinFormatted;
import com.globalnewsbrief.core.events.FormatFailed;
import com.globalnewsbrief.core.model.Bulletin;
import com.globalnewsbrief.core.model.BulletinWrapper;
import com.globalnewsbrief.core.model.Period;
import com.globalnewsbrief.core.model.Region;
import com.globalnewsbrief.core.validation.ValidationException;
import com.globalnewsbrief.formatter.api.LlmResponse;
import com.globalnewsbrief.formatter.config.FormatterSettings;
import com.globalnewsbrief.formatter.extract.ContentExtractionException;
import com.globalnewsbrief.formatter.extract.ContentExtractor;
import com.globalnewsbrief.formatter.normalize.ArticleNormalizer;
import com.globalnewsbrief.formatter.normalize.BulletinContext;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single entry point turning a raw API response into a validated bulletin.
 *
 * <p>Extraction failures surface as {@link ContentExtractionException} (empty vs malformed by
 * kind), model violations as one aggregated {@link ValidationException}. Nothing is retried or
 * repaired here, and no partial bulletin is ever returned. Instances hold no mutable state and may
 * be shared across threads.
 */
public class BulletinFormatter {
    private static final Logger LOGGER = Logger.getLogger(BulletinFormatter.class.getName());

    private final ContentExtractor extractor;
    private final ArticleNormalizer normalizer;
    private final Clock clock;
    private final EventBus eventBus;

    public BulletinFormatter() {
        this(FormatterSettings.defaults(), Clock.systemUTC(), new EventBus());
    }

    public BulletinFormatter(FormatterSettings settings, Clock clock, EventBus eventBus) {
        Objects.requireNonNull(settings, "settings is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.extractor = new ContentExtractor();
        this.normalizer = new ArticleNormalizer(settings, clock, eventBus);
    }

    public BulletinWrapper format(LlmResponse response, Region region, Period period) {
        return format(response, region, period, null, null);
    }

    public BulletinWrapper format(LlmResponse response, Region region, Period period, String date) {
        return format(response, region, period, date, null);
    }

    public BulletinWrapper format(LlmResponse response, Region region, Period period, String date, String workflowRunId) {
        Objects.requireNonNull(response, "response is required");
        BulletinContext context = new BulletinContext(region, period, date, clock.instant(), workflowRunId);
        try {
            List<Map<String, Object>> rawArticles = extractor.extractArticles(response.content());
            BulletinWrapper wrapper = normalizer.normalize(rawArticles, response.citations(), response.usage(), context);

            Bulletin bulletin = wrapper.bulletin();
            LOGGER.info(() -> "Formatted bulletin " + bulletin.id() + " with " + bulletin.articles().size() + " articles");
            eventBus.publish(new BulletinFormatted(
                    bulletin.generatedAt(),
                    bulletin.id(),
                    bulletin.articles().size(),
                    bulletin.metadata().processingTimeSeconds()
            ));
            return wrapper;
        } catch (ContentExtractionException e) {
            failed(e.kind().name(), e.getMessage(), 0);
            throw e;
        } catch (ValidationException e) {
            failed("VALIDATION", e.getMessage(), e.violations().size());
            throw e;
        }
    }

    private void failed(String kind, String message, int violationCount) {
        LOGGER.warning(() -> "Bulletin formatting failed (" + kind + "): " + message);
        eventBus.publish(new FormatFailed(clock.instant(), kind, message, violationCount));
    }
}

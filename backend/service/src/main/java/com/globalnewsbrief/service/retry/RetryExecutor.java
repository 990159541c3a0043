package com.globalnewsbrief.service.retry;

import com.globalnewsbrief.core.bus.EventBus;
import com.globalnewsbrief.core.events.RetriesExhausted;
import com.globalnewsbrief.core.events.RetryScheduled;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Re-invokes an upstream call with capped exponential backoff. Attempts for one call run strictly
 * one after another on the calling thread.
 */
public class RetryExecutor {
    private static final Logger LOGGER = Logger.getLogger(RetryExecutor.class.getName());

    private final RetrySettings settings;
    private final Set<Class<? extends Exception>> retryable;
    private final Sleeper sleeper;
    private final EventBus eventBus;
    private final Clock clock;

    public RetryExecutor(
            RetrySettings settings,
            Set<Class<? extends Exception>> retryable,
            Sleeper sleeper,
            EventBus eventBus
    ) {
        this(settings, retryable, sleeper, eventBus, Clock.systemUTC());
    }

    public RetryExecutor(
            RetrySettings settings,
            Set<Class<? extends Exception>> retryable,
            Sleeper sleeper,
            EventBus eventBus,
            Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.retryable = Set.copyOf(Objects.requireNonNull(retryable, "retryable is required"));
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public <T> T call(String operation, Callable<T> action) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= settings.maxRetries(); attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                if (!isRetryable(e)) {
                    throw passThrough(operation, e);
                }
                lastFailure = e;
                if (attempt == settings.maxRetries()) {
                    break;
                }
                Duration delay = settings.delayBefore(attempt + 1);
                LOGGER.log(Level.WARNING, "Attempt " + attempt + "/" + settings.maxRetries() + " of " + operation
                        + " failed, retrying in " + delay.toMillis() + "ms: " + e.getMessage(),
                        new Object[]{context(operation, attempt, delay, e)});
                eventBus.publish(new RetryScheduled(
                        clock.instant(),
                        operation,
                        attempt,
                        settings.maxRetries(),
                        delay.toMillis(),
                        e.getMessage()
                ));
                pause(operation, delay, e);
            }
        }
        LogRecord record = new LogRecord(Level.SEVERE,
                "Giving up on " + operation + " after " + settings.maxRetries() + " attempts");
        record.setLoggerName(LOGGER.getName());
        record.setParameters(new Object[]{context(operation, settings.maxRetries(), null, lastFailure)});
        record.setThrown(lastFailure);
        LOGGER.log(record);
        eventBus.publish(new RetriesExhausted(clock.instant(), operation, settings.maxRetries(), lastFailure.getMessage()));
        throw new RetriesExhaustedException(operation, settings.maxRetries(), lastFailure);
    }

    /**
     * Structured fields for JSON log lines; {@code delay} is null once no further attempt follows.
     */
    private static Map<String, Object> context(String operation, int attempt, Duration delay, Exception error) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("function", operation);
        context.put("attempt", attempt);
        if (delay != null) {
            context.put("delay_seconds", delay.toMillis() / 1000.0);
        }
        context.put("error", error.getMessage());
        return context;
    }

    private boolean isRetryable(Exception e) {
        for (Class<? extends Exception> type : retryable) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    private void pause(String operation, Duration delay, Exception lastFailure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            IllegalStateException aborted = new IllegalStateException("Interrupted while retrying " + operation, lastFailure);
            aborted.addSuppressed(interrupted);
            throw aborted;
        }
    }

    private static RuntimeException passThrough(String operation, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(operation + " failed: " + e.getMessage(), e);
    }
}

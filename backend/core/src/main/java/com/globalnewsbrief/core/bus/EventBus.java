package com.globalnewsbrief.core.bus;

import com.globalnewsbrief.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous dispatch of pipeline events on the publishing thread.
 *
 * <p>Handlers subscribed to an exact event class run first, then the listeners registered with
 * {@link #subscribeAll(Consumer)}. A failing handler is reported to the error callback and never
 * stops delivery to the others or reaches the publisher.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<Event>>> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> listeners = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, RuntimeException> onHandlerError;

    public EventBus() {
        this(EventBus::logFailure);
    }

    public EventBus(BiConsumer<Event, RuntimeException> onHandlerError) {
        this.onHandlerError = Objects.requireNonNull(onHandlerError, "onHandlerError is required");
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<? super T> handler) {
        Objects.requireNonNull(handler, "handler is required");
        handlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void subscribeAll(Consumer<Event> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void publish(Event event) {
        Objects.requireNonNull(event, "event is required");
        for (Consumer<Event> handler : handlers.getOrDefault(event.getClass(), List.of())) {
            deliver(handler, event);
        }
        for (Consumer<Event> listener : listeners) {
            deliver(listener, event);
        }
    }

    private void deliver(Consumer<Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (RuntimeException ex) {
            onHandlerError.accept(event, ex);
        }
    }

    private static void logFailure(Event event, RuntimeException ex) {
        LOGGER.log(Level.WARNING, "Event handler failed for " + event.type() + " at " + event.timestamp(), ex);
    }
}

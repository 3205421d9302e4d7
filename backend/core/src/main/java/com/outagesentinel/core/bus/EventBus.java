package com.outagesentinel.core.bus;

import com.outagesentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe hand-off between the detector or aggregator and whatever
 * sinks are wired in (event log, console, transport). A failing subscriber never stops
 * delivery to the others.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> subscribers = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Subscriber failed handling " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(List<Class<? extends Event>> types, Consumer<Event> handler) {
        for (Class<? extends Event> type : types) {
            subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        }
    }

    public void publish(Event event) {
        for (Consumer<? extends Event> handler : subscribers.getOrDefault(event.getClass(), List.of())) {
            deliver(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void deliver(Consumer<? extends Event> handler, Event event) {
        try {
            ((Consumer<T>) handler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}

package com.outagesentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.core.events.DetectorHeartbeat;
import com.outagesentinel.core.events.DetectorRunCompleted;
import com.outagesentinel.core.events.Event;
import com.outagesentinel.core.events.OutageScopeChanged;
import com.outagesentinel.core.events.OutageSummaryUpdated;
import com.outagesentinel.core.events.ProviderOutageReported;
import com.outagesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * JSON line format shared by the event log and the API: {@code {type, timestamp, event}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            ProviderOutageReported.TYPE, ProviderOutageReported.class,
            DetectorHeartbeat.TYPE, DetectorHeartbeat.class,
            DetectorRunCompleted.TYPE, DetectorRunCompleted.class,
            OutageScopeChanged.TYPE, OutageScopeChanged.class,
            OutageSummaryUpdated.TYPE, OutageSummaryUpdated.class,
            AlertRaised.TYPE, AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static Set<String> typeNames() {
        return TYPES.keySet();
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(envelope(event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (IOException e) {
            throw new IllegalArgumentException("Not a JSON event line", e);
        }
        String type = node.path("type").asText();
        Class<? extends Event> eventClass = TYPES.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unsupported event type: " + type);
        }
        try {
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed " + type + " event", e);
        }
    }

    public static Envelope envelope(Event event) {
        return new Envelope(event.type(), event.timestamp(), event);
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(allEventTypes(), consumer);
    }

    public record Envelope(String type, Instant timestamp, Event event) {
    }
}

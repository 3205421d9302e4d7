package com.outagesentinel.aggregator.config;

import java.time.Duration;

public record AggregatorConfig(
        int port,
        long windowMs,
        long debounceMs,
        int nationwideStatesMin,
        int nationwideNodesMin,
        int stateMin,
        long reevaluateMs,
        String eventLog
) {
    public static final int DEFAULT_PORT = 8090;
    public static final long DEFAULT_WINDOW_MS = Duration.ofMinutes(10).toMillis();
    public static final long DEFAULT_DEBOUNCE_MS = Duration.ofSeconds(90).toMillis();
    public static final long DEFAULT_REEVALUATE_MS = Duration.ofSeconds(30).toMillis();

    public AggregatorConfig {
        port = port > 0 ? port : DEFAULT_PORT;
        windowMs = windowMs > 0 ? windowMs : DEFAULT_WINDOW_MS;
        debounceMs = debounceMs > 0 ? debounceMs : DEFAULT_DEBOUNCE_MS;
        nationwideStatesMin = nationwideStatesMin > 0 ? nationwideStatesMin : 3;
        nationwideNodesMin = nationwideNodesMin > 0 ? nationwideNodesMin : 5;
        stateMin = stateMin > 0 ? stateMin : 2;
        reevaluateMs = reevaluateMs > 0 ? reevaluateMs : DEFAULT_REEVALUATE_MS;
        eventLog = eventLog == null || eventLog.isBlank() ? "logs/aggregator-events.jsonl" : eventLog;
    }

    public static AggregatorConfig defaults() {
        return new AggregatorConfig(0, 0, 0, 0, 0, 0, 0, null);
    }

    public Duration window() {
        return Duration.ofMillis(windowMs);
    }

    public Duration debounce() {
        return Duration.ofMillis(debounceMs);
    }
}

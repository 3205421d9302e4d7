package com.outagesentinel.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Degraded-capability notice, e.g. an unreachable aggregator or a rejected message.
 */
public record AlertRaised(
        Instant timestamp,
        String source,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String TYPE = "AlertRaised";

    @Override
    public String type() {
        return TYPE;
    }
}

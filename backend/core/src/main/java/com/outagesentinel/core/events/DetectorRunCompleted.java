package com.outagesentinel.core.events;

import java.time.Instant;

public record DetectorRunCompleted(
        Instant timestamp,
        String region,
        int providers,
        int nonOkProviders,
        boolean controlOk,
        long durationMillis
) implements Event {
    public static final String TYPE = "DetectorRunCompleted";

    @Override
    public String type() {
        return TYPE;
    }
}

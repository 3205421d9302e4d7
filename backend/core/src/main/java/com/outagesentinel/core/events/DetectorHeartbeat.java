package com.outagesentinel.core.events;

import com.outagesentinel.core.model.ProviderState;

import java.time.Instant;
import java.util.Map;

public record DetectorHeartbeat(
        Instant timestamp,
        String region,
        boolean controlOk,
        int controlPassed,
        int controlTotal,
        Map<String, ProviderState> groupSummary
) implements Event {
    public static final String TYPE = "carrier_outage_heartbeat";

    @Override
    public String type() {
        return TYPE;
    }
}

package com.outagesentinel.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.core.model.ProviderType;
import com.outagesentinel.core.model.Signal;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ProviderOutageReported(
        Instant timestamp,
        String region,
        String provider,
        ProviderType providerType,
        ProviderState state,
        ProviderState rawState,
        double confidence,
        List<Signal> signals,
        @JsonInclude(JsonInclude.Include.ALWAYS) Instant firstSeen,
        Instant lastSeen,
        Map<String, ProviderState> groupSummary
) implements Event {
    public static final String TYPE = "carrier_outage";

    @Override
    public String type() {
        return TYPE;
    }
}

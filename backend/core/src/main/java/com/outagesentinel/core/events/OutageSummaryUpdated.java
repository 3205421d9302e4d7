package com.outagesentinel.core.events;

import com.outagesentinel.core.model.ProviderScopeSummary;

import java.time.Instant;
import java.util.Map;

public record OutageSummaryUpdated(
        Instant timestamp,
        Map<String, ProviderScopeSummary> providers
) implements Event {
    public static final String TYPE = "carrier_outage_summary";

    @Override
    public String type() {
        return TYPE;
    }
}

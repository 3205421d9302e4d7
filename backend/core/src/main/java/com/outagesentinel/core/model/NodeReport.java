package com.outagesentinel.core.model;

import java.time.Instant;
import java.util.List;

public record NodeReport(
        String provider,
        ProviderType providerType,
        ProviderState rawState,
        ProviderState confirmedState,
        double confidence,
        List<Signal> signals,
        Instant firstSeen,
        Instant lastSeen,
        boolean controlOk
) {
    public NodeReport {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}

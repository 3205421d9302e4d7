package com.outagesentinel.core.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.outagesentinel.core.model.ProviderScopeSummary;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;

import java.time.Instant;
import java.util.List;

public record OutageScopeChanged(
        Instant timestamp,
        String provider,
        Scope scope,
        Severity severity,
        double confidence,
        int impactedCount,
        List<String> affectedStates
) implements Event {
    public static final String TYPE = "carrier_outage_scope";

    public static OutageScopeChanged of(Instant timestamp, String provider, ProviderScopeSummary summary) {
        return new OutageScopeChanged(
                timestamp,
                provider,
                summary.scope(),
                summary.severity(),
                summary.confidence(),
                summary.impactedCount(),
                summary.affectedStates()
        );
    }

    @JsonIgnore
    public ProviderScopeSummary summary() {
        return new ProviderScopeSummary(scope, severity, confidence, impactedCount, affectedStates);
    }

    @Override
    public String type() {
        return TYPE;
    }
}

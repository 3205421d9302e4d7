package com.outagesentinel.core.model;

import java.util.List;

public record ProviderScopeSummary(
        Scope scope,
        Severity severity,
        double confidence,
        int impactedCount,
        List<String> affectedStates
) {
    public ProviderScopeSummary {
        affectedStates = affectedStates == null ? List.of() : List.copyOf(affectedStates);
    }

    public static ProviderScopeSummary cleared() {
        return new ProviderScopeSummary(Scope.LOCAL, Severity.MINOR, 0.0, 0, List.of());
    }
}

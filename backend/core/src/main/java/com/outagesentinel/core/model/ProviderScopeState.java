package com.outagesentinel.core.model;

import java.time.Instant;

/**
 * Reported scope for one provider and when it last changed. {@code escalatingSince} marks
 * when the raw classification first outranked {@code scope}; it is null while no
 * escalation is pending and is dropped whenever the scope changes.
 */
public record ProviderScopeState(Scope scope, Instant since, Instant escalatingSince) {
    public static ProviderScopeState startingAt(Scope scope, Instant since) {
        return new ProviderScopeState(scope, since, null);
    }
}

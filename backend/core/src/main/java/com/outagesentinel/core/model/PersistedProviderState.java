package com.outagesentinel.core.model;

import java.time.Instant;

/**
 * Per-provider hysteresis state carried between detector runs.
 * At most one of the two streaks is non-zero.
 */
public record PersistedProviderState(
        ProviderState state,
        int failStreak,
        int okStreak,
        Instant firstSeen
) {
    public PersistedProviderState {
        if (state == null) {
            state = ProviderState.OK;
        }
        if (failStreak < 0 || okStreak < 0) {
            throw new IllegalArgumentException("streaks must not be negative");
        }
        if (failStreak > 0 && okStreak > 0) {
            throw new IllegalArgumentException("failStreak and okStreak are mutually exclusive");
        }
    }

    public static PersistedProviderState fresh() {
        return new PersistedProviderState(ProviderState.OK, 0, 0, null);
    }
}

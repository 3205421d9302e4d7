package com.outagesentinel.detector.state;

import com.outagesentinel.core.model.PersistedProviderState;
import com.outagesentinel.core.model.ProviderState;

import java.time.Instant;

/**
 * Result of one hysteresis step: the state to persist, and the {@code firstSeen} to report
 * for this run. The two differ only on the RECOVERED run, which still reports when the
 * outage began while persisting a cleared value.
 */
public record Transition(PersistedProviderState state, Instant firstSeen) {
    public ProviderState confirmedState() {
        return state.state();
    }
}

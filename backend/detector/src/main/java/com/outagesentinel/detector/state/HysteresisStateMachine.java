package com.outagesentinel.detector.state;

import com.outagesentinel.core.model.PersistedProviderState;
import com.outagesentinel.core.model.ProviderState;

import java.time.Instant;

/**
 * Damps per-run raw states into a confirmed provider state.
 * <p>
 * Any failing run is immediately visible as {@link ProviderState#DEGRADED}, but
 * {@link ProviderState#MAJOR_OUTAGE} needs {@code failForMajor} consecutive failing runs
 * whose raw state was itself a major outage. Leaving a non-OK state needs
 * {@code okForRecovery} consecutive healthy runs and passes through
 * {@link ProviderState#RECOVERED} for exactly one run.
 */
public class HysteresisStateMachine {
    private final int failForMajor;
    private final int okForRecovery;

    public HysteresisStateMachine(int failForMajor, int okForRecovery) {
        if (failForMajor < 1 || okForRecovery < 1) {
            throw new IllegalArgumentException("streak thresholds must be at least 1");
        }
        this.failForMajor = failForMajor;
        this.okForRecovery = okForRecovery;
    }

    public Transition apply(PersistedProviderState previous, ProviderState rawState, Instant now) {
        if (rawState == ProviderState.RECOVERED) {
            throw new IllegalArgumentException("RECOVERED is never a raw state");
        }
        if (rawState != ProviderState.OK) {
            return failing(previous, rawState, now);
        }
        return healthy(previous);
    }

    private Transition failing(PersistedProviderState previous, ProviderState rawState, Instant now) {
        int failStreak = previous.failStreak() + 1;
        Instant firstSeen = previous.firstSeen() == null ? now : previous.firstSeen();
        ProviderState next = rawState == ProviderState.MAJOR_OUTAGE && failStreak >= failForMajor
                ? ProviderState.MAJOR_OUTAGE
                : ProviderState.DEGRADED;
        return new Transition(new PersistedProviderState(next, failStreak, 0, firstSeen), firstSeen);
    }

    private Transition healthy(PersistedProviderState previous) {
        int okStreak = previous.okStreak() + 1;
        switch (previous.state()) {
            case OK:
            case RECOVERED:
                return new Transition(new PersistedProviderState(ProviderState.OK, 0, okStreak, null), null);
            default:
                if (okStreak >= okForRecovery) {
                    return new Transition(
                            new PersistedProviderState(ProviderState.RECOVERED, 0, okStreak, null),
                            previous.firstSeen()
                    );
                }
                return new Transition(
                        new PersistedProviderState(previous.state(), 0, okStreak, previous.firstSeen()),
                        previous.firstSeen()
                );
        }
    }
}

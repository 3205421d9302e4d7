package com.outagesentinel.detector.api;

import com.outagesentinel.core.model.Signal;

import java.time.Duration;

/**
 * A single bounded reachability check. Implementations never throw for network
 * failures: timeouts, refusals and bad statuses come back as failed signals.
 */
@FunctionalInterface
public interface Probe {
    Signal check(String signalName, String target, Duration timeout);
}

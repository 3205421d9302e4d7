package com.outagesentinel.detector.gate;

import com.outagesentinel.core.model.Signal;

import java.util.List;

/**
 * Judges whether the observing node's own path to the Internet can be trusted.
 * <p>
 * A two-thirds supermajority of control probes must pass. One flaky control endpoint
 * cannot suppress detection, while a majority of control failures points at the local
 * uplink rather than at any provider. No control probes at all never blocks detection.
 */
public final class ControlGate {
    private ControlGate() {
    }

    public static ControlVerdict evaluate(List<Signal> controlSignals) {
        int total = controlSignals.size();
        int passed = (int) controlSignals.stream().filter(Signal::ok).count();
        if (total == 0) {
            return new ControlVerdict(true, 0, 0);
        }
        return new ControlVerdict(passed >= requiredPasses(total), passed, total);
    }

    static int requiredPasses(int total) {
        // ceil(2n/3) in integer arithmetic
        return (2 * total + 2) / 3;
    }
}

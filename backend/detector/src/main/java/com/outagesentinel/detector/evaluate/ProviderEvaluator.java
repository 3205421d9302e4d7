package com.outagesentinel.detector.evaluate;

import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.core.model.Signal;

import java.util.List;

/**
 * Turns one provider's signals from a single run into a raw state and confidence.
 * A provider is never blamed while the control gate reports the local path unhealthy.
 */
public final class ProviderEvaluator {
    static final double CONFIDENCE_CAP = 0.95;
    private static final double CONFIDENCE_FLOOR = 0.2;
    private static final double CONFIDENCE_SLOPE = 0.9;

    private ProviderEvaluator() {
    }

    public static Evaluation evaluate(List<Signal> signals, boolean controlOk) {
        int total = signals.size();
        int failed = (int) signals.stream().filter(signal -> !signal.ok()).count();
        double failFraction = total == 0 ? 0.0 : (double) failed / total;

        ProviderState rawState = controlOk ? ProviderState.fromFailFraction(failFraction) : ProviderState.OK;
        double confidence = controlOk && total > 0
                ? Math.min(CONFIDENCE_CAP, CONFIDENCE_FLOOR + CONFIDENCE_SLOPE * failFraction)
                : 0.0;
        return new Evaluation(rawState, confidence, failFraction, failed, total);
    }
}

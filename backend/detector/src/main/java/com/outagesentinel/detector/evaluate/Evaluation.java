package com.outagesentinel.detector.evaluate;

import com.outagesentinel.core.model.ProviderState;

public record Evaluation(
        ProviderState rawState,
        double confidence,
        double failFraction,
        int failed,
        int total
) {
}

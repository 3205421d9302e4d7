package com.outagesentinel.detector.config;

/**
 * Where and how this node reports its own status to an aggregator.
 */
public record ReportingConfig(
        String aggregatorUrl,
        String providerHint,
        String state,
        Double regionWeight
) {
}

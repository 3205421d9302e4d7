package com.outagesentinel.core.model;

public enum ProviderState {
    OK,
    DEGRADED,
    MAJOR_OUTAGE,
    /** One-shot marker emitted on the run that closes an outage. */
    RECOVERED;

    private static final double DEGRADED_CEILING = 0.34;

    /**
     * Maps the fraction of failed signals in one run to the raw state for that run.
     */
    public static ProviderState fromFailFraction(double failFraction) {
        if (failFraction <= 0) {
            return OK;
        }
        if (failFraction <= DEGRADED_CEILING) {
            return DEGRADED;
        }
        return MAJOR_OUTAGE;
    }
}

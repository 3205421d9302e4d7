package com.outagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One reachability check (HTTP or DNS) from a single detector run.
 */
public record Signal(
        String name,
        boolean ok,
        @JsonProperty("ms") long latencyMs,
        String detail
) {
    public static Signal passed(String name, long latencyMs, String detail) {
        return new Signal(name, true, latencyMs, detail);
    }

    public static Signal failed(String name, long latencyMs, String detail) {
        return new Signal(name, false, latencyMs, detail);
    }
}

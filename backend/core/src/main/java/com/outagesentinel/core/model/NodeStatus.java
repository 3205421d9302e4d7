package com.outagesentinel.core.model;

import java.time.Instant;

/**
 * Latest known status of one observing node, as seen by the aggregator.
 * Every field except {@code nodeId} may be absent on a partial update.
 */
public record NodeStatus(
        String nodeId,
        String providerHint,
        String state,
        String region,
        Double regionWeight,
        Boolean controlOk,
        Presence presence,
        Instant ts
) {
    public static final String UNKNOWN_PROVIDER = "unknown";

    public NodeStatus {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
    }

    /**
     * Returns this entry overwritten by every field the update carries.
     */
    public NodeStatus mergedWith(NodeStatus update) {
        return new NodeStatus(
                nodeId,
                update.providerHint() != null ? update.providerHint() : providerHint,
                update.state() != null ? update.state() : state,
                update.region() != null ? update.region() : region,
                update.regionWeight() != null ? update.regionWeight() : regionWeight,
                update.controlOk() != null ? update.controlOk() : controlOk,
                update.presence() != null ? update.presence() : presence,
                update.ts() != null ? update.ts() : ts
        );
    }

    public boolean impacted() {
        return presence == Presence.OFFLINE || Boolean.FALSE.equals(controlOk);
    }

    public double weight() {
        if (regionWeight == null || regionWeight.isNaN()) {
            return 1.0;
        }
        return Math.max(0.0, regionWeight);
    }

    public String providerLabel() {
        return providerHint == null || providerHint.isBlank() ? UNKNOWN_PROVIDER : providerHint;
    }

    public boolean hasKnownState() {
        return state != null && !state.isBlank();
    }
}

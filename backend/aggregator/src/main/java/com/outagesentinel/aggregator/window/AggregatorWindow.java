package com.outagesentinel.aggregator.window;

import com.outagesentinel.core.model.NodeStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Latest status per node. Entries are never evicted; staleness is decided when reading.
 * Not thread-safe: owned by the single aggregator thread.
 */
public class AggregatorWindow {
    private final Duration window;
    private final Map<String, NodeStatus> nodes = new LinkedHashMap<>();

    public AggregatorWindow(Duration window) {
        this.window = window;
    }

    public NodeStatus update(NodeStatus status) {
        NodeStatus previous = nodes.get(status.nodeId());
        NodeStatus next = previous == null ? status : previous.mergedWith(status);
        nodes.put(next.nodeId(), next);
        return next;
    }

    public Optional<NodeStatus> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isFresh(NodeStatus status, Instant now) {
        return status.ts() != null && Duration.between(status.ts(), now).compareTo(window) <= 0;
    }

    /**
     * Fresh impacted nodes grouped by provider hint, providers in name order.
     */
    public Map<String, List<NodeStatus>> impactedByProvider(Instant now) {
        Map<String, List<NodeStatus>> groups = new TreeMap<>();
        for (NodeStatus status : nodes.values()) {
            if (isFresh(status, now) && status.impacted()) {
                groups.computeIfAbsent(status.providerLabel(), ignored -> new ArrayList<>()).add(status);
            }
        }
        return groups;
    }
}

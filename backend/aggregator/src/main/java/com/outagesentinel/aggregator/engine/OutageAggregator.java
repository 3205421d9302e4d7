package com.outagesentinel.aggregator.engine;

import com.outagesentinel.aggregator.codec.NodeStatusCodec;
import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.aggregator.scope.OutageScorer;
import com.outagesentinel.aggregator.scope.ScopeClassifier;
import com.outagesentinel.aggregator.window.AggregatorWindow;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.core.events.OutageScopeChanged;
import com.outagesentinel.core.events.OutageSummaryUpdated;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.ProviderScopeSummary;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Cross-node outage classification. Each inbound status is handled to completion before
 * the next one; callers must confine an instance to a single thread.
 * <p>
 * Every cycle recomputes all provider groups from the window, publishes a scope event
 * for each provider whose assessment changed, and publishes a fresh summary. The last
 * scope event per provider is retained for late readers.
 */
public class OutageAggregator {
    private static final Logger LOGGER = Logger.getLogger(OutageAggregator.class.getName());

    private final AggregatorWindow window;
    private final ScopeClassifier classifier;
    private final EventBus eventBus;
    private final Map<String, OutageScopeChanged> retainedScopes = new TreeMap<>();
    private OutageSummaryUpdated latestSummary;
    private long rejectedMessages;

    public OutageAggregator(AggregatorConfig config, EventBus eventBus) {
        this(new AggregatorWindow(config.window()), new ScopeClassifier(config), eventBus);
    }

    public OutageAggregator(AggregatorWindow window, ScopeClassifier classifier, EventBus eventBus) {
        this.window = window;
        this.classifier = classifier;
        this.eventBus = eventBus;
    }

    public OutageSummaryUpdated onNodeStatus(NodeStatus status, Instant now) {
        window.update(status);
        return evaluate(now);
    }

    /**
     * Decodes and applies one raw message. Malformed input is logged and dropped.
     */
    public Optional<OutageSummaryUpdated> onRawMessage(String payload, Instant now) {
        NodeStatus status;
        try {
            status = NodeStatusCodec.decode(payload);
        } catch (IllegalArgumentException malformed) {
            rejectedMessages++;
            LOGGER.warning(() -> "Discarding node status: " + malformed.getMessage());
            eventBus.publish(new AlertRaised(
                    now,
                    "aggregator",
                    "Discarded malformed node status",
                    Map.of("reason", String.valueOf(malformed.getMessage()))
            ));
            return Optional.empty();
        }
        return Optional.of(onNodeStatus(status, now));
    }

    public OutageSummaryUpdated evaluate(Instant now) {
        Map<String, List<NodeStatus>> groups = window.impactedByProvider(now);
        Map<String, ProviderScopeSummary> providers = new TreeMap<>();

        for (Map.Entry<String, List<NodeStatus>> group : groups.entrySet()) {
            String provider = group.getKey();
            List<NodeStatus> impacted = group.getValue();
            Scope scope = classifier.resolve(provider, classifier.classifyRaw(impacted), now);
            double confidence = OutageScorer.confidence(impacted);
            Severity severity = OutageScorer.severity(scope, confidence, impacted.size());
            ProviderScopeSummary summary = new ProviderScopeSummary(
                    scope,
                    severity,
                    confidence,
                    impacted.size(),
                    OutageScorer.affectedStates(impacted)
            );
            providers.put(provider, summary);
            retainIfChanged(provider, summary, now);
        }

        for (String provider : new ArrayList<>(retainedScopes.keySet())) {
            if (!groups.containsKey(provider)) {
                classifier.forget(provider);
                retainIfChanged(provider, ProviderScopeSummary.cleared(), now);
            }
        }

        latestSummary = new OutageSummaryUpdated(now, Collections.unmodifiableMap(providers));
        eventBus.publish(latestSummary);
        return latestSummary;
    }

    public Optional<OutageScopeChanged> retainedScope(String provider) {
        return Optional.ofNullable(retainedScopes.get(provider));
    }

    public Optional<OutageSummaryUpdated> latestSummary() {
        return Optional.ofNullable(latestSummary);
    }

    public long rejectedMessages() {
        return rejectedMessages;
    }

    public int knownNodes() {
        return window.size();
    }

    private void retainIfChanged(String provider, ProviderScopeSummary summary, Instant now) {
        OutageScopeChanged previous = retainedScopes.get(provider);
        if (previous != null && previous.summary().equals(summary)) {
            return;
        }
        if (previous == null && summary.impactedCount() == 0) {
            return;
        }
        OutageScopeChanged event = OutageScopeChanged.of(now, provider, summary);
        retainedScopes.put(provider, event);
        if (previous == null || previous.scope() != summary.scope()) {
            LOGGER.info(() -> "Provider " + provider + " scope " + summary.scope() + " (" + summary.severity()
                    + ", " + summary.impactedCount() + " impacted nodes)");
        }
        eventBus.publish(event);
    }
}

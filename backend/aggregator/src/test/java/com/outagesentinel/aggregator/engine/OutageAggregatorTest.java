package com.outagesentinel.aggregator.engine;

import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.core.events.Event;
import com.outagesentinel.core.events.OutageScopeChanged;
import com.outagesentinel.core.events.OutageSummaryUpdated;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.Presence;
import com.outagesentinel.core.model.ProviderScopeSummary;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutageAggregatorTest {
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final String CARRIER = "Carrier A";

    private final List<Event> events = new ArrayList<>();
    private OutageAggregator aggregator;

    @BeforeEach
    void setUp() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        bus.subscribeAll(List.of(OutageScopeChanged.class, OutageSummaryUpdated.class, AlertRaised.class), events::add);
        aggregator = new OutageAggregator(AggregatorConfig.defaults(), bus);
    }

    @Test
    void nationwideOutageEscalatesAfterDebounce() {
        String[] states = {"CA", "TX", "NY", "FL", "WA"};
        for (int i = 0; i < states.length; i++) {
            aggregator.onNodeStatus(offline("node-" + i, states[i], T0.plusSeconds(i)), T0.plusSeconds(i));
        }
        ProviderScopeSummary held = aggregator.latestSummary().orElseThrow().providers().get(CARRIER);
        assertEquals(Scope.LOCAL, held.scope());
        assertEquals(5, held.impactedCount());

        OutageSummaryUpdated later = aggregator.evaluate(T0.plusSeconds(95));

        ProviderScopeSummary summary = later.providers().get(CARRIER);
        assertEquals(Scope.NATIONWIDE, summary.scope());
        assertEquals(Severity.CRITICAL, summary.severity());
        assertEquals(List.of("CA", "FL", "NY", "TX", "WA"), summary.affectedStates());
        assertEquals(Scope.NATIONWIDE, aggregator.retainedScope(CARRIER).orElseThrow().scope());
    }

    @Test
    void scopeEventsArePublishedOnlyOnChange() {
        aggregator.onNodeStatus(offline("node-1", "TX", T0), T0);
        aggregator.evaluate(T0.plusSeconds(10));
        aggregator.evaluate(T0.plusSeconds(20));

        assertEquals(1, byType(OutageScopeChanged.class).size());
        assertEquals(3, byType(OutageSummaryUpdated.class).size());
    }

    @Test
    void healthyNodesProduceEmptySummary() {
        OutageSummaryUpdated summary = aggregator.onNodeStatus(
                new NodeStatus("node-1", CARRIER, "TX", null, null, true, Presence.ONLINE, T0), T0);

        assertTrue(summary.providers().isEmpty());
        assertTrue(byType(OutageScopeChanged.class).isEmpty());
    }

    @Test
    void expiredNodesClearTheRetainedScope() {
        aggregator.onNodeStatus(offline("node-1", "TX", T0), T0);

        OutageSummaryUpdated summary = aggregator.evaluate(T0.plus(Duration.ofMinutes(11)));

        assertTrue(summary.providers().isEmpty());
        List<OutageScopeChanged> scopes = byType(OutageScopeChanged.class);
        assertEquals(2, scopes.size());
        assertEquals(0, scopes.get(1).impactedCount());
        assertEquals(ProviderScopeSummary.cleared(), aggregator.retainedScope(CARRIER).orElseThrow().summary());

        aggregator.evaluate(T0.plus(Duration.ofMinutes(12)));
        assertEquals(2, byType(OutageScopeChanged.class).size());
    }

    @Test
    void recoveredNodeLeavesImpactedGroup() {
        aggregator.onNodeStatus(offline("node-1", "TX", T0), T0);
        aggregator.onNodeStatus(offline("node-2", "TX", T0), T0);

        OutageSummaryUpdated summary = aggregator.onNodeStatus(
                new NodeStatus("node-2", null, null, null, null, true, Presence.ONLINE, T0.plusSeconds(30)),
                T0.plusSeconds(30));

        assertEquals(1, summary.providers().get(CARRIER).impactedCount());
        assertEquals(2, aggregator.knownNodes());
    }

    @Test
    void malformedMessageIsDiscardedAndProcessingContinues() {
        assertTrue(aggregator.onRawMessage("{broken", T0).isEmpty());
        assertTrue(aggregator.onRawMessage("{\"presence\":\"OFFLINE\"}", T0).isEmpty());

        OutageSummaryUpdated summary = aggregator.onRawMessage(
                "{\"nodeId\":\"node-9\",\"providerHint\":\"ISP B\",\"presence\":\"OFFLINE\",\"ts\":\"2026-03-01T12:00:00Z\"}",
                T0
        ).orElseThrow();

        assertEquals(2, aggregator.rejectedMessages());
        assertEquals(2, byType(AlertRaised.class).size());
        assertEquals(1, summary.providers().get("ISP B").impactedCount());
    }

    private <T extends Event> List<T> byType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private static NodeStatus offline(String nodeId, String state, Instant ts) {
        return new NodeStatus(nodeId, CARRIER, state, null, null, true, Presence.OFFLINE, ts);
    }
}

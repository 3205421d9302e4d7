package com.outagesentinel.aggregator.scope;

import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.Presence;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutageScorerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void singleUnweightedNodeWithoutStateScoresOneHalf() {
        double confidence = OutageScorer.confidence(List.of(node("n1", null, null)));

        assertEquals(0.5, confidence, 1e-9);
    }

    @Test
    void confidenceCombinesWeightAndSpread() {
        List<NodeStatus> impacted = List.of(node("n1", "TX", null), node("n2", "CA", null));
        double expected = 1 - Math.exp(-(Math.log1p(2.0) + Math.log1p(2)));

        assertEquals(expected, OutageScorer.confidence(impacted), 1e-9);
    }

    @Test
    void heavierRegionsRaiseConfidence() {
        double light = OutageScorer.confidence(List.of(node("n1", "TX", 0.5)));
        double heavy = OutageScorer.confidence(List.of(node("n1", "TX", 3.0)));

        assertTrue(heavy > light);
    }

    @Test
    void confidenceSaturatesAtCap() {
        List<NodeStatus> impacted = List.of(
                node("n1", "CA", 10.0), node("n2", "TX", 10.0), node("n3", "NY", 10.0),
                node("n4", "FL", 10.0), node("n5", "WA", 10.0));

        assertEquals(OutageScorer.CONFIDENCE_CAP, OutageScorer.confidence(impacted), 1e-9);
    }

    @Test
    void severityRules() {
        assertEquals(Severity.CRITICAL, OutageScorer.severity(Scope.NATIONWIDE, 0.7, 5));
        assertEquals(Severity.MINOR, OutageScorer.severity(Scope.NATIONWIDE, 0.69, 3));
        assertEquals(Severity.MAJOR, OutageScorer.severity(Scope.NATIONWIDE, 0.69, 4));
        assertEquals(Severity.MAJOR, OutageScorer.severity(Scope.STATE, 0.55, 2));
        assertEquals(Severity.MINOR, OutageScorer.severity(Scope.STATE, 0.54, 2));
        assertEquals(Severity.MAJOR, OutageScorer.severity(Scope.LOCAL, 0.5, 4));
        assertEquals(Severity.MINOR, OutageScorer.severity(Scope.LOCAL, 0.9, 3));
    }

    @Test
    void affectedStatesAreDistinctSortedAndKnown() {
        List<String> states = OutageScorer.affectedStates(List.of(
                node("n1", "TX", null), node("n2", null, null), node("n3", "CA", null), node("n4", "TX", null)));

        assertEquals(List.of("CA", "TX"), states);
    }

    private static NodeStatus node(String id, String state, Double weight) {
        return new NodeStatus(id, "Carrier A", state, null, weight, false, Presence.ONLINE, NOW);
    }
}

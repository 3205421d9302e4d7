package com.outagesentinel.aggregator.scope;

import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;

import java.util.List;
import java.util.TreeSet;

/**
 * Confidence grows with both the summed region weight of impacted nodes and the number
 * of distinct states they cover, saturating below certainty.
 */
public final class OutageScorer {
    static final double CONFIDENCE_CAP = 0.95;

    private OutageScorer() {
    }

    public static double confidence(List<NodeStatus> impacted) {
        double weightSum = impacted.stream().mapToDouble(NodeStatus::weight).sum();
        int states = affectedStates(impacted).size();
        double score = Math.log1p(weightSum) + Math.log1p(states);
        return Math.min(CONFIDENCE_CAP, 1 - Math.exp(-score));
    }

    public static Severity severity(Scope scope, double confidence, int impactedCount) {
        if (scope == Scope.NATIONWIDE && confidence >= 0.7) {
            return Severity.CRITICAL;
        }
        if (scope == Scope.STATE && confidence >= 0.55) {
            return Severity.MAJOR;
        }
        if (impactedCount >= 4 && confidence >= 0.5) {
            return Severity.MAJOR;
        }
        return Severity.MINOR;
    }

    public static List<String> affectedStates(List<NodeStatus> impacted) {
        TreeSet<String> states = new TreeSet<>();
        for (NodeStatus status : impacted) {
            if (status.hasKnownState()) {
                states.add(status.state());
            }
        }
        return List.copyOf(states);
    }
}

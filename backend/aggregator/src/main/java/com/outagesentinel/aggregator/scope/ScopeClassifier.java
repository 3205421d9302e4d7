package com.outagesentinel.aggregator.scope;

import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.ProviderScopeState;
import com.outagesentinel.core.model.Scope;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps an impacted-node group to a scope, then debounces escalation.
 * <p>
 * A wider scope is accepted only after the raw classification has outranked the
 * reported scope for {@code debounceMs} without interruption, counted from no earlier
 * than the last scope change. Narrowing is applied on the cycle it is observed.
 * A provider seen for the first time starts at {@link Scope#LOCAL}.
 */
public class ScopeClassifier {
    private final AggregatorConfig config;
    private final Map<String, ProviderScopeState> scopes = new HashMap<>();

    public ScopeClassifier(AggregatorConfig config) {
        this.config = config;
    }

    public Scope classifyRaw(List<NodeStatus> impacted) {
        Map<String, Integer> perState = new HashMap<>();
        for (NodeStatus status : impacted) {
            if (status.hasKnownState()) {
                perState.merge(status.state(), 1, Integer::sum);
            }
        }
        if (perState.size() >= config.nationwideStatesMin() || impacted.size() >= config.nationwideNodesMin()) {
            return Scope.NATIONWIDE;
        }
        if (perState.values().stream().anyMatch(count -> count >= config.stateMin())) {
            return Scope.STATE;
        }
        return Scope.LOCAL;
    }

    public Scope resolve(String provider, Scope raw, Instant now) {
        ProviderScopeState current = scopes.computeIfAbsent(provider, ignored -> ProviderScopeState.startingAt(Scope.LOCAL, now));

        if (current.scope().outranks(raw)) {
            scopes.put(provider, ProviderScopeState.startingAt(raw, now));
            return raw;
        }
        if (!raw.outranks(current.scope())) {
            if (current.escalatingSince() != null) {
                scopes.put(provider, ProviderScopeState.startingAt(current.scope(), current.since()));
            }
            return current.scope();
        }

        Instant escalatingSince = current.escalatingSince() == null ? now : current.escalatingSince();
        if (Duration.between(escalatingSince, now).compareTo(config.debounce()) >= 0) {
            scopes.put(provider, ProviderScopeState.startingAt(raw, now));
            return raw;
        }
        scopes.put(provider, new ProviderScopeState(current.scope(), current.since(), escalatingSince));
        return current.scope();
    }

    public Optional<ProviderScopeState> state(String provider) {
        return Optional.ofNullable(scopes.get(provider));
    }

    public void forget(String provider) {
        scopes.remove(provider);
    }
}

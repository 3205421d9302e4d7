package com.outagesentinel.detector.support;

import com.outagesentinel.core.model.PersistedProviderState;
import com.outagesentinel.detector.api.ProviderStateRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryProviderStateRepository implements ProviderStateRepository {
    private final Map<String, PersistedProviderState> states = new LinkedHashMap<>();

    @Override
    public Optional<PersistedProviderState> get(String providerName) {
        return Optional.ofNullable(states.get(providerName));
    }

    @Override
    public void put(String providerName, PersistedProviderState state) {
        states.put(providerName, state);
    }
}

package com.outagesentinel.detector.api;

import com.outagesentinel.core.model.PersistedProviderState;

import java.util.Optional;

public interface ProviderStateRepository {
    Optional<PersistedProviderState> get(String providerName);

    void put(String providerName, PersistedProviderState state);
}

package com.outagesentinel.detector.api;

import com.outagesentinel.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record DetectorContext(
        Probe httpProbe,
        Probe dnsProbe,
        EventBus eventBus,
        ProviderStateRepository stateRepository,
        Clock clock
) {
    public DetectorContext {
        Objects.requireNonNull(httpProbe, "httpProbe is required");
        Objects.requireNonNull(dnsProbe, "dnsProbe is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(stateRepository, "stateRepository is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}

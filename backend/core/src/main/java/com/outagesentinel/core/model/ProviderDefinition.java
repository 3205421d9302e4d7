package com.outagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

public record ProviderDefinition(
        String name,
        ProviderType type,
        @JsonAlias("probes") List<String> probeUrls,
        @JsonAlias("dns") List<String> dnsHosts
) {
    public ProviderDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name is required");
        }
        probeUrls = probeUrls == null ? List.of() : List.copyOf(probeUrls);
        dnsHosts = dnsHosts == null ? List.of() : List.copyOf(dnsHosts);
    }
}

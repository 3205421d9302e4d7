package com.outagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProviderType {
    @JsonProperty("mobile") MOBILE,
    @JsonProperty("isp") ISP,
    @JsonProperty("cloud") CLOUD
}

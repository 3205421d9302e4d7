package com.outagesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {
    @JsonProperty("minor") MINOR,
    @JsonProperty("major") MAJOR,
    @JsonProperty("critical") CRITICAL
}

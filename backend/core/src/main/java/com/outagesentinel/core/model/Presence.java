package com.outagesentinel.core.model;

public enum Presence {
    ONLINE,
    OFFLINE
}

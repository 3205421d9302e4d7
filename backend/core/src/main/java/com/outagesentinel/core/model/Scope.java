package com.outagesentinel.core.model;

/**
 * Geographic breadth of an outage, declared in rank order.
 */
public enum Scope {
    LOCAL,
    STATE,
    NATIONWIDE;

    public boolean outranks(Scope other) {
        return compareTo(other) > 0;
    }
}

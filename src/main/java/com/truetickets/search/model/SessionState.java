package com.truetickets.search.model;

public enum SessionState {
    IDLE,
    DEBOUNCING,
    IN_FLIGHT,
    RESOLVED,
    SUPERSEDED,
    ABORTED;

    public boolean isTerminal() {
        return this == RESOLVED || this == SUPERSEDED || this == ABORTED;
    }
}

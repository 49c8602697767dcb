package com.kmg.altbuddy.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    STARTING,
    RUNNING,
    COMPLETE,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    // Forward-only: starting -> running -> terminal, or starting -> error before launch.
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case STARTING -> next == RUNNING || next == ERROR;
            case RUNNING -> next == COMPLETE || next == ERROR;
            case COMPLETE, ERROR -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}

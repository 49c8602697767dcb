package com.kmg.altbuddy.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobKind {
    PAGE_ANALYSIS("analyze-page"),
    BATCH("batch");

    private final String wireName;

    JobKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

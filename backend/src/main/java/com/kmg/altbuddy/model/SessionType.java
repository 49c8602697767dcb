package com.kmg.altbuddy.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionType {
    WEB("web"),
    CLI("cli"),
    UNKNOWN("unknown");

    private final String prefix;

    SessionType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    @JsonValue
    public String wireName() {
        return prefix;
    }

    public static SessionType fromSessionId(String sessionId) {
        if (sessionId != null) {
            if (sessionId.startsWith(WEB.prefix + "-")) {
                return WEB;
            }
            if (sessionId.startsWith(CLI.prefix + "-")) {
                return CLI;
            }
        }
        return UNKNOWN;
    }

    public static SessionType fromName(String name) {
        for (SessionType type : values()) {
            if (type.prefix.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown session type: " + name);
    }
}

package com.kmg.altbuddy.model;

import java.time.Instant;

public record SessionRecord(
        String sessionId,
        SessionType type,
        Instant createdAt,
        Instant lastAccessedAt
) {
    public SessionRecord touched(Instant now) {
        return new SessionRecord(sessionId, type, createdAt, now);
    }
}

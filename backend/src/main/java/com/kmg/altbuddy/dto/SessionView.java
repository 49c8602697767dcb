package com.kmg.altbuddy.dto;

import com.kmg.altbuddy.model.SessionFolders;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.model.SessionType;

public record SessionView(
        String sessionId,
        SessionType type,
        String createdAt,
        String lastAccessedAt,
        String imagesFolder,
        String altTextFolder,
        String reportsFolder
) {
    public static SessionView of(SessionRecord session, SessionFolders folders) {
        return new SessionView(
                session.sessionId(),
                session.type(),
                session.createdAt().toString(),
                session.lastAccessedAt().toString(),
                folders.images().toString(),
                folders.altText().toString(),
                folders.reports().toString()
        );
    }
}

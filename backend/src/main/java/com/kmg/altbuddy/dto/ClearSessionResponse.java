package com.kmg.altbuddy.dto;

import com.kmg.altbuddy.model.ClearResult;

public record ClearSessionResponse(
        boolean success,
        String message,
        int filesDeleted,
        int foldersDeleted,
        String sessionId
) {
    public static ClearSessionResponse cleared(ClearResult result) {
        return new ClearSessionResponse(
                true,
                "Session cleared: " + result.filesDeleted() + " file(s) in " + result.foldersDeleted() + " folder(s) deleted",
                result.filesDeleted(),
                result.foldersDeleted(),
                result.sessionId()
        );
    }

    public static ClearSessionResponse noSession() {
        return new ClearSessionResponse(true, "No active session", 0, 0, null);
    }
}

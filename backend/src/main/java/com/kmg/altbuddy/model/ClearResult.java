package com.kmg.altbuddy.model;

public record ClearResult(String sessionId, int filesDeleted, int foldersDeleted) {
}

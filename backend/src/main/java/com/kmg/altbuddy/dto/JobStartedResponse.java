package com.kmg.altbuddy.dto;

public record JobStartedResponse(String jobId, String status, String sessionId) {
    public static JobStartedResponse started(String jobId, String sessionId) {
        return new JobStartedResponse(jobId, "started", sessionId);
    }
}

package com.kmg.altbuddy.dto;

import java.util.Map;

public record HealthResponse(String status, long activeJobs, Map<String, Integer> sessions, String timestamp) {
}

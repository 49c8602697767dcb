package com.kmg.altbuddy.dto;

import java.util.List;
import java.util.Map;

public record SessionListResponse(Map<String, Integer> counts, List<SessionView> sessions) {
}

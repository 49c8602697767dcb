package com.kmg.altbuddy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Sparse progress report written by the analyzer process. Every field may be absent;
 * only present fields overwrite the job's current values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressSnapshot(
        @JsonProperty("percent") Integer percent,
        @JsonProperty("message") String message,
        @JsonProperty("phase") String phase,
        @JsonProperty("current_image") Integer currentImage,
        @JsonProperty("total_images") Integer totalImages,
        @JsonProperty("timestamp") Instant timestamp
) {
    public static ProgressSnapshot of(int percent, String message) {
        return new ProgressSnapshot(percent, message, null, null, null, Instant.now());
    }
}

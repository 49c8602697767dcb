package com.kmg.altbuddy.model;

import java.util.List;

public record JobResult(
        String sessionId,
        int exitCode,
        boolean partial,
        int artifactCount,
        List<ArtifactSummary> artifacts,
        String reportPath,
        String outputDirectory
) {
    public JobResult {
        artifacts = List.copyOf(artifacts);
    }
}

package com.kmg.altbuddy.model;

public record ArtifactSummary(
        String file,
        String imageId,
        String altText,
        String language
) {
}

package com.kmg.altbuddy.model;

public record ProviderOverrides(
        String visionProvider,
        String visionModel,
        String processingProvider,
        String processingModel,
        String translationProvider,
        String translationModel
) {
    public static final ProviderOverrides NONE = new ProviderOverrides(null, null, null, null, null, null);
}

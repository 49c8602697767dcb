package com.kmg.altbuddy.dto;

import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.ProviderOverrides;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record AnalyzePageRequest(
        @NotBlank String url,
        List<String> languages,
        @Min(1) Integer numImages,
        String visionProvider,
        String visionModel,
        String processingProvider,
        String processingModel,
        String translationProvider,
        String translationModel,
        Boolean advancedTranslation,
        Boolean geoBoost,
        String session
) {
    public JobSpec toSpec(String sessionId) {
        return new JobSpec(
                JobKind.PAGE_ANALYSIS,
                sessionId,
                url,
                null,
                languages,
                numImages,
                new ProviderOverrides(visionProvider, visionModel, processingProvider, processingModel,
                        translationProvider, translationModel),
                Boolean.TRUE.equals(advancedTranslation),
                Boolean.TRUE.equals(geoBoost)
        );
    }
}

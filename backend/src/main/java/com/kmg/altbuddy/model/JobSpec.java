package com.kmg.altbuddy.model;

import java.util.List;

/**
 * Everything the analyzer needs for one run. {@code target} is the page URL for a page
 * analysis and the images folder for a batch run.
 */
public record JobSpec(
        JobKind kind,
        String sessionId,
        String target,
        String contextFolder,
        List<String> languages,
        Integer numImages,
        ProviderOverrides overrides,
        boolean advancedTranslation,
        boolean geoBoost
) {
    public JobSpec {
        languages = languages == null ? List.of() : List.copyOf(languages);
        overrides = overrides == null ? ProviderOverrides.NONE : overrides;
    }
}

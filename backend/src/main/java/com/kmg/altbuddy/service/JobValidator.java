package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.ProviderOverrides;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a job before any process is started. The returned job carries normalized values:
 * lower-case language codes from the allowed list (the default language when none given)
 * and an absolute batch folder.
 */
@Component
public class JobValidator {
    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9._:/-]{1,120}$");

    private final SessionRegistry sessionRegistry;
    private final ImageFolderService imageFolderService;
    private final int maxNumImages;
    private final List<String> allowedLanguages;
    private final String defaultLanguage;
    private final List<Path> batchRoots;

    public JobValidator(SessionRegistry sessionRegistry, ImageFolderService imageFolderService,
                        AltBuddyProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.imageFolderService = imageFolderService;
        this.maxNumImages = properties.getJobs().getMaxNumImages();
        this.allowedLanguages = properties.getLanguages().getAllowed().stream()
                .map(code -> code.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        this.defaultLanguage = properties.getLanguages().getDefaultLanguage().trim().toLowerCase(Locale.ROOT);
        this.batchRoots = properties.getJobs().getBatchRoots().stream()
                .filter(root -> root != null && !root.isBlank())
                .map(properties::resolve)
                .toList();
    }

    public List<String> allowedLanguages() {
        return allowedLanguages;
    }

    public String defaultLanguage() {
        return defaultLanguage;
    }

    public ValidatedJob validate(JobSpec spec) {
        if (spec.kind() == null) {
            throw new JobValidationException("Job kind is required.");
        }
        if (spec.numImages() != null && (spec.numImages() < 1 || spec.numImages() > maxNumImages)) {
            throw new JobValidationException("num_images must be between 1 and " + maxNumImages + ".");
        }
        List<String> languages = normalizeLanguages(spec.languages());
        checkOverrides(spec.overrides());

        if (spec.kind() == JobKind.PAGE_ANALYSIS) {
            checkUrl(spec.target());
            return new ValidatedJob(withTarget(spec, spec.target().trim(), languages), null);
        }

        Path folder = resolveFolder(spec.sessionId(), spec.target(), "images_folder");
        int imageCount = imageFolderService.countImages(folder);
        if (imageCount == 0) {
            throw new JobValidationException("Images folder has no supported images: " + folder);
        }
        if (spec.contextFolder() != null && !spec.contextFolder().isBlank()) {
            Path context = resolveFolder(spec.sessionId(), spec.contextFolder(), "context_folder");
            if (!Files.isDirectory(context)) {
                throw new JobValidationException("Context folder not found: " + context);
            }
        }
        int total = spec.numImages() == null ? imageCount : Math.min(imageCount, spec.numImages());
        return new ValidatedJob(withTarget(spec, folder.toString(), languages), total);
    }

    private void checkUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new JobValidationException("url is required.");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new JobValidationException("url must use http or https: " + url);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new JobValidationException("url has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new JobValidationException("url is malformed: " + e.getMessage());
        }
    }

    private List<String> normalizeLanguages(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of(defaultLanguage);
        }
        LinkedHashSet<String> languages = new LinkedHashSet<>();
        for (String language : requested) {
            String code = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
            if (!allowedLanguages.contains(code)) {
                throw new JobValidationException("Language '" + language + "' not supported. Allowed languages: "
                        + String.join(", ", allowedLanguages));
            }
            languages.add(code);
        }
        return new ArrayList<>(languages);
    }

    private void checkOverrides(ProviderOverrides overrides) {
        checkToken("vision_provider", overrides.visionProvider());
        checkToken("vision_model", overrides.visionModel());
        checkToken("processing_provider", overrides.processingProvider());
        checkToken("processing_model", overrides.processingModel());
        checkToken("translation_provider", overrides.translationProvider());
        checkToken("translation_model", overrides.translationModel());
    }

    private void checkToken(String field, String value) {
        if (value != null && !TOKEN.matcher(value).matches()) {
            throw new JobValidationException(field + " contains unsupported characters: " + value);
        }
    }

    // Relative folders are taken from the caller's session images directory.
    // Absolute folders must lie inside that directory or below a configured batch root.
    private Path resolveFolder(String sessionId, String folder, String field) {
        if (folder == null || folder.isBlank()) {
            throw new JobValidationException(field + " is required.");
        }
        try {
            Path path = Path.of(folder.trim());
            Path base = sessionRegistry.pathsOf(sessionId).images();
            if (path.isAbsolute()) {
                Path normalized = path.normalize();
                if (normalized.startsWith(base) || batchRoots.stream().anyMatch(normalized::startsWith)) {
                    return normalized;
                }
                throw new JobValidationException(
                        field + " must be inside the session folder or an allowed batch root: " + folder);
            }
            Path resolved = base.resolve(path).normalize();
            if (!resolved.startsWith(base)) {
                throw new JobValidationException(field + " must stay inside the session folder: " + folder);
            }
            return resolved;
        } catch (InvalidPathException e) {
            throw new JobValidationException(field + " is not a valid path: " + folder);
        }
    }

    private JobSpec withTarget(JobSpec spec, String target, List<String> languages) {
        return new JobSpec(
                spec.kind(),
                spec.sessionId(),
                target,
                spec.contextFolder() == null || spec.contextFolder().isBlank()
                        ? null
                        : resolveFolder(spec.sessionId(), spec.contextFolder(), "context_folder").toString(),
                languages,
                spec.numImages(),
                spec.overrides(),
                spec.advancedTranslation(),
                spec.geoBoost()
        );
    }

    public record ValidatedJob(JobSpec spec, Integer totalImages) {
    }
}

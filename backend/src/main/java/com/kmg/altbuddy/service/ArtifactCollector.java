package com.kmg.altbuddy.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.altbuddy.model.ArtifactSummary;
import com.kmg.altbuddy.model.JobResult;
import com.kmg.altbuddy.model.SessionFolders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns what an analyzer run left behind into a {@link JobResult}. Artifacts are the
 * alt-text JSON files in the job's own output folder, which the runner creates empty
 * before launch, so sibling jobs in the same session never see each other's files.
 */
@Component
public class ArtifactCollector {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCollector.class);
    private static final Pattern REPORT_LINE = Pattern.compile("HTML report generated:\\s*(\\S.*)$", Pattern.MULTILINE);

    private final ObjectMapper objectMapper;

    public ArtifactCollector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // Each job writes into <alt-text>/<jobId>, created before the analyzer starts.
    public Path prepareOutputDir(SessionFolders folders, String jobId) throws IOException {
        Path outputDir = folders.altText().resolve(jobId).normalize();
        if (!outputDir.startsWith(folders.altText())) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return Files.createDirectories(outputDir);
    }

    public Optional<JobResult> collect(SessionFolders folders, Path outputDir, int exitCode, String output) {
        List<Path> jsonFiles = listFiles(outputDir).stream()
                .filter(path -> hasExtension(path, ".json"))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        if (jsonFiles.isEmpty()) {
            return Optional.empty();
        }

        List<ArtifactSummary> artifacts = new ArrayList<>();
        for (Path file : jsonFiles) {
            artifacts.add(summarize(file));
        }

        String reportPath = reportFromOutput(output)
                .or(() -> newestReport(outputDir))
                .orElse(null);

        return Optional.of(new JobResult(
                folders.sessionId(),
                exitCode,
                exitCode != 0,
                artifacts.size(),
                artifacts,
                reportPath,
                outputDir.toString()
        ));
    }

    private ArtifactSummary summarize(Path file) {
        String name = file.getFileName().toString();
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            String imageId = text(node, "image_id");
            String altText = text(node, "proposed_alt_text");
            if (altText == null) {
                altText = text(node, "alt_text");
            }
            return new ArtifactSummary(name, imageId != null ? imageId : stripExtension(name), altText, text(node, "language"));
        } catch (IOException e) {
            log.warn("Artifact {} is not readable JSON: {}", file, e.getMessage());
            return new ArtifactSummary(name, stripExtension(name), null, null);
        }
    }

    private Optional<String> reportFromOutput(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = REPORT_LINE.matcher(output);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1).trim();
        }
        return Optional.ofNullable(last);
    }

    private Optional<String> newestReport(Path outputDir) {
        return listFiles(outputDir).stream()
                .filter(path -> hasExtension(path, ".html"))
                .max(Comparator.comparing(this::lastModifiedMillis))
                .map(Path::toString);
    }

    private List<Path> listFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private long lastModifiedMillis(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean hasExtension(Path path, String extension) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }
}

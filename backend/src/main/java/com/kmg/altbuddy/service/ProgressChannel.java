package com.kmg.altbuddy.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File-based progress reports between an analyzer process and its supervising worker.
 *
 * <p>The writer replaces the file through a rename, so a reader sees either the previous
 * snapshot or the next one, never a torn write. Snapshots can be skipped; the last one
 * read wins. A missing or unreadable file simply means "no update".</p>
 */
@Component
public class ProgressChannel {
    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);
    private static final String SUFFIX = ".progress.json";

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public ProgressChannel(ObjectMapper objectMapper, AltBuddyProperties properties) {
        this(objectMapper, properties.resolve(properties.getJobs().getProgressDir()));
    }

    public ProgressChannel(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path allocate(String jobId) throws IOException {
        Files.createDirectories(directory);
        Path path = directory.resolve(jobId + SUFFIX);
        Files.deleteIfExists(path);
        return path;
    }

    public Optional<ProgressSnapshot> read(Path path) {
        try {
            byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(content, ProgressSnapshot.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Progress file {} not readable yet: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(Path path, ProgressSnapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, objectMapper.writeValueAsBytes(snapshot));
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete progress file {}: {}", path, e.getMessage());
        }
    }

    // Files left behind by a previous process; no worker owns them any more.
    public int deleteStale() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int deleted = 0;
        try (var stream = Files.list(directory)) {
            for (Path path : stream.toList()) {
                String name = path.getFileName().toString();
                if (name.endsWith(SUFFIX) || name.endsWith(".tmp")) {
                    Files.deleteIfExists(path);
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to clean progress directory {}: {}", directory, e.getMessage());
        }
        return deleted;
    }
}

package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.ClearResult;
import com.kmg.altbuddy.model.SessionFolders;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.model.SessionType;
import com.kmg.altbuddy.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Caller-scoped working directories. A session exists exactly when its images directory
 * exists on disk; the in-memory map only caches timestamps and is rebuilt from the
 * filesystem whenever an id is presented that it does not know.
 */
@Service
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final TimeService timeService;
    private final Path imagesRoot;
    private final Path altTextRoot;
    private final Path reportsRoot;

    public SessionRegistry(AltBuddyProperties properties, TimeService timeService) {
        this.timeService = timeService;
        AltBuddyProperties.Sessions config = properties.getSessions();
        this.imagesRoot = properties.resolve(config.getImagesDir());
        this.altTextRoot = properties.resolve(config.getAltTextDir());
        this.reportsRoot = properties.resolve(config.getReportsDir());
    }

    public SessionRecord resolveOrCreate(String candidateId) {
        return resolveOrCreate(candidateId, SessionType.WEB);
    }

    public SessionRecord resolveOrCreate(String candidateId, SessionType typeForNew) {
        if (exists(candidateId)) {
            return touch(candidateId);
        }
        if (candidateId != null && !candidateId.isBlank()) {
            log.debug("Session {} has no directory; minting a new one", candidateId);
        }
        return create(typeForNew);
    }

    public boolean exists(String sessionId) {
        return RandomIds.isWellFormedSessionId(sessionId) && Files.isDirectory(imagesRoot.resolve(sessionId));
    }

    public SessionRecord require(String sessionId) {
        if (!exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return sessions.computeIfAbsent(sessionId, this::restore);
    }

    public SessionRecord touch(String sessionId) {
        if (!exists(sessionId)) {
            sessions.remove(sessionId);
            throw new SessionNotFoundException(sessionId);
        }
        Instant now = timeService.now();
        SessionRecord touched = sessions.compute(sessionId, (id, current) -> (current == null ? restore(id) : current).touched(now));
        markAccessed(sessionId, now);
        return touched;
    }

    public SessionFolders directoriesFor(String sessionId) {
        if (!RandomIds.isWellFormedSessionId(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        SessionFolders folders = folders(sessionId);
        try {
            for (Path dir : folders.all()) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create session directories for " + sessionId, e);
        }
        return folders;
    }

    public SessionFolders pathsOf(String sessionId) {
        if (!RandomIds.isWellFormedSessionId(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return folders(sessionId);
    }

    public SweepResult expireOlderThan(Duration maxIdle) {
        Instant cutoff = cutoff(maxIdle);
        int removed = 0;
        int failed = 0;
        for (SessionRecord session : knownSessions()) {
            if (session.lastAccessedAt().isAfter(cutoff)) {
                continue;
            }
            try {
                destroy(session.sessionId());
                removed++;
                log.info("Expired session {} (last access {})", session.sessionId(), session.lastAccessedAt());
            } catch (Exception e) {
                failed++;
                log.warn("Failed to expire session {}: {}", session.sessionId(), e.getMessage());
            }
        }
        return new SweepResult(removed, failed);
    }

    public ClearResult clear(String sessionId) {
        if (!RandomIds.isWellFormedSessionId(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        int files = 0;
        int folders = 0;
        for (Path dir : folders(sessionId).all()) {
            if (!Files.exists(dir)) {
                continue;
            }
            try {
                files += countFiles(dir);
                deleteTree(dir);
                folders++;
                log.info("Cleared session folder {}", dir);
            } catch (IOException e) {
                log.warn("Failed to clear session folder {}: {}", dir, e.getMessage());
            }
        }
        sessions.remove(sessionId);
        return new ClearResult(sessionId, files, folders);
    }

    public List<SessionRecord> list(SessionType type) {
        return knownSessions().stream()
                .filter(session -> type == null || session.type() == type)
                .sorted(Comparator.comparing(SessionRecord::lastAccessedAt).reversed())
                .toList();
    }

    public Map<String, Integer> countByType() {
        Map<SessionType, Integer> counts = new EnumMap<>(SessionType.class);
        for (SessionType type : SessionType.values()) {
            counts.put(type, 0);
        }
        for (SessionRecord session : knownSessions()) {
            counts.merge(session.type(), 1, Integer::sum);
        }
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.forEach((type, count) -> result.put(type.wireName(), count));
        result.put("total", counts.values().stream().mapToInt(Integer::intValue).sum());
        return result;
    }

    public void reset() {
        sessions.clear();
    }

    protected void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }

    private SessionRecord create(SessionType requested) {
        SessionType type = requested == SessionType.UNKNOWN ? SessionType.WEB : requested;
        while (true) {
            String sessionId = RandomIds.sessionId(type.prefix(), timeService.idStamp());
            if (Files.exists(imagesRoot.resolve(sessionId))) {
                continue;
            }
            directoriesFor(sessionId);
            Instant now = timeService.now();
            SessionRecord record = new SessionRecord(sessionId, type, now, now);
            sessions.put(sessionId, record);
            log.info("Created session {}", sessionId);
            return record;
        }
    }

    // The images directory goes last: while it exists the session is still considered valid.
    private void destroy(String sessionId) throws IOException {
        SessionFolders folders = folders(sessionId);
        deleteTree(folders.reports());
        deleteTree(folders.altText());
        deleteTree(folders.images());
        sessions.remove(sessionId);
    }

    private List<SessionRecord> knownSessions() {
        sessions.keySet().removeIf(id -> !Files.isDirectory(imagesRoot.resolve(id)));
        List<SessionRecord> result = new ArrayList<>(sessions.values());
        if (!Files.isDirectory(imagesRoot)) {
            return result;
        }
        try (Stream<Path> stream = Files.list(imagesRoot)) {
            stream.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(RandomIds::isWellFormedSessionId)
                    .filter(id -> !sessions.containsKey(id))
                    .forEach(id -> result.add(restore(id)));
        } catch (IOException e) {
            log.warn("Failed to list session directories in {}: {}", imagesRoot, e.getMessage());
        }
        return result;
    }

    private SessionRecord restore(String sessionId) {
        Path dir = imagesRoot.resolve(sessionId);
        Instant created = timeService.now();
        Instant lastAccessed = created;
        try {
            BasicFileAttributes attributes = Files.readAttributes(dir, BasicFileAttributes.class);
            created = attributes.creationTime().toInstant();
            lastAccessed = attributes.lastModifiedTime().toInstant();
        } catch (IOException e) {
            log.debug("No attributes for session directory {}: {}", dir, e.getMessage());
        }
        return new SessionRecord(sessionId, SessionType.fromSessionId(sessionId), created, lastAccessed);
    }

    private Instant cutoff(Duration maxIdle) {
        try {
            return timeService.now().minus(maxIdle);
        } catch (ArithmeticException | DateTimeException e) {
            return Instant.MIN;
        }
    }

    // The directory mtime carries the last access across restarts.
    private void markAccessed(String sessionId, Instant now) {
        try {
            Files.setLastModifiedTime(imagesRoot.resolve(sessionId), FileTime.from(now));
        } catch (IOException e) {
            log.debug("Could not record access time for session {}: {}", sessionId, e.getMessage());
        }
    }

    private SessionFolders folders(String sessionId) {
        return new SessionFolders(
                sessionId,
                SessionType.fromSessionId(sessionId),
                imagesRoot.resolve(sessionId),
                altTextRoot.resolve(sessionId),
                reportsRoot.resolve(sessionId)
        );
    }

    private int countFiles(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return (int) walk.filter(Files::isRegularFile).count();
        }
    }
}

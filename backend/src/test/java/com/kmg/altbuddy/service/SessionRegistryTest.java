package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.ClearResult;
import com.kmg.altbuddy.model.SessionFolders;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.model.SessionType;
import com.kmg.altbuddy.model.SweepResult;
import com.kmg.altbuddy.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {
    @TempDir
    Path baseDir;

    private AltBuddyProperties properties;
    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new AltBuddyProperties();
        properties.setBaseDir(baseDir.toString());
        clock = new MutableClock(Instant.now());
        registry = new SessionRegistry(properties, new TimeService(clock));
    }

    @Test
    void createsSessionWithAllFolders() {
        SessionRecord session = registry.resolveOrCreate(null);

        assertTrue(session.sessionId().startsWith("web-"));
        assertEquals(SessionType.WEB, session.type());
        SessionFolders folders = registry.pathsOf(session.sessionId());
        for (Path dir : folders.all()) {
            assertTrue(Files.isDirectory(dir), dir + " missing");
        }
        assertEquals(baseDir.resolve("images").resolve(session.sessionId()).toAbsolutePath().normalize(),
                folders.images());
    }

    @Test
    void existingSessionIsReused() {
        String id = registry.resolveOrCreate(null).sessionId();

        assertEquals(id, registry.resolveOrCreate(id).sessionId());
    }

    @Test
    void unknownOrMalformedIdsGetANewSession() {
        String fresh = registry.resolveOrCreate("web-20240101T000000Z-abcdefabcdef").sessionId();
        String escaped = registry.resolveOrCreate("../../etc").sessionId();

        assertNotEquals("web-20240101T000000Z-abcdefabcdef", fresh);
        assertTrue(escaped.startsWith("web-"));
        assertFalse(Files.exists(baseDir.resolve("etc")));
    }

    @Test
    void sessionsSurviveARestart() {
        String id = registry.resolveOrCreate(null).sessionId();

        registry.reset();
        SessionRegistry restarted = new SessionRegistry(properties, new TimeService(clock));

        assertEquals(id, registry.resolveOrCreate(id).sessionId());
        assertEquals(id, restarted.resolveOrCreate(id).sessionId());
        assertEquals(1, restarted.list(null).size());
    }

    @Test
    void cliSessionsCarryTheirType() {
        SessionRecord session = registry.resolveOrCreate(null, SessionType.CLI);

        assertTrue(session.sessionId().startsWith("cli-"));
        assertEquals(SessionType.CLI, session.type());
    }

    @Test
    void touchFailsOnceTheDirectoryIsGone() throws IOException {
        String id = registry.resolveOrCreate(null).sessionId();
        deleteRecursively(registry.pathsOf(id).images());

        assertThrows(SessionNotFoundException.class, () -> registry.touch(id));
        assertThrows(SessionNotFoundException.class, () -> registry.require(id));
    }

    @Test
    void touchMovesLastAccessForward() {
        String id = registry.resolveOrCreate(null).sessionId();
        clock.advance(Duration.ofMinutes(10));

        SessionRecord touched = registry.touch(id);

        assertEquals(clock.instant(), touched.lastAccessedAt());
    }

    @Test
    void directoriesForIsIdempotent() {
        String id = registry.resolveOrCreate(null).sessionId();

        SessionFolders first = registry.directoriesFor(id);
        SessionFolders second = registry.directoriesFor(id);

        assertEquals(first, second);
    }

    @Test
    void expireWithZeroAgeRemovesEverySession() {
        String first = registry.resolveOrCreate(null).sessionId();
        String second = registry.resolveOrCreate(null, SessionType.CLI).sessionId();

        SweepResult result = registry.expireOlderThan(Duration.ZERO);

        assertEquals(2, result.removed());
        assertEquals(0, result.failed());
        assertFalse(registry.exists(first));
        assertFalse(registry.exists(second));
        assertFalse(Files.exists(registry.pathsOf(first).altText()));
    }

    @Test
    void expireWithHugeAgeRemovesNothing() {
        registry.resolveOrCreate(null);

        SweepResult result = registry.expireOlderThan(Duration.ofSeconds(Long.MAX_VALUE));

        assertEquals(0, result.removed());
        assertEquals(1, registry.list(null).size());
    }

    @Test
    void onlyIdleSessionsExpire() {
        String idle = registry.resolveOrCreate(null).sessionId();
        clock.advance(Duration.ofHours(23));
        String recent = registry.resolveOrCreate(null).sessionId();
        clock.advance(Duration.ofHours(2));

        SweepResult result = registry.expireOlderThan(Duration.ofHours(24));

        assertEquals(1, result.removed());
        assertFalse(registry.exists(idle));
        assertTrue(registry.exists(recent));
    }

    @Test
    void sessionsLeftByAnEarlierProcessAreSwept() throws IOException {
        String id = registry.resolveOrCreate(null).sessionId();
        Files.setLastModifiedTime(registry.pathsOf(id).images(),
                FileTime.from(clock.instant().minus(Duration.ofDays(3))));

        SessionRegistry restarted = new SessionRegistry(properties, new TimeService(clock));
        SweepResult result = restarted.expireOlderThan(Duration.ofHours(24));

        assertEquals(1, result.removed());
        assertFalse(restarted.exists(id));
    }

    @Test
    void oneFailingSessionDoesNotStopTheSweep() {
        SessionRegistry flaky = new SessionRegistry(properties, new TimeService(clock)) {
            @Override
            protected void deleteTree(Path root) throws IOException {
                if (root.getFileName().toString().startsWith("cli-")) {
                    throw new IOException("device busy");
                }
                super.deleteTree(root);
            }
        };
        String web = flaky.resolveOrCreate(null).sessionId();
        String cli = flaky.resolveOrCreate(null, SessionType.CLI).sessionId();

        SweepResult result = flaky.expireOlderThan(Duration.ZERO);

        assertEquals(1, result.removed());
        assertEquals(1, result.failed());
        assertFalse(flaky.exists(web));
        assertTrue(flaky.exists(cli));
    }

    @Test
    void clearCountsDeletedFilesAndFolders() throws IOException {
        String id = registry.resolveOrCreate(null).sessionId();
        SessionFolders folders = registry.pathsOf(id);
        Files.writeString(folders.images().resolve("a.png"), "x");
        Files.writeString(folders.altText().resolve("a.json"), "{}");
        Files.createDirectories(folders.altText().resolve("nested"));
        Files.writeString(folders.altText().resolve("nested").resolve("b.json"), "{}");

        ClearResult result = registry.clear(id);

        assertEquals(id, result.sessionId());
        assertEquals(3, result.filesDeleted());
        assertEquals(3, result.foldersDeleted());
        assertFalse(registry.exists(id));
    }

    @Test
    void countsSessionsByType() {
        registry.resolveOrCreate(null);
        registry.resolveOrCreate(null);
        registry.resolveOrCreate(null, SessionType.CLI);

        Map<String, Integer> counts = registry.countByType();

        assertEquals(2, counts.get("web"));
        assertEquals(1, counts.get("cli"));
        assertEquals(0, counts.get("unknown"));
        assertEquals(3, counts.get("total"));
        assertEquals(1, registry.list(SessionType.CLI).size());
    }

    private static void deleteRecursively(Path root) throws IOException {
        try (var walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}

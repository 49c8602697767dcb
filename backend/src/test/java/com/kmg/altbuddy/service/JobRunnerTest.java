package com.kmg.altbuddy.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobRecord;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.JobStatus;
import com.kmg.altbuddy.model.SessionRecord;
import com.kmg.altbuddy.support.FakeAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {
    private static final Duration WAIT = Duration.ofSeconds(40);

    @TempDir
    Path baseDir;

    private AltBuddyProperties properties;
    private JobRegistry jobRegistry;
    private SessionRegistry sessionRegistry;
    private ProgressChannel progressChannel;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        properties = new AltBuddyProperties();
        properties.setBaseDir(baseDir.toString());
        properties.getJobs().setPollInterval(Duration.ofMillis(50));
        properties.getJobs().setPageTimeout(Duration.ofSeconds(30));
        properties.getJobs().setBatchTimeout(Duration.ofSeconds(30));

        TimeService timeService = new TimeService();
        jobRegistry = new JobRegistry(timeService, Duration.ofMinutes(5));
        sessionRegistry = new SessionRegistry(properties, timeService);
        progressChannel = new ProgressChannel(new ObjectMapper().findAndRegisterModules(), properties);
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.shutdown();
        }
    }

    @Test
    void progressIsObservedInOrderAndJobCompletes() throws Exception {
        start("progress");
        String sessionId = newSession();

        String jobId = runner.submit(page(sessionId, "https://example.org/gallery"));

        List<Integer> observed = new ArrayList<>();
        JobRecord job = awaitTerminal(jobId, observed);

        assertEquals(JobStatus.COMPLETE, job.status());
        assertEquals(100, job.percent());
        assertEquals("Analysis complete", job.message());
        assertTrue(observed.contains(50), "intermediate progress not seen: " + observed);
        for (int i = 1; i < observed.size(); i++) {
            assertTrue(observed.get(i) >= observed.get(i - 1), "progress went backwards: " + observed);
        }
        assertEquals(0, job.result().exitCode());
        assertFalse(job.result().partial());
        assertEquals(1, job.result().artifactCount());
        assertEquals("A red bicycle leaning on a wall", job.result().artifacts().get(0).altText());
        assertTrue(job.result().reportPath().endsWith("report.html"));
        assertNotNull(job.startedAt());
        assertNotNull(job.finishedAt());
        assertNull(job.error());
        assertNoProgressFiles();
    }

    @Test
    void nonZeroExitWithoutArtifactsFailsWithStderr() throws Exception {
        start("fail");
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.ERROR, job.status());
        assertTrue(job.error().startsWith("Analyzer exited with code 1 and produced no artifacts"), job.error());
        assertTrue(job.error().contains("boom: provider unavailable"), job.error());
        assertNull(job.result());
        assertNoProgressFiles();
    }

    @Test
    void hangingAnalyzerIsKilledAtTheDeadline() throws Exception {
        properties.getJobs().setPageTimeout(Duration.ofSeconds(2));
        start("hang");
        String sessionId = newSession();

        long startedAt = System.nanoTime();
        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

        assertEquals(JobStatus.ERROR, job.status());
        assertEquals("Analysis timed out after 2s", job.error());
        assertTrue(elapsed.compareTo(Duration.ofSeconds(20)) < 0, "took " + elapsed);
        assertEquals(0, runner.runningProcesses());
        assertNoProgressFiles();
    }

    @Test
    void analyzerWithoutProgressStillCompletesFromArtifacts() throws Exception {
        start("silent");
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.COMPLETE, job.status());
        assertEquals(1, job.result().artifactCount());
        assertEquals("A quiet lake", job.result().artifacts().get(0).altText());
        assertEquals(0, job.percent());
        assertNull(job.phase());
    }

    @Test
    void nonZeroExitWithArtifactsIsAPartialSuccess() throws Exception {
        start("partial");
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.COMPLETE, job.status());
        assertEquals("Analysis complete with errors", job.message());
        assertEquals(2, job.result().exitCode());
        assertTrue(job.result().partial());
        assertEquals(1, job.result().artifactCount());
    }

    @Test
    void artifactsFromEarlierRunsAreNotCountedAgain() throws Exception {
        start("fail");
        String sessionId = newSession();
        Path altText = sessionRegistry.directoriesFor(sessionId).altText();
        Files.writeString(altText.resolve("old.json"), "{\"image_id\":\"old\",\"proposed_alt_text\":\"Earlier\"}");

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.ERROR, job.status());
    }

    @Test
    void concurrentJobsDoNotSeeEachOthersResults() throws Exception {
        start("echo");
        String first = newSession();
        String second = newSession();

        String firstJob = runner.submit(page(first, "https://alpha.example"));
        String secondJob = runner.submit(page(second, "https://beta.example"));
        assertNotEquals(firstJob, secondJob);

        JobRecord one = awaitTerminal(firstJob, null);
        JobRecord two = awaitTerminal(secondJob, null);

        assertEquals(JobStatus.COMPLETE, one.status());
        assertEquals(JobStatus.COMPLETE, two.status());
        assertEquals(first, one.result().sessionId());
        assertEquals(second, two.result().sessionId());
        assertEquals(List.of("alpha.example"), one.result().artifacts().stream().map(a -> a.imageId()).toList());
        assertEquals(List.of("beta.example"), two.result().artifacts().stream().map(a -> a.imageId()).toList());
        assertEquals("alpha.example", one.phase());
        assertEquals(53, one.percent());
        assertEquals("beta.example", two.phase());
        assertEquals(52, two.percent());
    }

    @Test
    void jobsInTheSameSessionKeepTheirOwnArtifacts() throws Exception {
        start("mixed");
        String sessionId = newSession();

        String badJob = runner.submit(page(sessionId, "https://bad.example"));
        String goodJob = runner.submit(page(sessionId, "https://good.example"));

        JobRecord good = awaitTerminal(goodJob, null);
        JobRecord bad = awaitTerminal(badJob, null);

        assertEquals(JobStatus.COMPLETE, good.status());
        assertEquals(List.of("good.example"), good.result().artifacts().stream().map(a -> a.imageId()).toList());
        assertEquals(JobStatus.ERROR, bad.status());
        assertNull(bad.result());
        assertEquals("Analyzer exited with code 1 and produced no artifacts", bad.error());

        Path altText = sessionRegistry.directoriesFor(sessionId).altText();
        assertEquals(altText.resolve(goodJob).toString(), good.result().outputDirectory());
        assertTrue(Files.isRegularFile(altText.resolve(goodJob).resolve("good.example.json")));
        assertTrue(Files.isDirectory(altText.resolve(badJob)));
    }

    @Test
    void timeoutAlsoKillsProcessesStartedByTheAnalyzer() throws Exception {
        properties.getJobs().setPageTimeout(Duration.ofSeconds(6));
        start("spawn");
        String sessionId = newSession();

        String jobId = runner.submit(page(sessionId, "https://example.org"));
        Path pidFile = sessionRegistry.directoriesFor(sessionId).altText().resolve(jobId).resolve("child.pid");
        JobRecord job = awaitTerminal(jobId, null);

        assertEquals(JobStatus.ERROR, job.status());
        assertTrue(Files.isRegularFile(pidFile), "analyzer never started its child");
        long childPid = Long.parseLong(Files.readString(pidFile).trim());
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false)
                && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false),
                "child process " + childPid + " survived the timeout");
    }

    @Test
    void largeOutputOnBothStreamsDoesNotStallTheAnalyzer() throws Exception {
        start("chatty");
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.COMPLETE, job.status());
        assertEquals(1, job.result().artifactCount());
    }

    @Test
    void invalidRequestFailsWithoutLaunching() throws Exception {
        start("progress");
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "ftp://example.org/file")), null);

        assertEquals(JobStatus.ERROR, job.status());
        assertTrue(job.error().startsWith("Invalid request:"), job.error());
        assertNull(job.startedAt());
        assertEquals(0, job.percent());
    }

    @Test
    void missingExecutableIsALaunchFailure() throws Exception {
        properties.getAnalyzer().setCommand(List.of(baseDir.resolve("no-such-analyzer").toString()));
        runner = newRunner();
        String sessionId = newSession();

        JobRecord job = awaitTerminal(runner.submit(page(sessionId, "https://example.org")), null);

        assertEquals(JobStatus.ERROR, job.status());
        assertTrue(job.error().startsWith("Failed to launch analyzer"), job.error());
        assertNull(job.startedAt());
        assertNoProgressFiles();
    }

    @Test
    void batchJobCountsImagesInTheSessionFolder() throws Exception {
        start("progress");
        String sessionId = newSession();
        Path folder = sessionRegistry.directoriesFor(sessionId).images().resolve("set1");
        Files.createDirectories(folder);
        Files.write(folder.resolve("a.png"), new byte[]{1});
        Files.write(folder.resolve("b.jpg"), new byte[]{2});
        Files.writeString(folder.resolve("notes.txt"), "skip");

        JobSpec spec = new JobSpec(JobKind.BATCH, sessionId, "set1", null, List.of("en", "IT"), null,
                null, false, false);
        JobRecord job = awaitTerminal(runner.submit(spec), null);

        assertEquals(JobStatus.COMPLETE, job.status());
        assertEquals(2, job.totalImages());
    }

    @Test
    void submissionsBeyondCapacityAreRefused() {
        properties.getJobs().setMaxConcurrent(1);
        properties.getJobs().setQueueCapacity(0);
        start("hang");
        String sessionId = newSession();

        runner.submit(page(sessionId, "https://example.org/one"));

        assertThrows(JobRejectedException.class, () -> runner.submit(page(sessionId, "https://example.org/two")));
        assertEquals(1, jobRegistry.list().size());
    }

    private void start(String scenario) {
        properties.getAnalyzer().setCommand(FakeAnalyzer.command(scenario));
        runner = newRunner();
    }

    private JobRunner newRunner() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        return new JobRunner(
                jobRegistry,
                sessionRegistry,
                progressChannel,
                new JobValidator(sessionRegistry, new ImageFolderService(), properties),
                new AnalyzerCommandBuilder(properties),
                new ArtifactCollector(mapper),
                properties
        );
    }

    private String newSession() {
        SessionRecord session = sessionRegistry.resolveOrCreate(null);
        return session.sessionId();
    }

    private static JobSpec page(String sessionId, String url) {
        return new JobSpec(JobKind.PAGE_ANALYSIS, sessionId, url, null, List.of("en"), null, null, false, false);
    }

    private JobRecord awaitTerminal(String jobId, List<Integer> observed) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            JobRecord job = jobRegistry.require(jobId);
            if (observed != null && job.status() == JobStatus.RUNNING
                    && (observed.isEmpty() || observed.get(observed.size() - 1) != job.percent())) {
                observed.add(job.percent());
            }
            if (job.status().isTerminal()) {
                if (observed != null) {
                    observed.add(job.percent());
                }
                return job;
            }
            Thread.sleep(20);
        }
        fail("job " + jobId + " did not finish within " + WAIT);
        return null;
    }

    private void assertNoProgressFiles() throws Exception {
        Path dir = progressChannel.directory();
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }
}

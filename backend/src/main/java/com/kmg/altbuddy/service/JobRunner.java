package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobRecord;
import com.kmg.altbuddy.model.JobResult;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.SessionFolders;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each job as one supervised analyzer process on a bounded worker pool.
 *
 * <p>The worker owns its job record until the job is terminal: it validates the request,
 * launches the analyzer, drains both output streams, polls the progress file, enforces the
 * deadline and finally decides between complete and error from the artifacts the run left.
 * No failure inside a worker escapes it; every outcome ends up on the job record.</p>
 */
@Service
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final int OUTPUT_LIMIT = 256 * 1024;
    private static final int ERROR_TAIL = 800;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final JobRegistry jobRegistry;
    private final SessionRegistry sessionRegistry;
    private final ProgressChannel progressChannel;
    private final JobValidator jobValidator;
    private final AnalyzerCommandBuilder commandBuilder;
    private final ArtifactCollector artifactCollector;
    private final AltBuddyProperties properties;

    private final ThreadPoolExecutor workers;
    private final Map<String, Process> liveProcesses = new ConcurrentHashMap<>();

    public JobRunner(
            JobRegistry jobRegistry,
            SessionRegistry sessionRegistry,
            ProgressChannel progressChannel,
            JobValidator jobValidator,
            AnalyzerCommandBuilder commandBuilder,
            ArtifactCollector artifactCollector,
            AltBuddyProperties properties
    ) {
        this.jobRegistry = jobRegistry;
        this.sessionRegistry = sessionRegistry;
        this.progressChannel = progressChannel;
        this.jobValidator = jobValidator;
        this.commandBuilder = commandBuilder;
        this.artifactCollector = artifactCollector;
        this.properties = properties;

        AltBuddyProperties.Jobs jobs = properties.getJobs();
        BlockingQueue<Runnable> queue = jobs.getQueueCapacity() > 0
                ? new ArrayBlockingQueue<>(jobs.getQueueCapacity())
                : new SynchronousQueue<>();
        this.workers = new ThreadPoolExecutor(
                jobs.getMaxConcurrent(),
                jobs.getMaxConcurrent(),
                60L,
                TimeUnit.SECONDS,
                queue,
                new WorkerThreadFactory()
        );
    }

    public String submit(JobSpec spec) {
        JobRecord record = jobRegistry.create(spec.kind(), spec.sessionId());
        try {
            workers.execute(() -> runJob(record.jobId(), spec));
        } catch (RejectedExecutionException e) {
            jobRegistry.remove(record.jobId());
            log.warn("Rejected {} job: {} running, {} queued", spec.kind().wireName(),
                    workers.getActiveCount(), workers.getQueue().size());
            throw new JobRejectedException("Too many analysis jobs in progress; try again later.", e);
        }
        log.info("Job {} submitted ({}, session {})", record.jobId(), spec.kind().wireName(), spec.sessionId());
        return record.jobId();
    }

    public int runningProcesses() {
        return liveProcesses.size();
    }

    private void runJob(String jobId, JobSpec requested) {
        Path progressFile = null;
        Process process = null;
        try {
            JobValidator.ValidatedJob job;
            try {
                job = jobValidator.validate(requested);
            } catch (JobValidationException e) {
                log.info("Job {} rejected: {}", jobId, e.getMessage());
                jobRegistry.fail(jobId, "Invalid request: " + e.getMessage());
                return;
            }
            JobSpec spec = job.spec();

            sessionRegistry.touch(spec.sessionId());
            SessionFolders folders = sessionRegistry.directoriesFor(spec.sessionId());
            progressFile = progressChannel.allocate(jobId);
            Path outputDir = artifactCollector.prepareOutputDir(folders, jobId);
            List<String> command = commandBuilder.build(spec, folders, outputDir, progressFile);

            process = launch(command);
            liveProcesses.put(jobId, process);
            jobRegistry.markRunning(jobId, "Analysis started", job.totalImages());
            log.info("Job {} running analyzer (pid {})", jobId, process.pid());

            OutputDrain stdout = OutputDrain.start(process.getInputStream(), "analyzer-out-" + jobId, OUTPUT_LIMIT);
            OutputDrain stderr = OutputDrain.start(process.getErrorStream(), "analyzer-err-" + jobId, OUTPUT_LIMIT);
            process.getOutputStream().close();

            Duration timeout = timeoutFor(spec.kind());
            if (!supervise(jobId, process, progressFile, timeout)) {
                destroyTree(process);
                process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                joinDrains(jobId, stdout, stderr);
                progressChannel.delete(progressFile);
                log.warn("Job {} timed out after {}; analyzer killed", jobId, describe(timeout));
                jobRegistry.fail(jobId, "Analysis timed out after " + describe(timeout));
                return;
            }

            int exitCode = process.exitValue();
            progressChannel.read(progressFile).ifPresent(snapshot -> jobRegistry.mergeProgress(jobId, snapshot));
            joinDrains(jobId, stdout, stderr);
            progressChannel.delete(progressFile);

            String output = stdout.text() + "\n" + stderr.text();
            Optional<JobResult> result = artifactCollector.collect(folders, outputDir, exitCode, output);
            if (result.isPresent()) {
                if (exitCode != 0) {
                    log.warn("Job {}: analyzer exited with code {} but left {} artifact(s); reporting a partial result",
                            jobId, exitCode, result.get().artifactCount());
                }
                jobRegistry.complete(jobId, result.get(),
                        exitCode == 0 ? "Analysis complete" : "Analysis complete with errors");
                log.info("Job {} complete with {} artifact(s)", jobId, result.get().artifactCount());
            } else {
                String error = noArtifactsMessage(exitCode, stderr, stdout);
                log.warn("Job {} failed: {}", jobId, error);
                jobRegistry.fail(jobId, error);
            }
        } catch (AnalyzerLaunchException e) {
            log.error("Job {}: {}", jobId, e.getMessage());
            jobRegistry.fail(jobId, e.getMessage());
        } catch (SessionNotFoundException e) {
            jobRegistry.fail(jobId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobRegistry.fail(jobId, "Job interrupted before the analyzer finished");
        } catch (Exception e) {
            log.error("Job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
            jobRegistry.fail(jobId, "Unexpected error: " + e.getMessage());
        } finally {
            if (process != null) {
                liveProcesses.remove(jobId);
                if (process.isAlive()) {
                    destroyTree(process);
                }
            }
            if (progressFile != null) {
                progressChannel.delete(progressFile);
            }
            ensureTerminal(jobId);
        }
    }

    // Returns false when the deadline passed before the process exited.
    private boolean supervise(String jobId, Process process, Path progressFile, Duration timeout)
            throws InterruptedException {
        long pollMillis = Math.max(10L, properties.getJobs().getPollInterval().toMillis());
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return false;
            }
            if (process.waitFor(Math.min(pollMillis, remainingMillis), TimeUnit.MILLISECONDS)) {
                return true;
            }
            progressChannel.read(progressFile).ifPresent(snapshot -> jobRegistry.mergeProgress(jobId, snapshot));
        }
    }

    private Process launch(List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDir().toFile());
        builder.environment().put("PYTHONUNBUFFERED", "1");
        try {
            return builder.start();
        } catch (IOException e) {
            throw new AnalyzerLaunchException("Failed to launch analyzer: " + e.getMessage(), e);
        }
    }

    private void joinDrains(String jobId, OutputDrain stdout, OutputDrain stderr) throws InterruptedException {
        Duration wait = properties.getJobs().getDrainJoinTimeout();
        if (!stdout.join(wait) || !stderr.join(wait)) {
            log.warn("Job {}: analyzer output readers did not finish within {}; continuing", jobId, describe(wait));
        }
    }

    private void ensureTerminal(String jobId) {
        try {
            jobRegistry.get(jobId)
                    .filter(job -> !job.status().isTerminal())
                    .ifPresent(job -> jobRegistry.fail(jobId, "Job ended without a result"));
        } catch (JobNotFoundException e) {
            log.debug("Job {} disappeared before it finished", jobId);
        }
    }

    private Duration timeoutFor(JobKind kind) {
        return kind == JobKind.BATCH
                ? properties.getJobs().getBatchTimeout()
                : properties.getJobs().getPageTimeout();
    }

    private Path workingDir() {
        String configured = properties.getAnalyzer().getWorkingDir();
        return configured == null || configured.isBlank()
                ? properties.baseDirPath()
                : properties.resolve(configured);
    }

    private String noArtifactsMessage(int exitCode, OutputDrain stderr, OutputDrain stdout) {
        String detail = stderr.tail(ERROR_TAIL);
        if (detail.isEmpty()) {
            detail = stdout.tail(ERROR_TAIL);
        }
        String message = exitCode == 0
                ? "Analyzer finished but produced no artifacts"
                : "Analyzer exited with code " + exitCode + " and produced no artifacts";
        return detail.isEmpty() ? message : message + ": " + detail;
    }

    private static String describe(Duration duration) {
        return duration.toMillis() % 1000 == 0
                ? duration.toSeconds() + "s"
                : duration.toMillis() + "ms";
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        liveProcesses.forEach((jobId, process) -> {
            log.info("Stopping analyzer for job {} on shutdown", jobId);
            destroyTree(process);
        });
    }

    // Children first: once the parent is gone its descendants are no longer reachable from it.
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

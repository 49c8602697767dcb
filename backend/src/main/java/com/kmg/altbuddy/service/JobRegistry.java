package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobRecord;
import com.kmg.altbuddy.model.JobResult;
import com.kmg.altbuddy.model.JobStatus;
import com.kmg.altbuddy.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory catalog of jobs. Records are immutable and replaced atomically through
 * {@link ConcurrentHashMap#computeIfPresent}, so a reader always sees a whole record.
 * Only the worker that owns a job calls the mutating methods.
 */
@Service
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final TimeService timeService;
    private final Duration retention;

    @Autowired
    public JobRegistry(TimeService timeService, AltBuddyProperties properties) {
        this(timeService, properties.getJobs().getRetention());
    }

    public JobRegistry(TimeService timeService, Duration retention) {
        this.timeService = timeService;
        this.retention = retention;
    }

    public JobRecord create(JobKind kind, String sessionId) {
        while (true) {
            String jobId = RandomIds.jobId();
            JobRecord record = JobRecord.starting(jobId, kind, sessionId, timeService.now());
            if (jobs.putIfAbsent(jobId, record) == null) {
                return record;
            }
        }
    }

    public Optional<JobRecord> get(String jobId) {
        purgeExpired();
        return Optional.ofNullable(jobs.get(jobId));
    }

    public JobRecord require(String jobId) {
        return get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<JobRecord> list() {
        purgeExpired();
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobRecord::createdAt).reversed())
                .toList();
    }

    public long activeCount() {
        return jobs.values().stream().filter(job -> !job.status().isTerminal()).count();
    }

    public JobRecord markRunning(String jobId, String message, Integer totalImages) {
        return update(jobId, current -> {
            requireTransition(current, JobStatus.RUNNING);
            return current.running(message, totalImages, timeService.now());
        });
    }

    public JobRecord mergeProgress(String jobId, ProgressSnapshot snapshot) {
        return update(jobId, current -> current.status() == JobStatus.RUNNING ? current.merge(snapshot) : current);
    }

    public JobRecord complete(String jobId, JobResult result, String message) {
        return update(jobId, current -> {
            requireTransition(current, JobStatus.COMPLETE);
            return current.completed(result, message, timeService.now());
        });
    }

    // A job that already ended keeps its first terminal state.
    public JobRecord fail(String jobId, String error) {
        return update(jobId, current -> {
            if (current.status().isTerminal()) {
                log.debug("Ignoring failure for finished job {}: {}", jobId, error);
                return current;
            }
            return current.failed(error, timeService.now());
        });
    }

    public void remove(String jobId) {
        jobs.remove(jobId);
    }

    public void reset() {
        jobs.clear();
    }

    private JobRecord update(String jobId, UnaryOperator<JobRecord> change) {
        JobRecord updated = jobs.computeIfPresent(jobId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return updated;
    }

    private void requireTransition(JobRecord current, JobStatus next) {
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Job %s may not move from %s to %s.",
                    current.jobId(), current.status().wireName(), next.wireName()));
        }
    }

    private void purgeExpired() {
        Instant now = timeService.now();
        jobs.values().removeIf(job -> job.expiredAt(now, retention));
    }
}

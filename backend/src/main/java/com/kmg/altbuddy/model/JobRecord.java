package com.kmg.altbuddy.model;

import java.time.Duration;
import java.time.Instant;

public record JobRecord(
        String jobId,
        JobKind kind,
        String sessionId,
        JobStatus status,
        int percent,
        String message,
        String phase,
        Integer currentImage,
        Integer totalImages,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        JobResult result,
        String error
) {
    public static JobRecord starting(String jobId, JobKind kind, String sessionId, Instant now) {
        return new JobRecord(jobId, kind, sessionId, JobStatus.STARTING, 0, "Job queued",
                null, null, null, now, null, null, null, null);
    }

    public JobRecord running(String message, Integer totalImages, Instant now) {
        return new JobRecord(jobId, kind, sessionId, JobStatus.RUNNING, percent, message, phase,
                currentImage, totalImages != null ? totalImages : this.totalImages,
                createdAt, now, null, null, null);
    }

    public JobRecord merge(ProgressSnapshot snapshot) {
        return new JobRecord(
                jobId,
                kind,
                sessionId,
                status,
                snapshot.percent() != null ? clampPercent(snapshot.percent()) : percent,
                snapshot.message() != null ? snapshot.message() : message,
                snapshot.phase() != null ? snapshot.phase() : phase,
                snapshot.currentImage() != null ? snapshot.currentImage() : currentImage,
                snapshot.totalImages() != null ? snapshot.totalImages() : totalImages,
                createdAt,
                startedAt,
                finishedAt,
                result,
                error
        );
    }

    public JobRecord completed(JobResult result, String message, Instant now) {
        return new JobRecord(jobId, kind, sessionId, JobStatus.COMPLETE, percent, message, phase,
                currentImage, totalImages, createdAt, startedAt, now, result, null);
    }

    public JobRecord failed(String error, Instant now) {
        return new JobRecord(jobId, kind, sessionId, JobStatus.ERROR, percent, "Job failed", phase,
                currentImage, totalImages, createdAt, startedAt, now, null, error);
    }

    public boolean expiredAt(Instant now, Duration retention) {
        return status.isTerminal() && finishedAt != null && !finishedAt.plus(retention).isAfter(now);
    }

    private static int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }
}

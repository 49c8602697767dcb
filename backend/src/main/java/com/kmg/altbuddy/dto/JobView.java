package com.kmg.altbuddy.dto;

import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobRecord;
import com.kmg.altbuddy.model.JobResult;
import com.kmg.altbuddy.model.JobStatus;

import java.time.Instant;

public record JobView(
        String jobId,
        JobKind kind,
        String sessionId,
        JobStatus status,
        int percent,
        String message,
        String phase,
        Integer currentImage,
        Integer totalImages,
        String createdAt,
        String startedAt,
        String finishedAt,
        JobResult result,
        String error
) {
    public static JobView from(JobRecord job) {
        return new JobView(
                job.jobId(),
                job.kind(),
                job.sessionId(),
                job.status(),
                job.percent(),
                job.message(),
                job.phase(),
                job.currentImage(),
                job.totalImages(),
                format(job.createdAt()),
                format(job.startedAt()),
                format(job.finishedAt()),
                job.result(),
                job.error()
        );
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}

package com.mainframe.migration.pipeline;

import java.time.Instant;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable view of a job at one point in time.
 */
@Value
@Builder(toBuilder = true)
public class JobSnapshot {

    @NonNull
    String jobId;

    @NonNull
    JobStatus status;

    /**
     * 0 to 100.
     */
    int progress;

    PipelineStage currentStage;

    JobMetrics metrics;

    String errorMessage;

    Instant startedAt;

    Instant completedAt;

    @NonNull
    Instant updatedAt;

    public Optional<PipelineStage> getCurrentStage() {
        return Optional.ofNullable(currentStage);
    }

    public Optional<JobMetrics> getMetrics() {
        return Optional.ofNullable(metrics);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }
}

package com.mainframe.migration.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable lifecycle of one job.
 *
 * Transitions are serialized on this object; readers get immutable
 * {@link JobSnapshot}s without locking. Once the job is finished (completed,
 * failed, cancelled or under review) pipeline transitions are ignored with a
 * warning and report {@code false}, so an external cancel never breaks a
 * running pipeline. startedAt and completedAt are written at most once.
 */
public class JobState {
    private static final Logger log = LoggerFactory.getLogger(JobState.class);

    private final Clock clock;
    private final List<JobStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile JobSnapshot current;

    public JobState(String jobId) {
        this(jobId, Clock.systemUTC());
    }

    public JobState(String jobId, Clock clock) {
        this.clock = clock;
        this.current = JobSnapshot.builder()
                .jobId(jobId)
                .status(JobStatus.PENDING)
                .progress(0)
                .updatedAt(clock.instant())
                .build();
    }

    public String getJobId() {
        return current.getJobId();
    }

    public JobSnapshot snapshot() {
        return current;
    }

    public void addListener(JobStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Pending to Running at progress 0.
     *
     * @throws IllegalStateException if the job already started
     */
    public synchronized boolean start() {
        if (ignoredWhenFinished("start")) {
            return false;
        }
        if (current.getStatus() != JobStatus.PENDING) {
            throw new IllegalStateException("Job " + getJobId() + " already started");
        }
        Instant now = clock.instant();
        transition(s -> s.toBuilder()
                .status(JobStatus.RUNNING)
                .progress(0)
                .startedAt(s.getStartedAt().orElse(now))
                .updatedAt(now)
                .build());
        return true;
    }

    /**
     * Enter {@code stage}, moving progress to its checkpoint.
     *
     * @throws IllegalStateException if the job is not running or progress would go back
     */
    public synchronized boolean advance(PipelineStage stage) {
        if (ignoredWhenFinished("advance to " + stage.getDisplayName())) {
            return false;
        }
        requireRunning("advance to " + stage.getDisplayName());
        if (stage == PipelineStage.COMPLETED) {
            throw new IllegalStateException("Use complete() to finish job " + getJobId());
        }
        if (stage.getCheckpoint() < current.getProgress()) {
            throw new IllegalStateException("Progress of job " + getJobId() + " cannot go back from "
                    + current.getProgress() + " to " + stage.getCheckpoint());
        }
        transition(s -> s.toBuilder()
                .currentStage(stage)
                .progress(stage.getCheckpoint())
                .updatedAt(clock.instant())
                .build());
        return true;
    }

    /**
     * Running to Completed at 100, storing {@code metrics} in the same transition.
     */
    public synchronized boolean complete(JobMetrics metrics) {
        if (ignoredWhenFinished("complete")) {
            return false;
        }
        requireRunning("complete");
        Instant now = clock.instant();
        transition(s -> s.toBuilder()
                .status(JobStatus.COMPLETED)
                .currentStage(PipelineStage.COMPLETED)
                .progress(PipelineStage.COMPLETED.getCheckpoint())
                .metrics(metrics)
                .completedAt(now)
                .updatedAt(now)
                .build());
        return true;
    }

    /**
     * Any unfinished state to Failed. Progress stays where the failure happened.
     */
    public synchronized boolean fail(String errorMessage) {
        if (ignoredWhenFinished("fail")) {
            return false;
        }
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        Instant now = clock.instant();
        transition(s -> s.toBuilder()
                .status(JobStatus.FAILED)
                .errorMessage(message)
                .completedAt(now)
                .updatedAt(now)
                .build());
        return true;
    }

    /**
     * External cancel of a pending or running job.
     */
    public synchronized boolean cancel() {
        if (current.getStatus().isFinished()) {
            log.debug("[{}] Cancel ignored, job is already {}", getJobId(), current.getStatus());
            return false;
        }
        Instant now = clock.instant();
        transition(s -> s.toBuilder()
                .status(JobStatus.CANCELLED)
                .completedAt(now)
                .updatedAt(now)
                .build());
        return true;
    }

    /**
     * Completed to Reviewing.
     *
     * @throws IllegalStateException unless the job completed
     */
    public synchronized void requestReview() {
        if (current.getStatus() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Only completed jobs can be reviewed, job " + getJobId()
                    + " is " + current.getStatus());
        }
        transition(s -> s.toBuilder()
                .status(JobStatus.REVIEWING)
                .updatedAt(clock.instant())
                .build());
    }

    private boolean ignoredWhenFinished(String action) {
        if (current.getStatus().isFinished()) {
            log.warn("[{}] Ignoring {}: job is already {}", getJobId(), action, current.getStatus());
            return true;
        }
        return false;
    }

    private void requireRunning(String action) {
        if (current.getStatus() != JobStatus.RUNNING) {
            throw new IllegalStateException("Cannot " + action + ": job " + getJobId()
                    + " is " + current.getStatus());
        }
    }

    /**
     * Caller holds the monitor, so listeners observe transitions in write order.
     */
    private void transition(UnaryOperator<JobSnapshot> change) {
        JobSnapshot previous = current;
        JobSnapshot next = change.apply(previous);
        current = next;
        for (JobStateListener listener : listeners) {
            try {
                listener.onTransition(previous, next);
            } catch (RuntimeException e) {
                log.warn("[{}] Job state listener failed: {}", getJobId(), e.getMessage(), e);
            }
        }
    }
}

package com.mainframe.migration.pipeline;

/**
 * Lifecycle status of a migration job.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /**
     * Completed and handed over for human review.
     */
    REVIEWING;

    /**
     * True once the pipeline can no longer move the job.
     */
    public boolean isFinished() {
        return this != PENDING && this != RUNNING;
    }
}

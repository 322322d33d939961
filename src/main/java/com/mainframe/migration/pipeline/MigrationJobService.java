package com.mainframe.migration.pipeline;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs migration jobs in the background and keeps their state by job id.
 *
 * Each job is one task on a bounded executor. The registry is the only state
 * shared between jobs.
 */
public class MigrationJobService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MigrationJobService.class);

    private final MigrationPipeline pipeline;
    private final ExecutorService executor;
    private final Map<String, JobState> jobs = new ConcurrentHashMap<>();

    public MigrationJobService(MigrationPipeline pipeline, int maxConcurrentJobs) {
        this.pipeline = pipeline;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrentJobs,
                r -> new Thread(r, "migration-job-" + counter.incrementAndGet()));
    }

    /**
     * Register {@code job} as pending and schedule it.
     *
     * @throws IllegalArgumentException if a job with the same id is registered
     */
    public CompletableFuture<MigrationResult> submit(MigrationJob job, JobStateListener... listeners) {
        JobState state = new JobState(job.getJobId());
        for (JobStateListener listener : listeners) {
            state.addListener(listener);
        }
        if (jobs.putIfAbsent(job.getJobId(), state) != null) {
            throw new IllegalArgumentException("Job already exists: " + job.getJobId());
        }

        log.info("[{}] Job submitted", job.getJobId());
        return CompletableFuture.supplyAsync(() -> pipeline.run(job, state), executor);
    }

    public Optional<JobSnapshot> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(JobState::snapshot);
    }

    /**
     * Mark the job cancelled. A pipeline already running keeps going; its
     * later transitions are ignored.
     *
     * @return false when the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        JobState state = jobs.get(jobId);
        return state != null && state.cancel();
    }

    /**
     * @throws IllegalArgumentException if the job is unknown
     * @throws IllegalStateException    if the job has not completed
     */
    public void requestReview(String jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new IllegalArgumentException("Job not found: " + jobId);
        }
        state.requestReview();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Migration jobs still running after 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}

package com.mainframe.migration.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fans per-program work out over a fixed number of threads.
 *
 * Results come back in input order and {@link #map} returns only after every
 * item finished. With one thread the work runs on the caller thread.
 */
public class ProgramWorkPool implements AutoCloseable {

    private final int threads;
    private final ExecutorService executor;

    public ProgramWorkPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.threads = threads;
        this.executor = threads == 1 ? null : Executors.newFixedThreadPool(threads, namedThreads());
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Apply {@code work} to every item.
     *
     * @throws RuntimeException the first failure of {@code work}, in input order
     */
    public <T, R> List<R> map(List<T> items, Function<T, R> work) {
        List<R> results = new ArrayList<>(items.size());
        if (executor == null) {
            for (T item : items) {
                results.add(work.apply(item));
            }
            return results;
        }

        List<Callable<R>> tasks = new ArrayList<>(items.size());
        for (T item : items) {
            tasks.add(() -> work.apply(item));
        }
        try {
            for (Future<R> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for program workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
        return results;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, "program-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

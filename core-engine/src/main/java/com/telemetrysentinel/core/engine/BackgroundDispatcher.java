package com.telemetrysentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs persistence writes and export forwards off the ingestion path.
 *
 * <h3>Retry</h3>
 * <p>
 * Each task is attempted up to {@code maxAttempts} times on the worker
 * thread, sleeping {@code backoff × 2^(attempt-1)} between attempts. After
 * the last failure the task is logged and dropped; nothing is reported back
 * to the submitter.
 * </p>
 *
 * <h3>Back-pressure</h3>
 * <p>
 * The default executor has a bounded queue. When it is full the task is
 * dropped with a warning instead of blocking the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class BackgroundDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BackgroundDispatcher.class);

    static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final Executor executor;
    private final boolean ownsExecutor;
    private final int maxAttempts;
    private final Duration backoff;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    /**
     * Dispatcher on a caller-supplied executor, which it will not shut down.
     *
     * @param executor    where tasks run; {@code Runnable::run} makes dispatch synchronous
     * @param maxAttempts attempts per task, at least 1
     * @param backoff     base delay between attempts; zero disables sleeping
     */
    public BackgroundDispatcher(Executor executor, int maxAttempts, Duration backoff) {
        this(executor, false, maxAttempts, backoff);
    }

    private BackgroundDispatcher(Executor executor, boolean ownsExecutor, int maxAttempts, Duration backoff) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative, got: " + backoff);
        }
        this.ownsExecutor = ownsExecutor;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /**
     * Dispatcher on its own bounded pool of daemon threads.
     *
     * @param threads     worker threads
     * @param maxAttempts attempts per task
     * @param backoff     base delay between attempts
     * @return dispatcher that shuts its pool down on {@link #close()}
     */
    public static BackgroundDispatcher pooled(int threads, int maxAttempts, Duration backoff) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(DEFAULT_QUEUE_CAPACITY),
                namedDaemonThreads("telemetry-dispatch"));
        return new BackgroundDispatcher(pool, true, maxAttempts, backoff);
    }

    /**
     * Queue a task. Never throws and never blocks on the task itself.
     *
     * @param description short label used in log lines
     * @param task        the work; an exception thrown from it counts as a failed attempt
     */
    public void dispatch(String description, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        try {
            executor.execute(() -> runWithRetry(description, task));
        } catch (RejectedExecutionException e) {
            rejected.incrementAndGet();
            LOG.warn("Dropping background task [{}]: {}", description, e.getMessage());
        }
    }

    private void runWithRetry(String description, Runnable task) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                task.run();
                completed.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                if (attempt == maxAttempts) {
                    failed.incrementAndGet();
                    LOG.error("Background task [{}] failed after {} attempt(s)", description, attempt, e);
                    return;
                }
                LOG.debug("Background task [{}] attempt {} failed: {}", description, attempt, e.getMessage());
                if (!sleepBeforeRetry(attempt)) {
                    failed.incrementAndGet();
                    LOG.warn("Background task [{}] abandoned: interrupted while backing off", description);
                    return;
                }
            }
        }
    }

    private boolean sleepBeforeRetry(int attempt) {
        long delay = backoff.toMillis() << (attempt - 1);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    /**
     * Stop accepting work and wait for queued tasks to finish, if this
     * dispatcher owns its executor.
     */
    @Override
    public void close() {
        if (!ownsExecutor || !(executor instanceof ExecutorService service)) {
            return;
        }
        service.shutdown();
        try {
            if (!service.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Background tasks still running after {}; forcing shutdown", SHUTDOWN_GRACE);
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.shutdownNow();
        }
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

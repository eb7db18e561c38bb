package com.libragraph.chatmedia.core.task;

import com.libragraph.chatmedia.core.cache.CacheIndex;
import com.libragraph.chatmedia.core.error.ErrorKind;
import com.libragraph.chatmedia.core.error.PipelineException;
import com.libragraph.chatmedia.core.model.CacheEntry;
import com.libragraph.chatmedia.core.model.PipelineTask;
import com.libragraph.chatmedia.core.model.ResolvedMedia;
import com.libragraph.chatmedia.core.service.AbstractManagedService;
import com.libragraph.chatmedia.core.validate.MediaValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs pipeline work on a bounded pool with per-key deduplication and timeouts.
 *
 * <p>For each request:
 * <ol>
 *   <li>a request for a key that is already claimed attaches to that run;</li>
 *   <li>otherwise the key is claimed and a job is queued on the pool. The job first
 *       checks the cache (validating entries found on disk) and only runs the work
 *       on a miss. On success the cache entry is recorded before the claim is released.</li>
 * </ol>
 * Callers never block: scanning, validation and work all happen on pool threads.
 *
 * <p>The timeout clock starts when the work starts, not when it is queued. A run
 * exceeding it fails its callers with {@link ErrorKind#TIMEOUT} at once and is
 * interrupted, but keeps the key claimed until its thread actually returns, so a
 * later request waits for it instead of overlapping it. Nothing is retried automatically.
 */
public class ConcurrencyCoordinator extends AbstractManagedService {

    private final int poolSize;
    private final CacheIndex cache;
    private final MediaValidator validator;

    private final ConcurrentHashMap<TaskKey, Run> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong executions = new AtomicLong();

    private volatile ExecutorService workers;
    private volatile ScheduledExecutorService timer;

    /**
     * One claim on a key. {@code result} is what callers see; {@code released}
     * completes once the worker thread has left the run.
     */
    private static final class Run {
        final CompletableFuture<ResolvedMedia> result = new CompletableFuture<>();
        final CompletableFuture<Void> released = new CompletableFuture<>();
        private Thread runner;

        synchronized void attach() {
            runner = Thread.currentThread();
        }

        synchronized void detach() {
            runner = null;
            // a watchdog interrupt must not leak into the next pooled job
            Thread.interrupted();
        }

        synchronized void interrupt() {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    public ConcurrencyCoordinator(int poolSize, CacheIndex cache, MediaValidator validator) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
        this.cache = cache;
        this.validator = validator;
    }

    /**
     * Half the processors, clamped to [2, 6].
     */
    public static int defaultPoolSize(int processors) {
        return Math.max(2, Math.min(6, processors / 2));
    }

    @Override
    public String serviceId() {
        return "concurrency-coordinator";
    }

    @Override
    protected void doStart() {
        workers = Executors.newFixedThreadPool(poolSize, daemonThreads("chatmedia-worker-"));
        timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("chatmedia-timeout-"));
        log.infof("ConcurrencyCoordinator started with %d workers", poolSize);
    }

    @Override
    protected void doStop() throws InterruptedException {
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        timer.shutdownNow();

        List<Run> pending = new ArrayList<>(inFlight.values());
        inFlight.clear();
        for (Run run : pending) {
            run.result.completeExceptionally(new CancellationException("Pipeline stopped"));
            run.released.complete(null);
        }

        if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Workers did not terminate within 5s");
        }
        log.infof("ConcurrencyCoordinator stopped (%d executions, %d pending cancelled)",
                executions.get(), pending.size());
    }

    public int poolSize() {
        return poolSize;
    }

    /** Number of times work actually ran (cache hits and joins excluded). */
    public long executions() {
        return executions.get();
    }

    /** Keys currently claimed, including timed-out runs whose thread has not returned yet. */
    public int inFlightCount() {
        return inFlight.size();
    }

    /** Executor for auxiliary work that should share the pool's bound. */
    public Executor executor() {
        requireRunning();
        return workers;
    }

    /**
     * Resolves a task, joining a running resolution for the same key if there is one.
     * The returned future is private to the caller; cancelling it does not affect others.
     *
     * @param timeout limit on the work itself, measured from when it starts running
     */
    public CompletableFuture<ResolvedMedia> resolve(PipelineTask task, Duration timeout, PipelineWork work) {
        requireRunning();
        TaskKey key = new TaskKey(task.kind(), task.key());

        Run mine = new Run();
        Run existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            if (!existing.result.isDone()) {
                log.debugf("Joining in-flight resolution of %s", key);
                return existing.result.copy();
            }
            // Finished or abandoned but still holding the key: start over once it lets go
            log.debugf("Waiting for %s to release before resolving again", key);
            return existing.released.thenCompose(v -> resolve(task, timeout, work));
        }

        try {
            workers.execute(() -> execute(key, task, timeout, work, mine));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, mine);
            mine.result.completeExceptionally(new IllegalStateException("Coordinator is not accepting work", e));
            mine.released.complete(null);
        }
        return mine.result.copy();
    }

    private void execute(TaskKey key, PipelineTask task, Duration timeout, PipelineWork work, Run run) {
        try {
            if (run.result.isDone()) {
                return;
            }
            Optional<ResolvedMedia> cached = cachedResult(key);
            if (cached.isPresent()) {
                log.debugf("Cache hit for %s", key);
                run.result.complete(cached.get());
                return;
            }
            runWork(key, task, timeout, work, run);
        } catch (RuntimeException e) {
            log.errorf(e, "Unexpected failure checking cache for %s", key);
            run.result.completeExceptionally(e);
        } finally {
            inFlight.remove(key, run);
            run.released.complete(null);
        }
    }

    private void runWork(TaskKey key, PipelineTask task, Duration timeout, PipelineWork work, Run run) {
        task.markRunning();
        executions.incrementAndGet();
        run.attach();
        ScheduledFuture<?> watchdog = timer.schedule(() -> {
            if (task.markFailed()) {
                run.result.completeExceptionally(new PipelineException(ErrorKind.TIMEOUT,
                        "Resolution of " + key + " exceeded " + timeout));
                run.interrupt();
                log.warnf("Timed out %s after %s (last variant %s of %s)",
                        key, timeout, task.attemptedVariant(), task.sourceCandidates());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            ResolvedMedia result = work.execute(task);
            if (task.markSucceeded()) {
                cache.record(CacheEntry.of(result));
                run.result.complete(result);
                log.infof("Resolved %s -> %s", key, result.path());
            } else {
                log.debugf("Discarding late result for abandoned %s", key);
            }
        } catch (Throwable t) {
            if (task.markFailed()) {
                run.result.completeExceptionally(t);
                if (t instanceof PipelineException pe) {
                    log.debugf("Resolution of %s failed (%s): %s", key, pe.kind(), pe.getMessage());
                } else {
                    log.errorf(t, "Unexpected failure resolving %s", key);
                }
            } else {
                log.debugf("Abandoned %s ended with %s", key, t.toString());
            }
        } finally {
            watchdog.cancel(false);
            run.detach();
        }
    }

    private Optional<ResolvedMedia> cachedResult(TaskKey key) {
        Optional<CacheEntry> found = cache.lookup(key.kind(), key.id());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry entry = found.get();
        if (!entry.validated()) {
            MediaValidator.Validation validation = validator.validate(entry.path(), entry.kind());
            if (!validation.usable()) {
                log.warnf("Cached output %s failed validation (%s), discarding", entry.path(), validation.reason());
                cache.invalidate(key.kind(), key.id());
                return Optional.empty();
            }
            entry = cache.markValidated(entry, validation.mimeType(), validation.durationSeconds());
        }
        try {
            return Optional.of(entry.toMedia(Files.size(entry.path())));
        } catch (IOException e) {
            cache.invalidate(key.kind(), key.id());
            return Optional.empty();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}

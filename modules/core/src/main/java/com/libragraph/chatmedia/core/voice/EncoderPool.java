package com.libragraph.chatmedia.core.voice;

import com.libragraph.chatmedia.core.service.AbstractManagedService;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes MP3 encode jobs, either on a shared pool or on dedicated threads.
 */
public class EncoderPool extends AbstractManagedService {

    private final EncoderMode mode;
    private final int size;
    private volatile ExecutorService executor;

    public EncoderPool(EncoderMode mode, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Encoder pool size must be positive: " + size);
        }
        this.mode = mode;
        this.size = size;
    }

    @Override
    public String serviceId() {
        return "encoder-pool";
    }

    @Override
    protected void doStart() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "chatmedia-encoder-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        executor = mode == EncoderMode.POOLED
                ? Executors.newFixedThreadPool(size, threads)
                : Executors.newCachedThreadPool(threads);
        log.infof("EncoderPool started in %s mode%s", mode, mode == EncoderMode.POOLED ? " with " + size + " threads" : "");
    }

    @Override
    protected void doStop() throws InterruptedException {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Encoder threads did not terminate within 5s");
        }
    }

    public <T> Future<T> submit(Callable<T> job) {
        requireRunning();
        return executor.submit(job);
    }
}

package com.khaounen.guard.security.store;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs single-shot store commands with a hard deadline so that a slow or hung backend can never
 * stall the decision path. Every command must be safe to retry.
 */
public class StoreCommandExecutor implements AutoCloseable {

    private final ThreadPoolExecutor executor;
    private final long timeoutMillis;

    public StoreCommandExecutor(int threads, int queueCapacity, long timeoutMillis) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be > 0");
        }
        this.timeoutMillis = timeoutMillis;
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                new StoreThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public <T> T call(String component, Supplier<T> command) {
        Future<T> future;
        try {
            future = executor.submit(command::get);
        } catch (RejectedExecutionException ex) {
            throw new StoreUnavailableException(component, "store executor saturated", ex);
        }
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new StoreUnavailableException(component, "call timed out after " + timeoutMillis + "ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof StoreUnavailableException unavailable) {
                throw unavailable;
            }
            throw new StoreUnavailableException(component, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StoreUnavailableException(component, "interrupted while waiting", ex);
        }
    }

    public void run(String component, Runnable command) {
        call(component, () -> {
            command.run();
            return null;
        });
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class StoreThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "abuse-guard-store-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

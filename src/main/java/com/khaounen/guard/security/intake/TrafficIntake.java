package com.khaounen.guard.security.intake;

import com.khaounen.guard.security.decision.DecisionEngine;
import com.khaounen.guard.security.decision.Verdict;
import com.khaounen.guard.security.identity.ClientIdentity;
import com.khaounen.guard.security.identity.InvalidIdentityException;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool in front of the {@link DecisionEngine}, fed through a bounded queue.
 *
 * <p>A caller never waits longer than the decision timeout: a full queue or a slow evaluation
 * resolves to the engine's failure verdict instead of leaving the request pending.
 */
@Slf4j
public class TrafficIntake implements AutoCloseable {

    private final DecisionEngine engine;
    private final DecisionTelemetry telemetry;
    private final ThreadPoolExecutor workers;
    private final long decisionTimeoutMillis;

    public TrafficIntake(
            DecisionEngine engine,
            DecisionTelemetry telemetry,
            int workerThreads,
            int queueCapacity,
            long decisionTimeoutMillis
    ) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        if (decisionTimeoutMillis <= 0) {
            throw new IllegalArgumentException("decisionTimeoutMillis must be > 0");
        }
        this.engine = engine;
        this.telemetry = telemetry == null ? DecisionTelemetry.NOOP : telemetry;
        this.decisionTimeoutMillis = decisionTimeoutMillis;
        AtomicInteger sequence = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                runnable -> {
                    Thread thread = new Thread(runnable, "abuse-guard-intake-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Builds a canonical event.
     *
     * @throws InvalidIdentityException when the identity is missing or blank
     */
    public TrafficEvent normalize(String identity, long timestamp, long weight, Map<String, String> tags) {
        try {
            return new TrafficEvent(ClientIdentity.of(identity), timestamp, weight, tags);
        } catch (InvalidIdentityException ex) {
            telemetry.intakeRejected("invalid_identity");
            throw ex;
        }
    }

    /**
     * Queues the event for evaluation. A saturated queue completes the future right away with the
     * failure verdict.
     */
    public CompletableFuture<Verdict> submit(TrafficEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> engine.decide(event), workers);
        } catch (RejectedExecutionException ex) {
            telemetry.intakeRejected("saturated");
            log.warn("intake queue full, applying failure policy for {}", event.identity());
            return CompletableFuture.completedFuture(fallback(event));
        }
    }

    /**
     * Evaluates the event and waits at most the decision timeout for the verdict.
     */
    public Verdict decide(TrafficEvent event) {
        CompletableFuture<Verdict> future = submit(event);
        try {
            return future.get(decisionTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            telemetry.intakeRejected("timeout");
            log.debug("no verdict for {} within {}ms", event.identity(), decisionTimeoutMillis);
            return fallback(event);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback(event);
        } catch (ExecutionException | CancellationException ex) {
            log.error("decision for {} failed", event.identity(), ex);
            return fallback(event);
        }
    }

    private Verdict fallback(TrafficEvent event) {
        Verdict verdict = engine.failureVerdict(event.identity().value(), event.timestamp());
        engine.record(verdict, Duration.ofMillis(decisionTimeoutMillis));
        return verdict;
    }

    public int pending() {
        return workers.getQueue().size();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}

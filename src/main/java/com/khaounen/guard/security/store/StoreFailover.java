package com.khaounen.guard.security.store;

import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Applies a {@link StoreFailurePolicy} around calls to a shared store. Outage start and recovery
 * are logged once each, not per call.
 */
@Slf4j
public class StoreFailover {

    private final String component;
    private final StoreFailurePolicy policy;
    private final DecisionTelemetry telemetry;
    private final AtomicBoolean degraded = new AtomicBoolean();

    public StoreFailover(String component, StoreFailurePolicy policy, DecisionTelemetry telemetry) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.component = component;
        this.policy = policy;
        this.telemetry = telemetry == null ? DecisionTelemetry.NOOP : telemetry;
    }

    public <T> T call(Supplier<T> primary, Supplier<T> fallback) {
        try {
            T result = primary.get();
            if (degraded.compareAndSet(true, false)) {
                log.info("{} store reachable again, leaving local fallback", component);
            }
            return result;
        } catch (StoreUnavailableException ex) {
            if (policy == StoreFailurePolicy.FAIL_CLOSED) {
                throw StoreUnavailableException.failingClosed(ex);
            }
            telemetry.storeFailure(component);
            if (degraded.compareAndSet(false, true)) {
                log.warn("{} store unavailable, serving from local fallback: {}", component, ex.getMessage());
            }
            return fallback.get();
        }
    }

    /**
     * Calls a store that has no local fallback. The failure always propagates, marked as failing
     * closed under {@link StoreFailurePolicy#FAIL_CLOSED}.
     */
    public <T> T callWithoutFallback(Supplier<T> primary) {
        try {
            return primary.get();
        } catch (StoreUnavailableException ex) {
            if (policy == StoreFailurePolicy.FAIL_CLOSED) {
                throw StoreUnavailableException.failingClosed(ex);
            }
            throw ex;
        }
    }

    public void run(Runnable primary, Runnable fallback) {
        call(() -> {
            primary.run();
            return null;
        }, () -> {
            fallback.run();
            return null;
        });
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public StoreFailurePolicy getPolicy() {
        return policy;
    }
}

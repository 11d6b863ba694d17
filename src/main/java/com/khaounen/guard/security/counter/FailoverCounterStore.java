package com.khaounen.guard.security.counter;

import com.khaounen.guard.security.store.StoreFailover;

/**
 * Shared counter store with a per-instance fallback, governed by the configured
 * {@link com.khaounen.guard.security.store.StoreFailurePolicy}. Snapshots served by the fallback
 * are flagged {@link RateSnapshot#degraded()}.
 */
public class FailoverCounterStore implements CounterStore {

    private final CounterStore primary;
    private final CounterStore fallback;
    private final StoreFailover failover;

    public FailoverCounterStore(CounterStore primary, CounterStore fallback, StoreFailover failover) {
        if (primary.windowMillis() != fallback.windowMillis()) {
            throw new IllegalArgumentException("primary and fallback must share the same window");
        }
        this.primary = primary;
        this.fallback = fallback;
        this.failover = failover;
    }

    @Override
    public RateSnapshot increment(String identity, long weight, long nowMillis) {
        return failover.call(
                () -> primary.increment(identity, weight, nowMillis),
                () -> fallback.increment(identity, weight, nowMillis).asDegraded()
        );
    }

    @Override
    public RateSnapshot peek(String identity, long nowMillis) {
        return failover.call(
                () -> primary.peek(identity, nowMillis),
                () -> fallback.peek(identity, nowMillis).asDegraded()
        );
    }

    @Override
    public void reset(String identity, long nowMillis) {
        fallback.reset(identity, nowMillis);
        failover.run(() -> primary.reset(identity, nowMillis), () -> { });
    }

    @Override
    public long windowMillis() {
        return primary.windowMillis();
    }
}

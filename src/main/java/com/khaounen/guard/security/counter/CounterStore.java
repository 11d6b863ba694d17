package com.khaounen.guard.security.counter;

/**
 * Per-identity weighted request counters over a rolling window.
 *
 * <p>Implementations must not lose increments under concurrent writers for the same identity.
 * Failures of a shared backend surface as
 * {@link com.khaounen.guard.security.store.StoreUnavailableException}.
 */
public interface CounterStore {

    RateSnapshot increment(String identity, long weight, long nowMillis);

    RateSnapshot peek(String identity, long nowMillis);

    void reset(String identity, long nowMillis);

    long windowMillis();
}

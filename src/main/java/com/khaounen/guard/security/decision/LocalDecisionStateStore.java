package com.khaounen.guard.security.decision;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-instance state. Leases are always granted: the engine's per-identity lock already
 * serializes recomputation inside one instance.
 */
public class LocalDecisionStateStore implements DecisionStateStore {

    private final Cache<String, IdentityState> states;

    public LocalDecisionStateStore(Duration retention, long maximumIdentities) {
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(Math.max(1, maximumIdentities))
                .build();
    }

    @Override
    public Optional<IdentityState> load(String identity) {
        IdentityState state = states.getIfPresent(identity);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    @Override
    public void save(String identity, IdentityState state) {
        states.put(identity, state.copy());
    }

    @Override
    public void delete(String identity) {
        states.invalidate(identity);
    }

    @Override
    public boolean tryAcquireLease(String identity, String owner, long leaseMillis) {
        return true;
    }

    @Override
    public void releaseLease(String identity, String owner) {
    }
}

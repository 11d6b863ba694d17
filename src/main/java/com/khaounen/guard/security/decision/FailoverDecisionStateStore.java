package com.khaounen.guard.security.decision;

import com.khaounen.guard.security.store.StoreFailover;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Shared state with a per-instance fallback. While degraded every instance owns its identities
 * outright, so the lease is granted locally.
 */
@Slf4j
public class FailoverDecisionStateStore implements DecisionStateStore {

    private final DecisionStateStore primary;
    private final DecisionStateStore fallback;
    private final StoreFailover failover;

    public FailoverDecisionStateStore(DecisionStateStore primary, DecisionStateStore fallback, StoreFailover failover) {
        this.primary = primary;
        this.fallback = fallback;
        this.failover = failover;
    }

    @Override
    public Optional<IdentityState> load(String identity) {
        return failover.call(() -> primary.load(identity), () -> fallback.load(identity));
    }

    @Override
    public void save(String identity, IdentityState state) {
        failover.run(() -> primary.save(identity, state), () -> fallback.save(identity, state));
    }

    @Override
    public void delete(String identity) {
        fallback.delete(identity);
        failover.run(() -> primary.delete(identity), () -> { });
    }

    @Override
    public boolean tryAcquireLease(String identity, String owner, long leaseMillis) {
        return failover.call(
                () -> primary.tryAcquireLease(identity, owner, leaseMillis),
                () -> fallback.tryAcquireLease(identity, owner, leaseMillis)
        );
    }

    @Override
    public void releaseLease(String identity, String owner) {
        try {
            failover.run(() -> primary.releaseLease(identity, owner), () -> { });
        } catch (RuntimeException ex) {
            // the lease expires on its own
            log.debug("lease release for {} failed: {}", identity, ex.getMessage());
        }
    }
}

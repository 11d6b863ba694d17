package com.khaounen.guard.security.reputation;

import com.khaounen.guard.security.store.StoreFailover;

import java.util.List;
import java.util.Optional;

/**
 * Shared ledger with a per-instance fallback for scores and sync state. Overrides are operator
 * decisions and are never answered from a local copy: an unreadable override store surfaces as a
 * failure so the engine applies its failure policy, or throttles when the store fails closed.
 */
public class FailoverReputationLedger implements ReputationLedger {

    private final ReputationLedger primary;
    private final ReputationLedger fallback;
    private final StoreFailover failover;

    public FailoverReputationLedger(ReputationLedger primary, ReputationLedger fallback, StoreFailover failover) {
        this.primary = primary;
        this.fallback = fallback;
        this.failover = failover;
    }

    @Override
    public int read(String identity, long nowMillis) {
        return failover.call(() -> primary.read(identity, nowMillis), () -> fallback.read(identity, nowMillis));
    }

    @Override
    public int adjust(String identity, int delta, long nowMillis) {
        return failover.call(
                () -> primary.adjust(identity, delta, nowMillis),
                () -> fallback.adjust(identity, delta, nowMillis)
        );
    }

    @Override
    public Optional<IdentityOverride> activeOverride(String identity, long nowMillis) {
        return failover.callWithoutFallback(() -> primary.activeOverride(identity, nowMillis));
    }

    @Override
    public void setOverride(IdentityOverride override) {
        primary.setOverride(override);
    }

    @Override
    public Optional<IdentityOverride> clearOverride(String identity) {
        return primary.clearOverride(identity);
    }

    @Override
    public List<IdentityOverride> listOverrides(long nowMillis) {
        return primary.listOverrides(nowMillis);
    }

    @Override
    public void markSync(String identity, SyncRecord record) {
        failover.run(() -> primary.markSync(identity, record), () -> fallback.markSync(identity, record));
    }

    @Override
    public Optional<SyncRecord> syncState(String identity) {
        return failover.call(() -> primary.syncState(identity), () -> fallback.syncState(identity));
    }
}

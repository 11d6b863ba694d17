package com.khaounen.guard.security;

import com.khaounen.guard.security.counter.RateSnapshot;
import com.khaounen.guard.security.decision.DecisionEngine;
import com.khaounen.guard.security.decision.IdentityState;
import com.khaounen.guard.security.decision.Verdict;
import com.khaounen.guard.security.identity.ClientIdentity;
import com.khaounen.guard.security.reputation.IdentityOverride;
import com.khaounen.guard.security.reputation.OverrideKind;
import com.khaounen.guard.security.reputation.ReputationLedger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Operator operations. Store failures surface to the caller as
 * {@link com.khaounen.guard.security.store.StoreUnavailableException}; nothing here is on the
 * request path.
 */
public class GuardAdminService {

    private final DecisionEngine engine;
    private final Clock clock;

    public GuardAdminService(DecisionEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    public GuardStatus status(String identity) {
        String key = ClientIdentity.of(identity).value();
        long now = clock.millis();
        ReputationLedger ledger = engine.ledger();
        int score = ledger.read(key, now);
        Verdict verdict = engine.currentVerdict(key, now);
        IdentityState state = engine.currentState(key);
        RateSnapshot rate = engine.counters().peek(key, now);
        long limit = engine.rules().defaultRule().threshold();
        return new GuardStatus(
                key,
                score,
                verdict,
                verdict.state().isOnLadder() ? state.getState() : verdict.state(),
                rate,
                limit,
                rate.remaining(limit),
                rate.windowResetAtMillis(),
                ledger.activeOverride(key, now).orElse(null),
                ledger.syncState(key).orElse(null)
        );
    }

    /**
     * @param ttl how long the override lasts, {@code null} until cleared
     */
    public IdentityOverride setOverride(String identity, OverrideKind kind, Duration ttl, String reason) {
        String key = ClientIdentity.of(identity).value();
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("override ttl must be positive");
        }
        long now = clock.millis();
        Long expiresAt = ttl == null ? null : now + ttl.toMillis();
        IdentityOverride override = new IdentityOverride(key, kind, expiresAt, now, reason);
        engine.applyOverride(override);
        return override;
    }

    /**
     * @return true if an override was removed
     */
    public boolean clearOverride(String identity) {
        return engine.clearOverride(ClientIdentity.of(identity).value()).isPresent();
    }

    public List<IdentityOverride> listOverrides() {
        return engine.ledger().listOverrides(clock.millis());
    }

    public void resetCounters(String identity) {
        engine.resetCounters(ClientIdentity.of(identity).value());
    }
}

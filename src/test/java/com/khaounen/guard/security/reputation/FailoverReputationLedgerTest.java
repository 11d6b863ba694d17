package com.khaounen.guard.security.reputation;

import com.khaounen.guard.security.store.StoreFailover;
import com.khaounen.guard.security.store.StoreFailurePolicy;
import com.khaounen.guard.security.store.StoreUnavailableException;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailoverReputationLedgerTest {

    private static final long T0 = 1_700_000_000_000L;

    private final LocalReputationLedger fallback =
            new LocalReputationLedger(DecayFunction.linear(1.0), Duration.ofHours(1), 100);
    private final FailoverReputationLedger ledger = new FailoverReputationLedger(new UnreachableLedger(), fallback,
            new StoreFailover("reputation", StoreFailurePolicy.LOCAL_FALLBACK, DecisionTelemetry.NOOP));

    @Test
    void scoresDegradeToTheLocalLedger() {
        assertEquals(-10, ledger.adjust("a", -10, T0));
        assertEquals(-10, ledger.read("a", T0));
        assertEquals(-10, fallback.read("a", T0));
    }

    @Test
    void overridesAreNeverAnsweredLocally() {
        fallback.setOverride(new IdentityOverride("a", OverrideKind.WHITELIST, null, T0, "stale"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> ledger.activeOverride("a", T0));
        assertEquals("reputation", ex.getComponent());
        assertFalse(ex.isFailClosed());
    }

    @Test
    void unreadableOverridesFailClosedUnderTheClosedPolicy() {
        FailoverReputationLedger closed = new FailoverReputationLedger(new UnreachableLedger(), fallback,
                new StoreFailover("reputation", StoreFailurePolicy.FAIL_CLOSED, DecisionTelemetry.NOOP));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> closed.activeOverride("a", T0));
        assertTrue(ex.isFailClosed());
        assertEquals("reputation", ex.getComponent());
    }

    private static final class UnreachableLedger implements ReputationLedger {

        @Override
        public int read(String identity, long nowMillis) {
            throw down();
        }

        @Override
        public int adjust(String identity, int delta, long nowMillis) {
            throw down();
        }

        @Override
        public Optional<IdentityOverride> activeOverride(String identity, long nowMillis) {
            throw down();
        }

        @Override
        public void setOverride(IdentityOverride override) {
            throw down();
        }

        @Override
        public Optional<IdentityOverride> clearOverride(String identity) {
            throw down();
        }

        @Override
        public List<IdentityOverride> listOverrides(long nowMillis) {
            throw down();
        }

        @Override
        public void markSync(String identity, SyncRecord record) {
            throw down();
        }

        @Override
        public Optional<SyncRecord> syncState(String identity) {
            throw down();
        }

        private static StoreUnavailableException down() {
            return new StoreUnavailableException("reputation", "connection refused");
        }
    }
}

package com.khaounen.guard.security.reputation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalReputationLedgerTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final long MINUTE = 60_000L;

    @Test
    void scoresStayWithinBounds() {
        LocalReputationLedger ledger = ledger(DecayFunction.linear(1.0));

        assertEquals(ReputationScore.MIN_SCORE, ledger.adjust("a", -500, T0));
        assertEquals(ReputationScore.MAX_SCORE, ledger.adjust("b", 1_000, T0));
        assertEquals(ReputationScore.MAX_SCORE, ledger.adjust("b", 1, T0));
        assertEquals(ReputationScore.NEUTRAL, ledger.read("unknown", T0));
    }

    @Test
    void linearDecayMovesTowardNeutralWithoutOvershooting() {
        LocalReputationLedger ledger = ledger(DecayFunction.linear(1.0));
        ledger.adjust("a", -50, T0);

        int previous = ledger.read("a", T0);
        assertEquals(-50, previous);
        for (int minutes = 5; minutes <= 45; minutes += 5) {
            int current = ledger.read("a", T0 + minutes * MINUTE);
            assertTrue(Math.abs(current) < Math.abs(previous), "no progress at " + minutes + " minutes");
            assertTrue(current <= 0, "overshot neutral at " + minutes + " minutes");
            previous = current;
        }
        assertEquals(0, ledger.read("a", T0 + 50 * MINUTE));
        assertEquals(0, ledger.read("a", T0 + 500 * MINUTE));
    }

    @Test
    void exponentialDecayHalvesPerHalfLife() {
        LocalReputationLedger ledger = ledger(DecayFunction.exponential(Duration.ofMinutes(10)));
        ledger.adjust("a", 80, T0);

        assertEquals(40, ledger.read("a", T0 + 10 * MINUTE));
        assertEquals(20, ledger.read("a", T0 + 20 * MINUTE));
        assertEquals(10, ledger.read("a", T0 + 30 * MINUTE));
        assertTrue(ledger.read("a", T0 + 1_000 * MINUTE) >= 0);
    }

    @Test
    void adjustAppliesDecayBeforeTheDelta() {
        LocalReputationLedger ledger = ledger(DecayFunction.linear(1.0));
        ledger.adjust("a", -20, T0);

        assertEquals(-15, ledger.adjust("a", -5, T0 + 10 * MINUTE));
    }

    @Test
    void overridesExpireAndCanBeCleared() {
        LocalReputationLedger ledger = ledger(DecayFunction.linear(1.0));
        ledger.setOverride(new IdentityOverride("a", OverrideKind.WHITELIST, T0 + MINUTE, T0, "partner"));
        ledger.setOverride(new IdentityOverride("b", OverrideKind.BLACKLIST, null, T0, "abuse"));

        assertTrue(ledger.activeOverride("a", T0).isPresent());
        assertFalse(ledger.activeOverride("a", T0 + MINUTE).isPresent());

        List<IdentityOverride> active = ledger.listOverrides(T0 + MINUTE);
        assertEquals(1, active.size());
        assertEquals("b", active.get(0).identity());

        Optional<IdentityOverride> removed = ledger.clearOverride("b");
        assertEquals(OverrideKind.BLACKLIST, removed.orElseThrow().kind());
        assertTrue(ledger.clearOverride("b").isEmpty());
    }

    @Test
    void recordsSyncState() {
        LocalReputationLedger ledger = ledger(DecayFunction.linear(1.0));
        ledger.markSync("a", new SyncRecord(3, "UPSERT", SyncStatus.SYNCED, T0, null));

        SyncRecord record = ledger.syncState("a").orElseThrow();
        assertEquals(3, record.generation());
        assertEquals(SyncStatus.SYNCED, record.status());
        assertTrue(ledger.syncState("b").isEmpty());
    }

    private static LocalReputationLedger ledger(DecayFunction decay) {
        return new LocalReputationLedger(decay, Duration.ofHours(1), 1_000);
    }
}

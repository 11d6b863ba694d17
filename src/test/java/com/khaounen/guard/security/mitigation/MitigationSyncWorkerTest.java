package com.khaounen.guard.security.mitigation;

import com.khaounen.guard.security.reputation.DecayFunction;
import com.khaounen.guard.security.reputation.LocalReputationLedger;
import com.khaounen.guard.security.reputation.SyncRecord;
import com.khaounen.guard.security.reputation.SyncStatus;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import com.khaounen.guard.support.InMemoryEdgeFirewall;
import com.khaounen.guard.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MitigationSyncWorkerTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final MitigationSettings FAST = fast(1_000);

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryEdgeFirewall edge = new InMemoryEdgeFirewall();
    private final LocalReputationLedger ledger =
            new LocalReputationLedger(DecayFunction.linear(1.0), Duration.ofHours(1), 1_000);
    private final AtomicInteger successes = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final List<String> synced = new CopyOnWriteArrayList<>();
    private final List<String> failed = new CopyOnWriteArrayList<>();

    @Test
    void replayedNotificationIsAppliedOnce() throws Exception {
        MitigationSyncWorker worker = worker();
        MitigationNotification block = MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "EXTREME_RATE", T0);

        assertTrue(worker.process(block));
        assertFalse(worker.process(block));

        assertEquals(1, edge.upserts());
        assertEquals(1, successes.get());
        assertEquals(List.of("1.2.3.4"), synced);
    }

    @Test
    void olderGenerationNeverOverridesANewerOne() throws Exception {
        MitigationSyncWorker worker = worker();
        worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "EXTREME_RATE", T0));
        worker.process(MitigationNotification.remove("1.2.3.4", 2, "HOLD_EXPIRED", T0));

        boolean applied = worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1,
                "EXTREME_RATE", T0));

        assertFalse(applied);
        assertFalse(edge.hasRule("1.2.3.4"));
        SyncRecord record = ledger.syncState("1.2.3.4").orElseThrow();
        assertEquals(2, record.generation());
        assertEquals("REMOVE", record.action());
        assertEquals(SyncStatus.SYNCED, record.status());
    }

    @Test
    void transientEdgeFailuresAreRetried() throws Exception {
        MitigationSyncWorker worker = worker();
        edge.failNext(2, true);

        assertTrue(worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "BLACKLISTED", T0)));

        assertEquals(3, edge.calls());
        assertTrue(edge.hasRule("1.2.3.4"));
        assertEquals(0, failures.get());
    }

    @Test
    void permanentEdgeFailureIsRecordedWithoutRetrying() throws Exception {
        MitigationSyncWorker worker = worker();
        edge.failNext(1, false);

        assertFalse(worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "BLACKLISTED", T0)));

        assertEquals(1, edge.calls());
        assertEquals(1, failures.get());
        assertEquals(List.of("1.2.3.4"), failed);
        assertEquals(SyncStatus.FAILED, ledger.syncState("1.2.3.4").orElseThrow().status());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        MitigationSyncWorker worker = worker();
        edge.failNext(10, true);

        assertFalse(worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "BLACKLISTED", T0)));

        assertEquals(3, edge.calls());
        assertEquals(SyncStatus.FAILED, ledger.syncState("1.2.3.4").orElseThrow().status());
    }

    @Test
    void failedNotificationCanBeRetriedLater() throws Exception {
        MitigationSyncWorker worker = worker();
        MitigationNotification block = MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "BLACKLISTED", T0);
        edge.failNext(10, true);
        worker.process(block);

        edge.failNext(0, true);

        assertTrue(worker.process(block));
        assertTrue(edge.hasRule("1.2.3.4"));
    }

    @Test
    void sweepRemovesRulesWhoseTtlElapsed() throws Exception {
        MitigationSyncWorker worker = worker();
        worker.process(MitigationNotification.upsert("1.2.3.4", Duration.ofMinutes(10), 1, "EXTREME_RATE", T0));
        worker.process(MitigationNotification.upsert("5.6.7.8", null, 1, "BLACKLISTED", T0));
        assertEquals(Duration.ofMinutes(10), worker.expiresIn("1.2.3.4"));

        clock.advance(Duration.ofMinutes(5));
        worker.sweepExpired();
        assertTrue(edge.hasRule("1.2.3.4"));

        clock.advance(Duration.ofMinutes(5));
        worker.sweepExpired();

        assertFalse(edge.hasRule("1.2.3.4"));
        assertNull(worker.expiresIn("1.2.3.4"));
        assertTrue(edge.hasRule("5.6.7.8"));
    }

    @Test
    void backgroundLoopDrainsTheQueue() throws Exception {
        MitigationQueue queue = new MitigationQueue(10, Duration.ofMinutes(5));
        MitigationSyncWorker worker = new MitigationSyncWorker(queue, edge, ledger, DecisionTelemetry.NOOP,
                List.of(), FAST, clock);
        worker.start();
        try {
            queue.enqueue(MitigationNotification.upsert("1.2.3.4", Duration.ofHours(1), 1, "EXTREME_RATE", T0));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!edge.hasRule("1.2.3.4") && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertTrue(edge.hasRule("1.2.3.4"));
        } finally {
            worker.close();
        }
    }

    @Test
    void appliedGenerationsStayBoundedUnderManyIdentities() throws Exception {
        MitigationSyncWorker worker = worker(fast(100));

        for (int i = 0; i < 5_000; i++) {
            String identity = "10.0." + (i / 256) + "." + (i % 256);
            assertTrue(worker.process(MitigationNotification.upsert(identity, Duration.ofMinutes(10), 1,
                    "EXTREME_RATE", T0)));
            assertTrue(worker.process(MitigationNotification.remove(identity, 2, "HOLD_EXPIRED", T0)));
        }
        worker.sweepExpired();

        assertTrue(worker.trackedIdentities() <= 100, "tracked " + worker.trackedIdentities());
        assertFalse(edge.hasRule("10.0.0.0"));
        assertNull(worker.expiresIn("10.0.0.0"));
    }

    @Test
    void backoffDoublesUpToTheCap() {
        MitigationSettings settings = MitigationSettings.defaults();
        List<Long> delays = new ArrayList<>();
        for (int attempt = 1; attempt <= 8; attempt++) {
            delays.add(settings.backoffMillis(attempt));
        }

        assertEquals(List.of(200L, 400L, 800L, 1_600L, 3_200L, 6_400L, 10_000L, 10_000L), delays);
    }

    private static MitigationSettings fast(long maxTrackedIdentities) {
        return new MitigationSettings(Duration.ofMillis(1), Duration.ofMillis(4), 3, Duration.ofSeconds(30),
                Duration.ofMillis(10), maxTrackedIdentities, Duration.ofHours(1));
    }

    private MitigationSyncWorker worker() {
        return worker(FAST);
    }

    private MitigationSyncWorker worker(MitigationSettings settings) {
        DecisionTelemetry telemetry = new DecisionTelemetry() {
            @Override
            public void mitigationSync(boolean success) {
                (success ? successes : failures).incrementAndGet();
            }
        };
        MitigationSyncListener listener = new MitigationSyncListener() {
            @Override
            public void onSynced(MitigationNotification notification) {
                synced.add(notification.identity());
            }

            @Override
            public void onFailed(MitigationNotification notification, String error) {
                failed.add(notification.identity());
            }
        };
        return new MitigationSyncWorker(new MitigationQueue(10, Duration.ofMinutes(5)), edge, ledger, telemetry,
                List.of(listener), settings, clock);
    }
}

package com.khaounen.guard.security.intake;

import com.khaounen.guard.security.counter.CounterStore;
import com.khaounen.guard.security.counter.LocalCounterStore;
import com.khaounen.guard.security.counter.RateSnapshot;
import com.khaounen.guard.security.decision.DecisionEngine;
import com.khaounen.guard.security.decision.DecisionFailurePolicy;
import com.khaounen.guard.security.decision.DecisionSettings;
import com.khaounen.guard.security.decision.LocalDecisionStateStore;
import com.khaounen.guard.security.decision.ReasonCode;
import com.khaounen.guard.security.decision.TrafficRules;
import com.khaounen.guard.security.decision.Verdict;
import com.khaounen.guard.security.decision.VerdictKind;
import com.khaounen.guard.security.identity.InvalidIdentityException;
import com.khaounen.guard.security.mitigation.MitigationQueue;
import com.khaounen.guard.security.reputation.DecayFunction;
import com.khaounen.guard.security.reputation.LocalReputationLedger;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import com.khaounen.guard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrafficIntakeTest {

    private static final long T0 = 1_700_000_000_000L;

    private final List<String> rejections = new CopyOnWriteArrayList<>();
    private final DecisionTelemetry telemetry = new DecisionTelemetry() {
        @Override
        public void intakeRejected(String cause) {
            rejections.add(cause);
        }
    };
    private final CountDownLatch release = new CountDownLatch(1);
    private TrafficIntake intake;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (intake != null) {
            intake.close();
        }
    }

    @Test
    void rejectsEventsWithoutIdentity() {
        intake = new TrafficIntake(engine(new LocalCounterStore(60, 100)), telemetry, 1, 4, 1_000);

        assertThrows(InvalidIdentityException.class, () -> intake.normalize("  ", T0, 1, Map.of()));
        assertThrows(InvalidIdentityException.class, () -> intake.normalize(null, T0, 1, Map.of()));
        assertEquals(List.of("invalid_identity", "invalid_identity"), rejections);
    }

    @Test
    void decidesNormalizedEvents() {
        intake = new TrafficIntake(engine(new LocalCounterStore(60, 100)), telemetry, 2, 4, 1_000);

        Verdict verdict = intake.decide(intake.normalize("10.0.0.1", T0, 1, Map.of(TrafficEvent.TAG_PATH, "/")));

        assertEquals(VerdictKind.ALLOW, verdict.kind());
        assertEquals(ReasonCode.WITHIN_LIMITS, verdict.reason());
    }

    @Test
    void slowEvaluationResolvesToFailurePolicy() {
        intake = new TrafficIntake(engine(new BlockingCounterStore(release)), telemetry, 1, 4, 50);

        Verdict verdict = intake.decide(TrafficEvent.of("10.0.0.1", T0, 1));

        assertEquals(VerdictKind.THROTTLE, verdict.kind());
        assertEquals(ReasonCode.FAIL_CLOSED, verdict.reason());
        assertEquals(List.of("timeout"), rejections);
    }

    @Test
    void saturatedQueueAnswersImmediately() throws Exception {
        intake = new TrafficIntake(engine(new BlockingCounterStore(release)), telemetry, 1, 1, 1_000);

        CompletableFuture<Verdict> running = intake.submit(TrafficEvent.of("10.0.0.1", T0, 1));
        CompletableFuture<Verdict> queued = intake.submit(TrafficEvent.of("10.0.0.2", T0, 1));
        CompletableFuture<Verdict> rejected = intake.submit(TrafficEvent.of("10.0.0.3", T0, 1));

        assertTrue(rejected.isDone());
        assertEquals(ReasonCode.FAIL_CLOSED, rejected.get().reason());
        assertEquals(List.of("saturated"), rejections);

        release.countDown();
        assertEquals(VerdictKind.ALLOW, running.get(5, TimeUnit.SECONDS).kind());
        assertEquals(VerdictKind.ALLOW, queued.get(5, TimeUnit.SECONDS).kind());
    }

    private DecisionEngine engine(CounterStore counters) {
        DecisionSettings settings = DecisionSettings.builder()
                .failurePolicy(DecisionFailurePolicy.FAIL_CLOSED)
                .build();
        return new DecisionEngine(
                counters,
                new LocalReputationLedger(DecayFunction.linear(1.0), Duration.ofHours(1), 100),
                new LocalDecisionStateStore(Duration.ofHours(1), 100),
                new MitigationQueue(10, Duration.ofMinutes(1)),
                telemetry,
                TrafficRules.single(100),
                settings,
                new MutableClock(T0)
        );
    }

    private static final class BlockingCounterStore implements CounterStore {
        private final CounterStore delegate = new LocalCounterStore(60, 100);
        private final CountDownLatch release;

        private BlockingCounterStore(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public RateSnapshot increment(String identity, long weight, long nowMillis) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return delegate.increment(identity, weight, nowMillis);
        }

        @Override
        public RateSnapshot peek(String identity, long nowMillis) {
            return delegate.peek(identity, nowMillis);
        }

        @Override
        public void reset(String identity, long nowMillis) {
            delegate.reset(identity, nowMillis);
        }

        @Override
        public long windowMillis() {
            return delegate.windowMillis();
        }
    }
}

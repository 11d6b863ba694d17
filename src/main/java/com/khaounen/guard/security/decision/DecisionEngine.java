package com.khaounen.guard.security.decision;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.khaounen.guard.security.counter.CounterStore;
import com.khaounen.guard.security.counter.RateSnapshot;
import com.khaounen.guard.security.intake.TrafficEvent;
import com.khaounen.guard.security.mitigation.MitigationNotification;
import com.khaounen.guard.security.mitigation.MitigationQueue;
import com.khaounen.guard.security.reputation.IdentityOverride;
import com.khaounen.guard.security.reputation.OverrideKind;
import com.khaounen.guard.security.reputation.ReputationLedger;
import com.khaounen.guard.security.reputation.ReputationScore;
import com.khaounen.guard.security.store.StoreUnavailableException;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns traffic events into verdicts.
 *
 * <p>Evaluation order per event: whitelist, blacklist, cached verdict, then a fresh evaluation of
 * the ladder against the rate and reputation. A fresh evaluation for one identity runs at most
 * once at a time: a per-identity lock inside the instance and a lease in the shared state store
 * across instances. Store failures never escape {@link #decide}; they resolve to the last verdict
 * within the grace period, then to the configured {@link DecisionFailurePolicy}. A store failing
 * closed always throttles.
 *
 * <p>The engine never talks to the edge. Entering or leaving a blocking state bumps the identity's
 * generation and enqueues a {@link MitigationNotification}.
 */
@Slf4j
public class DecisionEngine {

    private final CounterStore counters;
    private final ReputationLedger ledger;
    private final DecisionStateStore stateStore;
    private final MitigationQueue mitigationQueue;
    private final DecisionTelemetry telemetry;
    private final TrafficRules rules;
    private final DecisionSettings settings;
    private final EnforcementLadder ladder;
    private final Clock clock;
    private final String instanceId = UUID.randomUUID().toString();
    private final Cache<String, CachedVerdict> verdicts;
    private final LoadingCache<String, ReentrantLock> locks;
    private final AtomicBoolean storeDown = new AtomicBoolean();

    public DecisionEngine(
            CounterStore counters,
            ReputationLedger ledger,
            DecisionStateStore stateStore,
            MitigationQueue mitigationQueue,
            DecisionTelemetry telemetry,
            TrafficRules rules,
            DecisionSettings settings,
            Clock clock
    ) {
        settings.validate();
        this.counters = counters;
        this.ledger = ledger;
        this.stateStore = stateStore;
        this.mitigationQueue = mitigationQueue;
        this.telemetry = telemetry == null ? DecisionTelemetry.NOOP : telemetry;
        this.rules = rules;
        this.settings = settings;
        this.ladder = new EnforcementLadder(settings.getLadder());
        this.clock = clock;
        this.verdicts = Caffeine.newBuilder()
                .expireAfterWrite(settings.getVerdictTtl().plus(settings.getGrace()))
                .maximumSize(settings.getMaximumIdentities())
                .build();
        this.locks = Caffeine.newBuilder()
                .weakValues()
                .build(key -> new ReentrantLock());
    }

    public Verdict decide(TrafficEvent event) {
        long started = System.nanoTime();
        Verdict verdict = evaluate(event);
        record(verdict, Duration.ofNanos(System.nanoTime() - started));
        return verdict;
    }

    private Verdict evaluate(TrafficEvent event) {
        String identity = event.identity().value();
        long now = event.timestamp();
        try {
            Optional<IdentityOverride> override = ledger.activeOverride(identity, now);
            if (override.isPresent()) {
                storeRecovered();
                return overrideVerdict(override.get(), now);
            }
            TrafficRule rule = rules.match(event);
            RateSnapshot rate = counters.increment(identity, rule.weigh(event.weight()), now);
            CachedVerdict cached = verdicts.getIfPresent(identity);
            if (cached != null && cached.answers(rate, rule, now)) {
                return cached.verdict();
            }
            Verdict verdict = recompute(identity, rule, rate, now);
            storeRecovered();
            return verdict;
        } catch (StoreUnavailableException ex) {
            telemetry.storeFailure(ex.getComponent());
            if (storeDown.compareAndSet(false, true)) {
                log.warn("deciding without the {} store: {}", ex.getComponent(), ex.getMessage());
            } else {
                log.debug("{} store still unavailable for {}", ex.getComponent(), identity);
            }
            if (ex.isFailClosed()) {
                return overThresholdVerdict(identity, now);
            }
            return failureVerdict(identity, now);
        }
    }

    private Verdict recompute(String identity, TrafficRule rule, RateSnapshot rate, long now) {
        ReentrantLock lock = locks.get(identity);
        boolean locked;
        try {
            locked = lock.tryLock(settings.getLockWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return failureVerdict(identity, now);
        }
        if (!locked) {
            log.debug("timed out waiting for the evaluation of {}", identity);
            return failureVerdict(identity, now);
        }
        try {
            // a concurrent evaluation may have produced a verdict that still answers this event
            CachedVerdict cached = verdicts.getIfPresent(identity);
            if (cached != null && cached.answers(rate, rule, now)) {
                return cached.verdict();
            }
            return evaluateLadder(identity, rule, rate, now);
        } finally {
            lock.unlock();
        }
    }

    private Verdict evaluateLadder(String identity, TrafficRule rule, RateSnapshot rate, long now) {
        boolean leased = stateStore.tryAcquireLease(identity, instanceId, settings.getLease().toMillis());
        try {
            IdentityState state = stateStore.load(identity).orElseGet(IdentityState::new);
            if (!leased) {
                // another instance is evaluating this identity, answer from what it last wrote
                return verdictFor(state, state.getLastReason(), now);
            }
            int score = ledger.read(identity, now);
            double threshold = effectiveThreshold(rule, score);
            LadderOutcome outcome = ladder.advance(state, rate.bucketIndex(), now, rate.effectiveRate(), threshold);
            if (outcome.changed()) {
                onTransition(identity, state, outcome, now);
            }
            stateStore.save(identity, state);
            Verdict verdict = verdictFor(state, outcome.reason(), now);
            verdicts.put(identity, new CachedVerdict(verdict, rate.bucketIndex(), rule.name(), threshold,
                    outcome.violating()));
            return verdict;
        } finally {
            if (leased) {
                releaseLease(identity);
            }
        }
    }

    private void onTransition(String identity, IdentityState state, LadderOutcome outcome, long now) {
        int delta = reputationDelta(outcome);
        if (delta != 0) {
            ledger.adjust(identity, delta, now);
        }
        if (outcome.crossedBlock()) {
            state.setGeneration(state.getGeneration() + 1);
            if (outcome.to().isBlocking()) {
                Duration ttl = Duration.ofMillis(Math.max(0L, state.getHoldUntil() - now));
                mitigationQueue.enqueue(MitigationNotification.upsert(identity, ttl, state.getGeneration(),
                        outcome.reason().name(), now));
            } else {
                mitigationQueue.enqueue(MitigationNotification.remove(identity, state.getGeneration(),
                        outcome.reason().name(), now));
            }
            log.info("{} moved {} -> {} ({}), generation {}", identity, outcome.from(), outcome.to(),
                    outcome.reason(), state.getGeneration());
        } else {
            log.debug("{} moved {} -> {} ({})", identity, outcome.from(), outcome.to(), outcome.reason());
        }
    }

    private int reputationDelta(LadderOutcome outcome) {
        if (outcome.promoted()) {
            return -settings.getPenaltyPerSeverity() * outcome.to().severity();
        }
        if (outcome.to() == EnforcementState.CLEAN) {
            return settings.getRecoveryReward();
        }
        return 0;
    }

    double effectiveThreshold(TrafficRule rule, int score) {
        double factor = 1.0 + settings.getReputationWeight() * score / ReputationScore.MAX_SCORE;
        factor = Math.max(0.5, Math.min(1.5, factor));
        return rule.threshold() * factor;
    }

    /**
     * Verdict used when none can be computed: the last verdict while within the grace period,
     * otherwise the configured failure policy.
     */
    public Verdict failureVerdict(String identity, long now) {
        CachedVerdict last = verdicts.getIfPresent(identity);
        if (last != null && now < last.verdict().expiresAt() + settings.getGrace().toMillis()) {
            return last.verdict().withReason(ReasonCode.GRACE);
        }
        if (settings.getFailurePolicy() == DecisionFailurePolicy.FAIL_OPEN) {
            return Verdict.allow(ReasonCode.FAIL_OPEN, EnforcementState.CLEAN, now, now);
        }
        return Verdict.throttle(settings.getFailClosedThrottle(), ReasonCode.FAIL_CLOSED, now, now);
    }

    /**
     * Verdict for a store failing closed: the identity counts as over its threshold, so only an
     * enforcing last verdict within the grace period is kept, otherwise the identity is throttled.
     */
    Verdict overThresholdVerdict(String identity, long now) {
        CachedVerdict last = verdicts.getIfPresent(identity);
        if (last != null && last.verdict().kind() != VerdictKind.ALLOW
                && now < last.verdict().expiresAt() + settings.getGrace().toMillis()) {
            return last.verdict().withReason(ReasonCode.GRACE);
        }
        return Verdict.throttle(settings.getFailClosedThrottle(), ReasonCode.FAIL_CLOSED, now, now);
    }

    /**
     * Records a verdict produced outside {@link #decide}, e.g. by a timed-out intake.
     */
    public void record(Verdict verdict, Duration elapsed) {
        try {
            telemetry.verdict(verdict);
            telemetry.decisionLatency(elapsed);
        } catch (RuntimeException ex) {
            log.warn("telemetry failed: {}", ex.getMessage());
        }
    }

    /**
     * Current verdict without counting traffic or advancing the ladder.
     */
    public Verdict currentVerdict(String identity, long now) {
        Optional<IdentityOverride> override = ledger.activeOverride(identity, now);
        if (override.isPresent()) {
            return overrideVerdict(override.get(), now);
        }
        CachedVerdict cached = verdicts.getIfPresent(identity);
        if (cached != null && cached.verdict().isValidAt(now)) {
            return cached.verdict();
        }
        IdentityState state = stateStore.load(identity).orElseGet(IdentityState::new);
        return verdictFor(state, state.getLastReason(), now);
    }

    public IdentityState currentState(String identity) {
        return stateStore.load(identity).orElseGet(IdentityState::new);
    }

    public void applyOverride(IdentityOverride override) {
        String identity = override.identity();
        long now = clock.millis();
        ReentrantLock lock = locks.get(identity);
        lock.lock();
        try {
            IdentityOverride previous = ledger.activeOverride(identity, now).orElse(null);
            ledger.setOverride(override);
            verdicts.invalidate(identity);
            reconcileBlock(identity, previous, override.isActive(now) ? override : null, now);
        } finally {
            lock.unlock();
        }
        log.info("override {} set for {} until {}: {}", override.kind(), identity,
                override.expiresAt() == null ? "never" : override.expiresAt(), override.reason());
    }

    public Optional<IdentityOverride> clearOverride(String identity) {
        long now = clock.millis();
        ReentrantLock lock = locks.get(identity);
        lock.lock();
        Optional<IdentityOverride> removed;
        try {
            removed = ledger.clearOverride(identity);
            verdicts.invalidate(identity);
            IdentityOverride previous = removed.filter(o -> o.isActive(now)).orElse(null);
            reconcileBlock(identity, previous, null, now);
        } finally {
            lock.unlock();
        }
        removed.ifPresent(o -> log.info("override {} cleared for {}", o.kind(), identity));
        return removed;
    }

    public void resetCounters(String identity) {
        counters.reset(identity, clock.millis());
        verdicts.invalidate(identity);
        log.info("counters reset for {}", identity);
    }

    private void reconcileBlock(String identity, IdentityOverride before, IdentityOverride after, long now) {
        IdentityState state = stateStore.load(identity).orElseGet(IdentityState::new);
        boolean wasBlocking = isBlocking(state, before, now);
        boolean nowBlocking = isBlocking(state, after, now);
        if (wasBlocking == nowBlocking) {
            return;
        }
        state.setGeneration(state.getGeneration() + 1);
        stateStore.save(identity, state);
        if (nowBlocking) {
            Duration ttl = after != null
                    ? (after.expiresAt() == null ? null : Duration.ofMillis(after.remainingMillis(now)))
                    : Duration.ofMillis(state.getHoldUntil() - now);
            String reason = after != null ? ReasonCode.BLACKLISTED.name() : state.getLastReason().name();
            mitigationQueue.enqueue(MitigationNotification.upsert(identity, ttl, state.getGeneration(), reason, now));
        } else {
            String reason = after != null ? ReasonCode.WHITELISTED.name() : "OVERRIDE_CLEARED";
            mitigationQueue.enqueue(MitigationNotification.remove(identity, state.getGeneration(), reason, now));
        }
    }

    private static boolean isBlocking(IdentityState state, IdentityOverride override, long now) {
        if (override != null) {
            return override.kind() == OverrideKind.BLACKLIST;
        }
        return state.getState() == EnforcementState.BLOCKED && state.getHoldUntil() > now;
    }

    private Verdict overrideVerdict(IdentityOverride override, long now) {
        long ttlEnd = now + settings.getVerdictTtl().toMillis();
        long expiresAt = override.expiresAt() == null ? ttlEnd : Math.min(ttlEnd, override.expiresAt());
        if (override.kind() == OverrideKind.WHITELIST) {
            return Verdict.allow(ReasonCode.WHITELISTED, EnforcementState.WHITELISTED, now, expiresAt);
        }
        Duration duration = override.expiresAt() == null
                ? settings.getBlacklistBlock()
                : Duration.ofMillis(override.remainingMillis(now));
        return new Verdict(VerdictKind.BLOCK, duration, ReasonCode.BLACKLISTED, EnforcementState.BLACKLISTED,
                now, expiresAt, 0L);
    }

    private Verdict verdictFor(IdentityState state, ReasonCode reason, long now) {
        long ttlEnd = now + settings.getVerdictTtl().toMillis();
        EnforcementState current = state.getState();
        if (!current.isEnforcing()) {
            return new Verdict(VerdictKind.ALLOW, Duration.ZERO, reason, current, now, ttlEnd, state.getGeneration());
        }
        long holdUntil = state.getHoldUntil();
        Duration remaining = Duration.ofMillis(Math.max(0L, holdUntil - now));
        long expiresAt = Math.min(ttlEnd, Math.max(now, holdUntil));
        VerdictKind kind;
        switch (current) {
            case THROTTLED:
                kind = VerdictKind.THROTTLE;
                break;
            case CHALLENGED:
                kind = VerdictKind.CHALLENGE;
                break;
            default:
                kind = VerdictKind.BLOCK;
                break;
        }
        return new Verdict(kind, remaining, reason, current, now, expiresAt, state.getGeneration());
    }

    private void releaseLease(String identity) {
        try {
            stateStore.releaseLease(identity, instanceId);
        } catch (StoreUnavailableException ex) {
            // the lease expires on its own
            log.debug("could not release lease for {}: {}", identity, ex.getMessage());
        }
    }

    private void storeRecovered() {
        if (storeDown.compareAndSet(true, false)) {
            log.info("decision stores reachable again");
        }
    }

    public TrafficRules rules() {
        return rules;
    }

    public CounterStore counters() {
        return counters;
    }

    public ReputationLedger ledger() {
        return ledger;
    }

    private record CachedVerdict(Verdict verdict, long windowIndex, String ruleName, double threshold, boolean violating) {

        boolean answers(RateSnapshot rate, TrafficRule rule, long now) {
            return verdict.isValidAt(now)
                    && rate.bucketIndex() == windowIndex
                    && rule.name().equals(ruleName)
                    && (rate.effectiveRate() > threshold) == violating;
        }
    }
}

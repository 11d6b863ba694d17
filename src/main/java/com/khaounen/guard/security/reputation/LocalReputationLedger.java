package com.khaounen.guard.security.reputation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-instance ledger. Scores left untouched for {@code retention} are forgotten, which is the
 * same as having decayed back to neutral for any sane decay setting.
 */
public class LocalReputationLedger implements ReputationLedger {

    private final DecayFunction decay;
    private final Cache<String, ReputationRecord> scores;
    private final Cache<String, SyncRecord> syncStates;
    private final Map<String, IdentityOverride> overrides = new ConcurrentHashMap<>();

    public LocalReputationLedger(DecayFunction decay, Duration retention, long maximumIdentities) {
        if (decay == null) {
            throw new IllegalArgumentException("decay cannot be null");
        }
        this.decay = decay;
        this.scores = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(Math.max(1, maximumIdentities))
                .build();
        this.syncStates = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(Math.max(1, maximumIdentities))
                .build();
    }

    @Override
    public int read(String identity, long nowMillis) {
        ReputationRecord record = scores.getIfPresent(identity);
        if (record == null) {
            return ReputationScore.NEUTRAL;
        }
        return ReputationScore.report(record.decayedAt(decay, nowMillis));
    }

    @Override
    public int adjust(String identity, int delta, long nowMillis) {
        ReputationRecord updated = scores.asMap().compute(identity, (key, existing) -> {
            ReputationRecord base = existing != null ? existing : ReputationRecord.neutral(nowMillis);
            return base.adjusted(decay, delta, nowMillis);
        });
        return ReputationScore.report(updated.score());
    }

    @Override
    public Optional<IdentityOverride> activeOverride(String identity, long nowMillis) {
        IdentityOverride override = overrides.get(identity);
        if (override == null) {
            return Optional.empty();
        }
        if (!override.isActive(nowMillis)) {
            overrides.remove(identity, override);
            return Optional.empty();
        }
        return Optional.of(override);
    }

    @Override
    public void setOverride(IdentityOverride override) {
        overrides.put(override.identity(), override);
    }

    @Override
    public Optional<IdentityOverride> clearOverride(String identity) {
        return Optional.ofNullable(overrides.remove(identity));
    }

    @Override
    public List<IdentityOverride> listOverrides(long nowMillis) {
        overrides.values().removeIf(override -> !override.isActive(nowMillis));
        return overrides.values().stream()
                .sorted(Comparator.comparing(IdentityOverride::identity))
                .collect(Collectors.toList());
    }

    @Override
    public void markSync(String identity, SyncRecord record) {
        syncStates.put(identity, record);
    }

    @Override
    public Optional<SyncRecord> syncState(String identity) {
        return Optional.ofNullable(syncStates.getIfPresent(identity));
    }
}

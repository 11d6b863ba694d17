package com.khaounen.guard.security.reputation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.security.store.StoreCommandExecutor;
import com.khaounen.guard.security.store.StoreKeys;
import com.khaounen.guard.security.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ledger shared through Redis: {@code rep:{identity}} holds the score and its last-update time,
 * {@code ovr:{identity}} the override, {@code sync:{identity}} the last edge sync outcome.
 *
 * <p>Score updates read, adjust, then write through a compare-and-set script, retrying when another
 * instance wrote in between, so two instances adjusting the same identity never overwrite each
 * other's delta.
 */
@Slf4j
public class RedisReputationLedger implements ReputationLedger {

    private static final String COMPONENT = "reputation";
    static final int MAX_CAS_ATTEMPTS = 8;

    // writes ARGV[2] only if the key still holds ARGV[1] ('' for absent)
    private static final DefaultRedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "if (redis.call('GET', KEYS[1]) or '') ~= ARGV[1] then "
                    + "return 0 "
                    + "end "
                    + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
                    + "return 1",
            Long.class
    );

    private final StringRedisTemplate redis;
    private final StoreCommandExecutor executor;
    private final ObjectMapper objectMapper;
    private final DecayFunction decay;
    private final Duration retention;

    public RedisReputationLedger(
            StringRedisTemplate redis,
            StoreCommandExecutor executor,
            ObjectMapper objectMapper,
            DecayFunction decay,
            Duration retention
    ) {
        this.redis = redis;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.decay = decay;
        this.retention = retention;
    }

    @Override
    public int read(String identity, long nowMillis) {
        String raw = executor.call(COMPONENT, () -> redis.opsForValue().get(StoreKeys.reputation(identity)));
        if (raw == null) {
            return ReputationScore.NEUTRAL;
        }
        return ReputationScore.report(readValue(raw, ReputationRecord.class).decayedAt(decay, nowMillis));
    }

    @Override
    public int adjust(String identity, int delta, long nowMillis) {
        String key = StoreKeys.reputation(identity);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<ReputationRecord> written = executor.call(COMPONENT, () -> compareAndAdjust(key, delta, nowMillis));
            if (written.isPresent()) {
                return ReputationScore.report(written.get().score());
            }
            log.debug("reputation update for {} lost a race, attempt {}", identity, attempt);
        }
        throw new StoreUnavailableException(COMPONENT, "too much contention updating " + key);
    }

    private Optional<ReputationRecord> compareAndAdjust(String key, int delta, long nowMillis) {
        String raw = redis.opsForValue().get(key);
        ReputationRecord current = raw == null
                ? ReputationRecord.neutral(nowMillis)
                : readValue(raw, ReputationRecord.class);
        ReputationRecord next = current.adjusted(decay, delta, nowMillis);
        Long swapped = redis.execute(
                COMPARE_AND_SET,
                List.of(key),
                raw == null ? "" : raw,
                writeValue(next),
                String.valueOf(retention.toMillis())
        );
        return Long.valueOf(1L).equals(swapped) ? Optional.of(next) : Optional.empty();
    }

    @Override
    public Optional<IdentityOverride> activeOverride(String identity, long nowMillis) {
        String raw = executor.call(COMPONENT, () -> redis.opsForValue().get(StoreKeys.override(identity)));
        if (raw == null) {
            return Optional.empty();
        }
        IdentityOverride override = readValue(raw, IdentityOverride.class);
        return override.isActive(nowMillis) ? Optional.of(override) : Optional.empty();
    }

    @Override
    public void setOverride(IdentityOverride override) {
        String key = StoreKeys.override(override.identity());
        String json = writeValue(override);
        executor.run(COMPONENT, () -> {
            redis.opsForValue().set(key, json);
            if (override.expiresAt() != null) {
                redis.expireAt(key, new Date(override.expiresAt()));
            }
            redis.opsForSet().add(StoreKeys.OVERRIDE_INDEX, override.identity());
        });
    }

    @Override
    public Optional<IdentityOverride> clearOverride(String identity) {
        String key = StoreKeys.override(identity);
        String raw = executor.call(COMPONENT, () -> redis.opsForValue().getAndDelete(key));
        executor.run(COMPONENT, () -> redis.opsForSet().remove(StoreKeys.OVERRIDE_INDEX, identity));
        return raw == null ? Optional.empty() : Optional.of(readValue(raw, IdentityOverride.class));
    }

    @Override
    public List<IdentityOverride> listOverrides(long nowMillis) {
        Set<String> members = executor.call(COMPONENT, () -> redis.opsForSet().members(StoreKeys.OVERRIDE_INDEX));
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<String> identities = new ArrayList<>(members);
        List<String> keys = identities.stream().map(StoreKeys::override).toList();
        List<String> values = executor.call(COMPONENT, () -> redis.opsForValue().multiGet(keys));
        List<IdentityOverride> active = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (int i = 0; i < identities.size(); i++) {
            String raw = values == null ? null : values.get(i);
            IdentityOverride override = raw == null ? null : readValue(raw, IdentityOverride.class);
            if (override != null && override.isActive(nowMillis)) {
                active.add(override);
            } else {
                stale.add(identities.get(i));
            }
        }
        if (!stale.isEmpty()) {
            executor.run(COMPONENT, () -> redis.opsForSet().remove(StoreKeys.OVERRIDE_INDEX, stale.toArray()));
        }
        active.sort(Comparator.comparing(IdentityOverride::identity));
        return active;
    }

    @Override
    public void markSync(String identity, SyncRecord record) {
        String json = writeValue(record);
        executor.run(COMPONENT, () -> redis.opsForValue().set(StoreKeys.sync(identity), json, retention));
    }

    @Override
    public Optional<SyncRecord> syncState(String identity) {
        String raw = executor.call(COMPONENT, () -> redis.opsForValue().get(StoreKeys.sync(identity)));
        return raw == null ? Optional.empty() : Optional.of(readValue(raw, SyncRecord.class));
    }

    private <T> T readValue(String raw, Class<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException ex) {
            throw new StoreUnavailableException(COMPONENT, "unreadable " + type.getSimpleName(), ex);
        }
    }

    private String writeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("cannot serialize " + value.getClass().getSimpleName(), ex);
        }
    }
}

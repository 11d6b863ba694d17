package com.khaounen.guard.security.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.security.store.StoreCommandExecutor;
import com.khaounen.guard.security.store.StoreKeys;
import com.khaounen.guard.security.store.StoreUnavailableException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Ladder state as JSON under {@code st:{identity}}; the lease is {@code lease:{identity}} taken with
 * SET NX PX and released with a compare-and-delete script.
 */
public class RedisDecisionStateStore implements DecisionStateStore {

    private static final String COMPONENT = "state";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) "
                    + "end "
                    + "return 0",
            Long.class
    );

    private final StringRedisTemplate redis;
    private final StoreCommandExecutor executor;
    private final ObjectMapper objectMapper;
    private final Duration retention;

    public RedisDecisionStateStore(
            StringRedisTemplate redis,
            StoreCommandExecutor executor,
            ObjectMapper objectMapper,
            Duration retention
    ) {
        this.redis = redis;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.retention = retention;
    }

    @Override
    public Optional<IdentityState> load(String identity) {
        String raw = executor.call(COMPONENT, () -> redis.opsForValue().get(StoreKeys.state(identity)));
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, IdentityState.class));
        } catch (JsonProcessingException ex) {
            throw new StoreUnavailableException(COMPONENT, "unreadable state for " + identity, ex);
        }
    }

    @Override
    public void save(String identity, IdentityState state) {
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("cannot serialize state for " + identity, ex);
        }
        executor.run(COMPONENT, () -> redis.opsForValue().set(StoreKeys.state(identity), json, retention));
    }

    @Override
    public void delete(String identity) {
        executor.run(COMPONENT, () -> redis.delete(StoreKeys.state(identity)));
    }

    @Override
    public boolean tryAcquireLease(String identity, String owner, long leaseMillis) {
        Boolean acquired = executor.call(COMPONENT, () -> redis.opsForValue()
                .setIfAbsent(StoreKeys.lease(identity), owner, Duration.ofMillis(leaseMillis)));
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public void releaseLease(String identity, String owner) {
        executor.run(COMPONENT, () -> redis.execute(RELEASE_SCRIPT, List.of(StoreKeys.lease(identity)), owner));
    }
}

package com.khaounen.guard.security.counter;

import com.khaounen.guard.security.store.StoreCommandExecutor;
import com.khaounen.guard.security.store.StoreKeys;
import com.khaounen.guard.security.store.StoreUnavailableException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Counter store shared by every instance through Redis. Each bucket is its own key with a
 * {@code 2 x window} expiry, so stale buckets clean themselves up. An identity's buckets share a
 * hash tag, so the increment script stays on one cluster slot.
 */
public class RedisCounterStore implements CounterStore {

    private static final String COMPONENT = "counter";

    // replies "current:previous" as stored, so counts never pass through Lua numbers
    private static final String INCREMENT_SCRIPT =
            "redis.call('INCRBY', KEYS[1], ARGV[1]) " +
            "if redis.call('PTTL', KEYS[1]) < 0 then " +
            "  redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
            "end " +
            "return redis.call('GET', KEYS[1]) .. ':' .. (redis.call('GET', KEYS[2]) or '0')";

    private static final DefaultRedisScript<String> INCREMENT = new DefaultRedisScript<>(INCREMENT_SCRIPT, String.class);

    private final StringRedisTemplate redis;
    private final StoreCommandExecutor executor;
    private final long windowSeconds;
    private final long windowMillis;
    private final long bucketTtlMillis;

    public RedisCounterStore(StringRedisTemplate redis, StoreCommandExecutor executor, long windowSeconds) {
        if (redis == null) {
            throw new IllegalArgumentException("redis cannot be null");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0");
        }
        this.redis = redis;
        this.executor = executor;
        this.windowSeconds = windowSeconds;
        this.windowMillis = TimeUnit.SECONDS.toMillis(windowSeconds);
        this.bucketTtlMillis = windowMillis * 2;
    }

    @Override
    public RateSnapshot increment(String identity, long weight, long nowMillis) {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        String reply = executor.call(COMPONENT, () -> redis.execute(
                INCREMENT,
                List.of(key(identity, bucket), key(identity, bucket - 1)),
                String.valueOf(weight),
                String.valueOf(bucketTtlMillis)
        ));
        long[] counts = parseCounts(reply);
        return RateSnapshot.of(identity, windowMillis, counts[0], counts[1], nowMillis, false);
    }

    @Override
    public RateSnapshot peek(String identity, long nowMillis) {
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        List<String> values = executor.call(COMPONENT, () -> redis.opsForValue()
                .multiGet(List.of(key(identity, bucket), key(identity, bucket - 1))));
        long current = parse(values, 0);
        long previous = parse(values, 1);
        return RateSnapshot.of(identity, windowMillis, current, previous, nowMillis, false);
    }

    @Override
    public void reset(String identity, long nowMillis) {
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        executor.run(COMPONENT, () -> redis.delete(List.of(key(identity, bucket), key(identity, bucket - 1))));
    }

    @Override
    public long windowMillis() {
        return windowMillis;
    }

    private String key(String identity, long bucket) {
        return StoreKeys.counter(windowSeconds, identity, bucket);
    }

    static long[] parseCounts(String reply) {
        int separator = reply == null ? -1 : reply.indexOf(':');
        if (separator < 0) {
            throw new StoreUnavailableException(COMPONENT, "unexpected increment reply: " + reply);
        }
        try {
            return new long[] {
                    Long.parseLong(reply.substring(0, separator)),
                    Long.parseLong(reply.substring(separator + 1))
            };
        } catch (NumberFormatException ex) {
            throw new StoreUnavailableException(COMPONENT, "unexpected increment reply: " + reply, ex);
        }
    }

    private static long parse(List<String> values, int index) {
        if (values == null || values.size() <= index || values.get(index) == null) {
            return 0L;
        }
        return Long.parseLong(values.get(index));
    }
}

package com.khaounen.guard.security.counter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.khaounen.guard.security.store.StoreKeys;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-instance counter store. Used when no shared store is configured and as the degraded
 * fallback while the shared store is unreachable.
 */
public class LocalCounterStore implements CounterStore {

    private final long windowSeconds;
    private final long windowMillis;
    private final long bucketTtlNanos;
    private final Cache<String, Bucket> buckets;

    public LocalCounterStore(long windowSeconds, long maximumBuckets) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0");
        }
        this.windowSeconds = windowSeconds;
        this.windowMillis = TimeUnit.SECONDS.toMillis(windowSeconds);
        this.bucketTtlNanos = TimeUnit.SECONDS.toNanos(windowSeconds * 2);
        this.buckets = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumBuckets))
                .expireAfter(new BucketExpiry())
                .build();
    }

    @Override
    public RateSnapshot increment(String identity, long weight, long nowMillis) {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        Bucket current = buckets.asMap().compute(key(identity, bucket), (key, existing) -> {
            if (existing == null) {
                return new Bucket(weight, bucketTtlNanos);
            }
            existing.count.accumulateAndGet(weight, LocalCounterStore::saturatedAdd);
            return existing;
        });
        return RateSnapshot.of(identity, windowMillis, current.count.get(), count(identity, bucket - 1),
                nowMillis, false);
    }

    private static long saturatedAdd(long count, long weight) {
        long sum = count + weight;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    @Override
    public RateSnapshot peek(String identity, long nowMillis) {
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        return RateSnapshot.of(identity, windowMillis, count(identity, bucket), count(identity, bucket - 1),
                nowMillis, false);
    }

    @Override
    public void reset(String identity, long nowMillis) {
        long bucket = RateSnapshot.bucketIndex(nowMillis, windowMillis);
        buckets.invalidate(key(identity, bucket));
        buckets.invalidate(key(identity, bucket - 1));
    }

    @Override
    public long windowMillis() {
        return windowMillis;
    }

    private long count(String identity, long bucket) {
        Bucket found = buckets.getIfPresent(key(identity, bucket));
        return found == null ? 0L : found.count.get();
    }

    private String key(String identity, long bucket) {
        return StoreKeys.counter(windowSeconds, identity, bucket);
    }

    private static final class Bucket {
        private final AtomicLong count;
        private final long ttlNanos;

        private Bucket(long count, long ttlNanos) {
            this.count = new AtomicLong(count);
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class BucketExpiry implements Expiry<String, Bucket> {
        @Override
        public long expireAfterCreate(String key, Bucket value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Bucket value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, Bucket value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

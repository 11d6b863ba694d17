package com.khaounen.guard.security.counter;

/**
 * Point-in-time view of an identity's traffic over the rolling window.
 *
 * @param identity      identity key
 * @param windowMillis  length of the rolling window
 * @param bucketIndex   index of the bucket containing {@code takenAtMillis}
 * @param currentCount  weighted count of the current, partial bucket
 * @param previousCount weighted count of the immediately preceding bucket
 * @param effectiveRate approximate weighted count over the last window
 * @param takenAtMillis instant the snapshot describes
 * @param degraded      true when served by a per-instance fallback instead of the shared store
 */
public record RateSnapshot(
        String identity,
        long windowMillis,
        long bucketIndex,
        long currentCount,
        long previousCount,
        double effectiveRate,
        long takenAtMillis,
        boolean degraded
) {

    public static RateSnapshot of(
            String identity,
            long windowMillis,
            long currentCount,
            long previousCount,
            long nowMillis,
            boolean degraded
    ) {
        long bucket = bucketIndex(nowMillis, windowMillis);
        return new RateSnapshot(
                identity,
                windowMillis,
                bucket,
                currentCount,
                previousCount,
                effectiveRate(currentCount, previousCount, windowMillis, nowMillis),
                nowMillis,
                degraded
        );
    }

    /**
     * Current bucket plus the share of the previous bucket still covered by the rolling window.
     * Exact for uniform traffic; the error grows with how unevenly the previous bucket was filled.
     */
    public static double effectiveRate(long currentCount, long previousCount, long windowMillis, long nowMillis) {
        long elapsed = Math.floorMod(nowMillis, windowMillis);
        double previousWeight = 1.0 - ((double) elapsed / windowMillis);
        return currentCount + previousCount * previousWeight;
    }

    public static long bucketIndex(long nowMillis, long windowMillis) {
        return Math.floorDiv(nowMillis, windowMillis);
    }

    public long windowResetAtMillis() {
        return (bucketIndex + 1) * windowMillis;
    }

    public long remaining(long limit) {
        return Math.max(0L, limit - (long) Math.ceil(effectiveRate));
    }

    public RateSnapshot asDegraded() {
        if (degraded) {
            return this;
        }
        return new RateSnapshot(identity, windowMillis, bucketIndex, currentCount, previousCount,
                effectiveRate, takenAtMillis, true);
    }

    public static RateSnapshot empty(String identity, long windowMillis, long nowMillis) {
        return of(identity, windowMillis, 0L, 0L, nowMillis, false);
    }
}

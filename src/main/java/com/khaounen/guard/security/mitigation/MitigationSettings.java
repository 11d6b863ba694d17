package com.khaounen.guard.security.mitigation;

import java.time.Duration;

/**
 * @param maxAttempts          edge calls per notification before it is recorded as failed
 * @param sweepInterval        how often rules whose TTL elapsed are removed from the edge
 * @param maxTrackedIdentities identities whose last applied generation is remembered
 * @param appliedRetention     how long a last applied generation is remembered; no longer than the
 *                             decision state it was numbered from
 */
public record MitigationSettings(
        Duration initialBackoff,
        Duration maxBackoff,
        int maxAttempts,
        Duration sweepInterval,
        Duration pollInterval,
        long maxTrackedIdentities,
        Duration appliedRetention
) {

    public MitigationSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
        if (maxTrackedIdentities < 1) {
            throw new IllegalArgumentException("maxTrackedIdentities must be >= 1");
        }
        if (appliedRetention.isNegative() || appliedRetention.isZero()) {
            throw new IllegalArgumentException("appliedRetention must be positive");
        }
    }

    public static MitigationSettings defaults() {
        return new MitigationSettings(Duration.ofMillis(200), Duration.ofSeconds(10), 5,
                Duration.ofSeconds(30), Duration.ofMillis(500), 100_000, Duration.ofHours(24));
    }

    /**
     * Delay before attempt {@code attempt + 1}, doubling from the initial backoff.
     */
    public long backoffMillis(int attempt) {
        long delay = initialBackoff.toMillis();
        for (int i = 1; i < attempt && delay < maxBackoff.toMillis(); i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoff.toMillis());
    }
}

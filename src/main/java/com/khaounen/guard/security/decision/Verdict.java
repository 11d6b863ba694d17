package com.khaounen.guard.security.decision;

import java.time.Duration;

/**
 * Decision for an identity at a point in time.
 *
 * @param duration   how long the restriction lasts, zero for {@link VerdictKind#ALLOW}
 * @param issuedAt   epoch millis the verdict was computed
 * @param expiresAt  epoch millis after which it must be recomputed
 * @param generation block generation of the identity when issued
 */
public record Verdict(
        VerdictKind kind,
        Duration duration,
        ReasonCode reason,
        EnforcementState state,
        long issuedAt,
        long expiresAt,
        long generation
) {

    public Verdict {
        duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
    }

    public static Verdict allow(ReasonCode reason, EnforcementState state, long nowMillis, long expiresAt) {
        return new Verdict(VerdictKind.ALLOW, Duration.ZERO, reason, state, nowMillis, expiresAt, 0L);
    }

    public static Verdict throttle(Duration duration, ReasonCode reason, long nowMillis, long expiresAt) {
        return new Verdict(VerdictKind.THROTTLE, duration, reason, EnforcementState.THROTTLED, nowMillis, expiresAt, 0L);
    }

    public boolean isValidAt(long nowMillis) {
        return nowMillis < expiresAt;
    }

    public boolean allowed() {
        return kind == VerdictKind.ALLOW;
    }

    public long retryAfterSeconds() {
        long millis = duration.toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }

    public Verdict withReason(ReasonCode newReason) {
        if (newReason == reason) {
            return this;
        }
        return new Verdict(kind, duration, newReason, state, issuedAt, expiresAt, generation);
    }
}

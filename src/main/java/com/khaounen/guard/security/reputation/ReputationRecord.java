package com.khaounen.guard.security.reputation;

/**
 * Stored form of a score: the exact value and when it was last written.
 */
public record ReputationRecord(double score, long updatedAt) {

    public static ReputationRecord neutral(long nowMillis) {
        return new ReputationRecord(ReputationScore.NEUTRAL, nowMillis);
    }

    public double decayedAt(DecayFunction decay, long nowMillis) {
        return decay.decay(score, Math.max(0L, nowMillis - updatedAt));
    }

    public ReputationRecord adjusted(DecayFunction decay, int delta, long nowMillis) {
        double base = decayedAt(decay, nowMillis);
        return new ReputationRecord(ReputationScore.clamp(base + delta), Math.max(nowMillis, updatedAt));
    }
}

package com.khaounen.guard.security.reputation;

/**
 * Bounds of the trust score. Negative is distrusted, positive is trusted.
 */
public final class ReputationScore {

    public static final int MIN_SCORE = -100;
    public static final int MAX_SCORE = 100;
    public static final int NEUTRAL = 0;

    private ReputationScore() {
    }

    public static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    /**
     * Integer view of a stored score, rounded toward neutral so a reported value never sits on the
     * far side of where the exact value is.
     */
    public static int report(double score) {
        return (int) clamp(score);
    }
}

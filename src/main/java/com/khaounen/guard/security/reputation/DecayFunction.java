package com.khaounen.guard.security.reputation;

import java.time.Duration;

/**
 * Pulls a score toward {@link ReputationScore#NEUTRAL} as time passes. Implementations are
 * deterministic in the elapsed time, never increase the distance to neutral and never cross it.
 */
@FunctionalInterface
public interface DecayFunction {

    double decay(double score, long elapsedMillis);

    static DecayFunction linear(double pointsPerMinute) {
        if (pointsPerMinute <= 0) {
            throw new IllegalArgumentException("pointsPerMinute must be > 0");
        }
        return (score, elapsedMillis) -> {
            if (elapsedMillis <= 0) {
                return score;
            }
            double distance = Math.abs(score - ReputationScore.NEUTRAL);
            double remaining = Math.max(0.0, distance - pointsPerMinute * elapsedMillis / 60_000.0);
            return ReputationScore.NEUTRAL + Math.signum(score - ReputationScore.NEUTRAL) * remaining;
        };
    }

    static DecayFunction exponential(Duration halfLife) {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("halfLife must be positive");
        }
        double halfLifeMillis = halfLife.toMillis();
        return (score, elapsedMillis) -> {
            if (elapsedMillis <= 0) {
                return score;
            }
            double factor = Math.pow(0.5, elapsedMillis / halfLifeMillis);
            return ReputationScore.NEUTRAL + (score - ReputationScore.NEUTRAL) * factor;
        };
    }
}

package com.khaounen.guard.security.decision;

import java.time.Duration;

/**
 * Hysteresis settings of the enforcement ladder.
 *
 * @param watchAfterWindows       violating windows before Clean becomes Watched
 * @param promoteAfterWindows     consecutive violating windows for every later promotion
 * @param demoteAfterCleanWindows consecutive clean windows that return an identity to Clean
 * @param fastPathMultiple        rate multiple of the threshold that jumps straight to Blocked,
 *                                zero or less disables the fast path
 */
public record LadderPolicy(
        int watchAfterWindows,
        int promoteAfterWindows,
        int demoteAfterCleanWindows,
        Duration throttleHold,
        Duration challengeHold,
        Duration blockHold,
        double fastPathMultiple
) {

    public LadderPolicy {
        if (watchAfterWindows < 1 || promoteAfterWindows < 1 || demoteAfterCleanWindows < 1) {
            throw new IllegalArgumentException("ladder window counts must be >= 1");
        }
        if (fastPathMultiple > 0 && fastPathMultiple <= 1.0) {
            throw new IllegalArgumentException("fast path multiple must be > 1");
        }
    }

    public static LadderPolicy defaults() {
        return new LadderPolicy(1, 3, 4, Duration.ofMinutes(10), Duration.ofMinutes(15),
                Duration.ofHours(1), 10.0);
    }

    public boolean fastPathEnabled() {
        return fastPathMultiple > 0;
    }

    public Duration holdFor(EnforcementState state) {
        switch (state) {
            case THROTTLED:
                return throttleHold;
            case CHALLENGED:
                return challengeHold;
            case BLOCKED:
                return blockHold;
            default:
                return Duration.ZERO;
        }
    }
}

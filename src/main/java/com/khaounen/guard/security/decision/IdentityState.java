package com.khaounen.guard.security.decision;

import lombok.Data;

/**
 * Ladder position and streak bookkeeping for one identity. Stored as JSON in the shared store,
 * hence mutable with a no-args constructor.
 */
@Data
public class IdentityState {

    private EnforcementState state = EnforcementState.CLEAN;
    /** Window the streak counters were last updated for, -1 before the first evaluation. */
    private long windowIndex = -1L;
    private boolean windowViolated;
    private int violationStreak;
    private int cleanStreak;
    private long holdUntil;
    /** Bumped on every entry into or exit from a blocking state. */
    private long generation;
    private ReasonCode lastReason = ReasonCode.WITHIN_LIMITS;
    private long updatedAt;

    public IdentityState copy() {
        IdentityState copy = new IdentityState();
        copy.setState(state);
        copy.setWindowIndex(windowIndex);
        copy.setWindowViolated(windowViolated);
        copy.setViolationStreak(violationStreak);
        copy.setCleanStreak(cleanStreak);
        copy.setHoldUntil(holdUntil);
        copy.setGeneration(generation);
        copy.setLastReason(lastReason);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}

package com.khaounen.guard.security.decision;

/**
 * Ladder rungs, least strict first, plus the two override states that sit outside the ladder.
 */
public enum EnforcementState {
    CLEAN(0),
    WATCHED(1),
    THROTTLED(2),
    CHALLENGED(3),
    BLOCKED(4),
    WHITELISTED(-1),
    BLACKLISTED(5);

    private final int severity;

    EnforcementState(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isOnLadder() {
        return this != WHITELISTED && this != BLACKLISTED;
    }

    /**
     * Rungs that restrict traffic and carry a hold duration.
     */
    public boolean isEnforcing() {
        return this == THROTTLED || this == CHALLENGED || this == BLOCKED;
    }

    public boolean isBlocking() {
        return this == BLOCKED || this == BLACKLISTED;
    }

    public EnforcementState stricter() {
        switch (this) {
            case CLEAN:
                return WATCHED;
            case WATCHED:
                return THROTTLED;
            case THROTTLED:
                return CHALLENGED;
            case CHALLENGED:
            case BLOCKED:
                return BLOCKED;
            default:
                throw new IllegalStateException(this + " is not on the ladder");
        }
    }

    public EnforcementState lenient() {
        switch (this) {
            case BLOCKED:
                return CHALLENGED;
            case CHALLENGED:
                return THROTTLED;
            case THROTTLED:
                return WATCHED;
            case WATCHED:
            case CLEAN:
                return CLEAN;
            default:
                throw new IllegalStateException(this + " is not on the ladder");
        }
    }
}

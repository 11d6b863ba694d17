package com.khaounen.guard.security.decision;

public enum ReasonCode {
    WITHIN_LIMITS,
    WATCHED,
    RATE_EXCEEDED,
    SUSTAINED_RATE,
    EXTREME_RATE,
    HOLDING,
    HOLD_EXPIRED,
    RECOVERED,
    WHITELISTED,
    BLACKLISTED,
    GRACE,
    FAIL_OPEN,
    FAIL_CLOSED;

    static ReasonCode steadyState(EnforcementState state) {
        switch (state) {
            case CLEAN:
                return WITHIN_LIMITS;
            case WATCHED:
                return WATCHED;
            case WHITELISTED:
                return WHITELISTED;
            case BLACKLISTED:
                return BLACKLISTED;
            default:
                return HOLDING;
        }
    }
}

package com.khaounen.guard.security.decision;

public enum VerdictKind {
    ALLOW,
    THROTTLE,
    CHALLENGE,
    BLOCK
}

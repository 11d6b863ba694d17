package com.khaounen.guard.security.reputation;

public enum OverrideKind {
    WHITELIST,
    BLACKLIST
}

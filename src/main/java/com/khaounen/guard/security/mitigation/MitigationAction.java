package com.khaounen.guard.security.mitigation;

public enum MitigationAction {
    UPSERT,
    REMOVE
}

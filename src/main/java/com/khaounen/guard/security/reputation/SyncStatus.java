package com.khaounen.guard.security.reputation;

public enum SyncStatus {
    PENDING,
    SYNCED,
    FAILED
}

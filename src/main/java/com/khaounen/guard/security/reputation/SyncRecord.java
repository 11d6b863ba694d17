package com.khaounen.guard.security.reputation;

/**
 * Outcome of mirroring an identity's block state to the edge.
 */
public record SyncRecord(long generation, String action, SyncStatus status, long updatedAt, String detail) {
}

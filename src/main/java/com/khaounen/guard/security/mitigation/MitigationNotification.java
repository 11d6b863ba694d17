package com.khaounen.guard.security.mitigation;

import java.time.Duration;

/**
 * Request to mirror a block state change to the edge.
 *
 * @param ttl        lifetime of the edge rule, {@code null} for a rule without expiry; ignored for
 *                   {@link MitigationAction#REMOVE}
 * @param generation block generation of the identity the change belongs to
 */
public record MitigationNotification(
        String identity,
        MitigationAction action,
        Duration ttl,
        long generation,
        String reason,
        long createdAt
) {

    public MitigationNotification {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be empty");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
    }

    public static MitigationNotification upsert(String identity, Duration ttl, long generation, String reason, long createdAt) {
        return new MitigationNotification(identity, MitigationAction.UPSERT, ttl, generation, reason, createdAt);
    }

    public static MitigationNotification remove(String identity, long generation, String reason, long createdAt) {
        return new MitigationNotification(identity, MitigationAction.REMOVE, null, generation, reason, createdAt);
    }

    /**
     * Idempotency key: the same transition reported twice maps to the same key.
     */
    public String dedupeKey() {
        return identity + "#" + generation + "#" + action;
    }
}

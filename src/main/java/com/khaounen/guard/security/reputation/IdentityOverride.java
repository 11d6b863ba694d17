package com.khaounen.guard.security.reputation;

/**
 * Operator-set allow or deny record. Authoritative over computed state while active.
 *
 * @param expiresAt epoch millis after which the override no longer applies, {@code null} for never
 */
public record IdentityOverride(
        String identity,
        OverrideKind kind,
        Long expiresAt,
        long createdAt,
        String reason
) {

    public IdentityOverride {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }

    public boolean isActive(long nowMillis) {
        return expiresAt == null || expiresAt > nowMillis;
    }

    public long remainingMillis(long nowMillis) {
        if (expiresAt == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, expiresAt - nowMillis);
    }
}

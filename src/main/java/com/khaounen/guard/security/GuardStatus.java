package com.khaounen.guard.security;

import com.khaounen.guard.security.counter.RateSnapshot;
import com.khaounen.guard.security.decision.EnforcementState;
import com.khaounen.guard.security.decision.Verdict;
import com.khaounen.guard.security.reputation.IdentityOverride;
import com.khaounen.guard.security.reputation.SyncRecord;

/**
 * Read-only view of one identity.
 *
 * @param limit     threshold of the default rule
 * @param remaining weighted requests left in the current window under that limit
 * @param override  active override, {@code null} if none
 * @param sync      last edge sync outcome, {@code null} if the identity was never synced
 */
public record GuardStatus(
        String identity,
        int score,
        Verdict verdict,
        EnforcementState state,
        RateSnapshot rate,
        long limit,
        long remaining,
        long windowResetAt,
        IdentityOverride override,
        SyncRecord sync
) {
}

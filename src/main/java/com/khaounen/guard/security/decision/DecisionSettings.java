package com.khaounen.guard.security.decision;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the {@link DecisionEngine}. The failure policy has no default and must be chosen.
 */
@Value
@Builder
public class DecisionSettings {

    @Builder.Default
    LadderPolicy ladder = LadderPolicy.defaults();
    /** How strongly reputation stretches or shrinks the threshold, 0 disables it. */
    @Builder.Default
    double reputationWeight = 0.5;
    @Builder.Default
    int penaltyPerSeverity = 5;
    @Builder.Default
    int recoveryReward = 5;
    @Builder.Default
    Duration verdictTtl = Duration.ofSeconds(5);
    @Builder.Default
    Duration grace = Duration.ofSeconds(30);
    @Builder.Default
    Duration lease = Duration.ofMillis(250);
    @Builder.Default
    Duration lockWait = Duration.ofMillis(100);
    DecisionFailurePolicy failurePolicy;
    @Builder.Default
    Duration failClosedThrottle = Duration.ofSeconds(60);
    /** Block duration reported for a blacklist without expiry. */
    @Builder.Default
    Duration blacklistBlock = Duration.ofHours(1);
    @Builder.Default
    long maximumIdentities = 100_000L;

    public void validate() {
        if (failurePolicy == null) {
            throw new IllegalStateException("a decision failure policy must be configured");
        }
        if (reputationWeight < 0 || reputationWeight > 1) {
            throw new IllegalStateException("reputation weight must be within [0, 1]");
        }
    }
}

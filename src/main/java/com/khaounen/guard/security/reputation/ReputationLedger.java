package com.khaounen.guard.security.reputation;

import java.util.List;
import java.util.Optional;

/**
 * Decaying trust score per identity plus explicit overrides.
 *
 * <p>Scores decay lazily: {@link #read} and {@link #adjust} apply the decay accumulated since the
 * last write, no background sweep is involved. Reported scores always lie within
 * [{@link ReputationScore#MIN_SCORE}, {@link ReputationScore#MAX_SCORE}].
 */
public interface ReputationLedger {

    int read(String identity, long nowMillis);

    /**
     * Applies decay, then the delta, then clamps. Safe under concurrent writers.
     *
     * @return the new score
     */
    int adjust(String identity, int delta, long nowMillis);

    Optional<IdentityOverride> activeOverride(String identity, long nowMillis);

    void setOverride(IdentityOverride override);

    /**
     * @return the removed override, if one was present
     */
    Optional<IdentityOverride> clearOverride(String identity);

    List<IdentityOverride> listOverrides(long nowMillis);

    void markSync(String identity, SyncRecord record);

    Optional<SyncRecord> syncState(String identity);
}

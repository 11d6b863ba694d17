package com.khaounen.guard.security.decision;

import java.util.Optional;

/**
 * Shared ladder state per identity plus the short-lived recomputation lease.
 */
public interface DecisionStateStore {

    Optional<IdentityState> load(String identity);

    void save(String identity, IdentityState state);

    void delete(String identity);

    /**
     * Takes the recomputation lease for {@code identity} unless another owner holds it.
     *
     * @return true when {@code owner} now holds the lease
     */
    boolean tryAcquireLease(String identity, String owner, long leaseMillis);

    /**
     * Releases the lease only if {@code owner} still holds it.
     */
    void releaseLease(String identity, String owner);
}

package com.khaounen.guard.security.store;

/**
 * What a store does while the shared backend is unreachable.
 */
public enum StoreFailurePolicy {
    /**
     * Serve from a per-instance approximate store until the backend answers again.
     */
    LOCAL_FALLBACK,
    /**
     * Propagate the failure and treat the identity as over its threshold: the decision engine
     * throttles regardless of its own failure policy.
     */
    FAIL_CLOSED
}

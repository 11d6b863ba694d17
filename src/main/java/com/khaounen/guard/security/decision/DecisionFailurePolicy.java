package com.khaounen.guard.security.decision;

/**
 * What the engine answers when no verdict can be computed and no recent one is available.
 */
public enum DecisionFailurePolicy {
    FAIL_OPEN,
    FAIL_CLOSED
}

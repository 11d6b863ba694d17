package com.khaounen.guard.security.mitigation;

import java.time.Duration;

/**
 * Edge enforcement point. Both operations must be idempotent: upserting an existing rule or
 * removing a missing one succeeds without side effects.
 */
public interface EdgeFirewall {

    /**
     * @param ttl how long the rule should live, {@code null} for no expiry
     */
    void upsertBlockRule(String identity, Duration ttl) throws EdgeFirewallException;

    void removeBlockRule(String identity) throws EdgeFirewallException;

    /**
     * Loads whatever state the adapter needs from the edge before the first sync.
     */
    default void initialize() throws EdgeFirewallException {
    }
}

package com.khaounen.guard.security.mitigation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Used when no edge is configured: block changes are only logged.
 */
@Slf4j
public class LoggingEdgeFirewall implements EdgeFirewall {

    @Override
    public void upsertBlockRule(String identity, Duration ttl) {
        log.info("edge block for {} ({})", identity, ttl == null ? "no expiry" : ttl);
    }

    @Override
    public void removeBlockRule(String identity) {
        log.info("edge block lifted for {}", identity);
    }
}

package com.khaounen.guard.security.identity;

public enum IdentityMode {
    /**
     * Source address only.
     */
    ADDRESS,
    /**
     * Bearer token or authenticated principal when present, source address otherwise.
     */
    TOKEN_OR_ADDRESS,
    /**
     * Network prefix plus normalized user agent.
     */
    COMPOSITE
}

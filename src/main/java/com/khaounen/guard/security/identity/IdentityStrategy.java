package com.khaounen.guard.security.identity;

import jakarta.servlet.http.HttpServletRequest;

@FunctionalInterface
public interface IdentityStrategy {

    /**
     * @throws InvalidIdentityException when the request carries nothing to key on
     */
    ClientIdentity resolve(HttpServletRequest request);
}

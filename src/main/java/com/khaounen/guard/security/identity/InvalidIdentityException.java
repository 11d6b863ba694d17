package com.khaounen.guard.security.identity;

/**
 * An event or request carried no usable identity. Rejected before any state is touched.
 */
public class InvalidIdentityException extends IllegalArgumentException {

    public InvalidIdentityException(String message) {
        super(message);
    }
}

package com.khaounen.guard.security.mitigation;

public class EdgeFirewallException extends Exception {

    private final boolean retryable;

    public EdgeFirewallException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public EdgeFirewallException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

package com.khaounen.guard.security.store;

/**
 * Raised when the shared store cannot answer: connection failure, command error, timeout or a
 * saturated store executor. Callers route it through the configured failure policy.
 *
 * <p>{@link #isFailClosed()} marks failures raised under {@link StoreFailurePolicy#FAIL_CLOSED}:
 * the caller must treat the identity as over its threshold.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String component;
    private final boolean failClosed;

    public StoreUnavailableException(String component, String message, Throwable cause) {
        this(component, message, cause, false);
    }

    public StoreUnavailableException(String component, String message) {
        this(component, message, null, false);
    }

    private StoreUnavailableException(String component, String message, Throwable cause, boolean failClosed) {
        super(component + ": " + message, cause);
        this.component = component;
        this.failClosed = failClosed;
    }

    static StoreUnavailableException failingClosed(StoreUnavailableException cause) {
        if (cause.failClosed) {
            return cause;
        }
        return new StoreUnavailableException(cause.component, "failing closed", cause, true);
    }

    public String getComponent() {
        return component;
    }

    public boolean isFailClosed() {
        return failClosed;
    }
}

package com.khaounen.guard.security.mitigation;

/**
 * Observes sync outcomes. Called from the sync worker thread; failures are logged and ignored.
 */
public interface MitigationSyncListener {

    default void onSynced(MitigationNotification notification) {
    }

    default void onFailed(MitigationNotification notification, String error) {
    }
}

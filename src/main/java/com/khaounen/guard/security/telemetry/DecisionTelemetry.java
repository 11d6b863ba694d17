package com.khaounen.guard.security.telemetry;

import com.khaounen.guard.security.decision.Verdict;

import java.time.Duration;

/**
 * Observability sink for the decision path. Implementations must be fast and must never throw.
 */
public interface DecisionTelemetry {

    DecisionTelemetry NOOP = new DecisionTelemetry() {
    };

    default void verdict(Verdict verdict) {
    }

    default void decisionLatency(Duration elapsed) {
    }

    default void storeFailure(String component) {
    }

    default void mitigationSync(boolean success) {
    }

    default void intakeRejected(String cause) {
    }
}

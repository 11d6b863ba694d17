package com.khaounen.guard.security.telemetry;

import com.khaounen.guard.security.decision.EnforcementState;
import com.khaounen.guard.security.decision.ReasonCode;
import com.khaounen.guard.security.decision.Verdict;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MicrometerDecisionTelemetryTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerDecisionTelemetry telemetry = new MicrometerDecisionTelemetry(registry);

    @Test
    void countsVerdictsByKindAndReason() {
        telemetry.verdict(Verdict.allow(ReasonCode.WITHIN_LIMITS, EnforcementState.CLEAN, 0L, 5_000L));
        telemetry.verdict(Verdict.allow(ReasonCode.WITHIN_LIMITS, EnforcementState.CLEAN, 0L, 5_000L));
        telemetry.verdict(Verdict.throttle(Duration.ofMinutes(1), ReasonCode.FAIL_CLOSED, 0L, 0L));

        assertEquals(2.0, registry.get(MicrometerDecisionTelemetry.VERDICTS)
                .tags("kind", "ALLOW", "reason", "WITHIN_LIMITS").counter().count());
        assertEquals(1.0, registry.get(MicrometerDecisionTelemetry.VERDICTS)
                .tags("kind", "THROTTLE", "reason", "FAIL_CLOSED").counter().count());
    }

    @Test
    void recordsLatencyAndFailures() {
        telemetry.decisionLatency(Duration.ofMillis(3));
        telemetry.storeFailure("counter");
        telemetry.mitigationSync(true);
        telemetry.mitigationSync(false);
        telemetry.intakeRejected("saturated");

        assertEquals(1, registry.get(MicrometerDecisionTelemetry.LATENCY).timer().count());
        assertEquals(1.0, registry.get(MicrometerDecisionTelemetry.STORE_FAILURES)
                .tag("component", "counter").counter().count());
        assertEquals(1.0, registry.get(MicrometerDecisionTelemetry.MITIGATION_SYNC)
                .tag("outcome", "failure").counter().count());
        assertEquals(1.0, registry.get(MicrometerDecisionTelemetry.INTAKE_REJECTED)
                .tag("cause", "saturated").counter().count());
    }
}

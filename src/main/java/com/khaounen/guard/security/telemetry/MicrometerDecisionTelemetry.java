package com.khaounen.guard.security.telemetry;

import com.khaounen.guard.security.decision.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Slf4j
public class MicrometerDecisionTelemetry implements DecisionTelemetry {

    static final String VERDICTS = "abuse_guard.verdicts";
    static final String LATENCY = "abuse_guard.decision.latency";
    static final String STORE_FAILURES = "abuse_guard.store.failures";
    static final String MITIGATION_SYNC = "abuse_guard.mitigation.sync";
    static final String INTAKE_REJECTED = "abuse_guard.intake.rejected";

    private final MeterRegistry registry;
    private final Timer latency;

    public MicrometerDecisionTelemetry(MeterRegistry registry) {
        this.registry = registry;
        this.latency = Timer.builder(LATENCY)
                .description("Time spent producing a verdict")
                .publishPercentileHistogram()
                .register(registry);
    }

    @Override
    public void verdict(Verdict verdict) {
        try {
            Counter.builder(VERDICTS)
                    .description("Verdicts issued, by kind and reason")
                    .tag("kind", verdict.kind().name())
                    .tag("reason", verdict.reason().name())
                    .register(registry)
                    .increment();
        } catch (RuntimeException ex) {
            log.warn("failed to record verdict metric: {}", ex.getMessage());
        }
    }

    @Override
    public void decisionLatency(Duration elapsed) {
        try {
            latency.record(elapsed);
        } catch (RuntimeException ex) {
            log.warn("failed to record decision latency: {}", ex.getMessage());
        }
    }

    @Override
    public void storeFailure(String component) {
        increment(STORE_FAILURES, "component", component);
    }

    @Override
    public void mitigationSync(boolean success) {
        increment(MITIGATION_SYNC, "outcome", success ? "success" : "failure");
    }

    @Override
    public void intakeRejected(String cause) {
        increment(INTAKE_REJECTED, "cause", cause);
    }

    private void increment(String name, String tag, String value) {
        try {
            registry.counter(name, tag, value).increment();
        } catch (RuntimeException ex) {
            log.warn("failed to record {}: {}", name, ex.getMessage());
        }
    }
}

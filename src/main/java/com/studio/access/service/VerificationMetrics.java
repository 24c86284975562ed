package com.studio.access.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for verification outcomes and for door events that could not be
 * written. A non-zero {@code door.access.trigger.failures} means someone was let through
 * on paper but the door stayed shut.
 */
@Component
public class VerificationMetrics {

    static final String VERIFICATIONS = "door.access.verifications";
    static final String TRIGGER_FAILURES = "door.access.trigger.failures";

    public static final String SUCCESS = "success";
    public static final String REJECTED = "rejected";
    public static final String NOT_FOUND = "not_found";
    public static final String BAD_REQUEST = "bad_request";
    public static final String INFRA_ERROR = "infra_error";

    private final MeterRegistry registry;
    private final Counter triggerFailures;
    private final ConcurrentHashMap<String, Counter> outcomes = new ConcurrentHashMap<>();

    public VerificationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.triggerFailures = Counter.builder(TRIGGER_FAILURES)
            .description("Verified secrets whose door-open event could not be recorded")
            .register(registry);
    }

    public void recordOutcome(String outcome) {
        outcomes.computeIfAbsent(outcome,
                key -> Counter.builder(VERIFICATIONS)
                    .tag("outcome", key)
                    .register(registry))
            .increment();
    }

    public void recordTriggerFailure() {
        triggerFailures.increment();
    }
}

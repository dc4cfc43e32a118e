package org.example.assignment.service.gate;

import java.time.Duration;
import java.util.List;

public record ReadinessGateSettings(
        List<String> probeResources,
        Duration probeTimeout,
        int maxAttempts,
        BackoffPolicy backoff,
        FailurePolicy failurePolicy,
        Duration operationTimeout,
        Duration retryDebounce
) {

    public ReadinessGateSettings {
        if (probeResources == null || probeResources.isEmpty()) {
            throw new IllegalArgumentException("At least one probe resource is required");
        }
        probeResources = List.copyOf(probeResources);
        maxAttempts = Math.max(1, maxAttempts);
        failurePolicy = failurePolicy == null ? FailurePolicy.FAIL_OPEN : failurePolicy;
    }

    public static ReadinessGateSettings defaults(List<String> probeResources) {
        return new ReadinessGateSettings(
                probeResources,
                Duration.ofSeconds(5),
                3,
                BackoffPolicy.of(1000, 1.5, 5000),
                FailurePolicy.FAIL_OPEN,
                Duration.ofSeconds(10),
                Duration.ofSeconds(2)
        );
    }

    public ReadinessGateSettings withMaxAttempts(int attempts) {
        return new ReadinessGateSettings(probeResources, probeTimeout, attempts, backoff,
                failurePolicy, operationTimeout, retryDebounce);
    }

    public ReadinessGateSettings withBackoff(BackoffPolicy policy) {
        return new ReadinessGateSettings(probeResources, probeTimeout, maxAttempts, policy,
                failurePolicy, operationTimeout, retryDebounce);
    }

    public ReadinessGateSettings withFailurePolicy(FailurePolicy policy) {
        return new ReadinessGateSettings(probeResources, probeTimeout, maxAttempts, backoff,
                policy, operationTimeout, retryDebounce);
    }

    public ReadinessGateSettings withOperationTimeout(Duration timeout) {
        return new ReadinessGateSettings(probeResources, probeTimeout, maxAttempts, backoff,
                failurePolicy, timeout, retryDebounce);
    }
}

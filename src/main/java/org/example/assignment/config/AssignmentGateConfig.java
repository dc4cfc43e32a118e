package org.example.assignment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.assignment.service.cache.CacheStore;
import org.example.assignment.service.cache.InMemoryCacheStore;
import org.example.assignment.service.cache.TtlCache;
import org.example.assignment.service.gate.BackoffPolicy;
import org.example.assignment.service.gate.FailurePolicy;
import org.example.assignment.service.gate.ReadinessGate;
import org.example.assignment.service.gate.ReadinessGateSettings;
import org.example.assignment.service.remote.RemoteDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Wires the readiness gate and the assignment cache.
 */
@Configuration
public class AssignmentGateConfig {

    private static final Logger log = LoggerFactory.getLogger(AssignmentGateConfig.class);

    // Gate
    @Value("${gate.probe.resources:interactive_assignment,user_progress,user_profile}")
    private List<String> probeResources;

    @Value("${gate.probe.timeout-ms:5000}")
    private long probeTimeoutMs;

    @Value("${gate.reconnect.max-attempts:3}")
    private int reconnectMaxAttempts;

    @Value("${gate.reconnect.base-delay-ms:1000}")
    private long reconnectBaseDelayMs;

    @Value("${gate.reconnect.multiplier:1.5}")
    private double reconnectMultiplier;

    @Value("${gate.reconnect.max-delay-ms:5000}")
    private long reconnectMaxDelayMs;

    @Value("${gate.failure-policy:fail-open}")
    private String failurePolicy;

    @Value("${gate.operation.timeout-ms:10000}")
    private long operationTimeoutMs;

    @Value("${gate.retry.debounce-ms:2000}")
    private long retryDebounceMs;

    // Cache
    @Value("${cache.ttl-seconds:300}")
    private long cacheTtlSeconds;

    @Value("${cache.max-entries:500}")
    private int cacheMaxEntries;

    @Value("${cache.max-entry-bytes:262144}")
    private long cacheMaxEntryBytes;

    @Value("${cache.max-total-bytes:5242880}")
    private long cacheMaxTotalBytes;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReadinessGateSettings readinessGateSettings() {
        ReadinessGateSettings settings = new ReadinessGateSettings(
                probeResources,
                Duration.ofMillis(probeTimeoutMs),
                reconnectMaxAttempts,
                BackoffPolicy.of(reconnectBaseDelayMs, reconnectMultiplier, reconnectMaxDelayMs),
                parseFailurePolicy(failurePolicy),
                Duration.ofMillis(operationTimeoutMs),
                Duration.ofMillis(retryDebounceMs)
        );
        log.info("Readiness gate: probes={}, maxAttempts={}, policy={}, operationTimeout={}ms",
                settings.probeResources(), settings.maxAttempts(), settings.failurePolicy(), operationTimeoutMs);
        return settings;
    }

    @Bean(destroyMethod = "shutdown")
    public ReadinessGate readinessGate(RemoteDataSource remoteDataSource, ReadinessGateSettings settings, Clock clock) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "readiness-gate");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setRemoveOnCancelPolicy(true);
        log.info("Readiness gate probing backend '{}'", remoteDataSource.getSourceName());
        return new ReadinessGate(remoteDataSource, settings, scheduler, clock);
    }

    @Bean
    public CacheStore cacheStore() {
        return new InMemoryCacheStore(cacheMaxEntries, cacheMaxEntryBytes, cacheMaxTotalBytes);
    }

    @Bean
    public TtlCache ttlCache(CacheStore cacheStore, ObjectMapper objectMapper, Clock clock) {
        return new TtlCache(cacheStore, objectMapper, Duration.ofSeconds(cacheTtlSeconds), clock);
    }

    static FailurePolicy parseFailurePolicy(String value) {
        if (value == null || value.isBlank()) {
            return FailurePolicy.FAIL_OPEN;
        }
        return switch (value.trim().toLowerCase().replace('_', '-')) {
            case "fail-open" -> FailurePolicy.FAIL_OPEN;
            case "strict" -> FailurePolicy.STRICT;
            default -> {
                log.warn("Unknown gate.failure-policy '{}', falling back to fail-open", value);
                yield FailurePolicy.FAIL_OPEN;
            }
        };
    }
}

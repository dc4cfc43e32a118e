package org.example.assignment.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.assignment.config.RequestCorrelation;
import org.example.assignment.service.cache.TtlCache;
import org.example.assignment.service.gate.ConnectionStatus;
import org.example.assignment.service.gate.ReadinessGate;
import org.example.assignment.service.remote.RemoteDataSource;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
public class HealthController {

    private final ReadinessGate readinessGate;
    private final RemoteDataSource remoteDataSource;
    private final TtlCache cache;
    private final Clock clock;

    public HealthController(ReadinessGate readinessGate, RemoteDataSource remoteDataSource, TtlCache cache, Clock clock) {
        this.readinessGate = readinessGate;
        this.remoteDataSource = remoteDataSource;
        this.cache = cache;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        ConnectionStatus connection = readinessGate.status();
        String status;
        if (!connection.ready()) {
            status = "unavailable";
        } else if (connection.degraded()) {
            status = "degraded";
        } else {
            status = "ok";
        }
        return new HealthDetails(
                status,
                RequestCorrelation.resolveRequestId(request),
                clock.instant(),
                remoteDataSource.getSourceName(),
                connection,
                new CacheHealth(cache.size(), cache.getTtl().toSeconds())
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            Instant asOf,
            String backend,
            ConnectionStatus connection,
            CacheHealth cache
    ) {
    }

    public record CacheHealth(int entries, long ttlSeconds) {
    }
}

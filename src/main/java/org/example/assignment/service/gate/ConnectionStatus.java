package org.example.assignment.service.gate;

import java.time.Instant;

/**
 * Point-in-time view of a gate, suitable for connectivity banners.
 *
 * @param degraded true when the gate reached {@link ConnectionState#READY} by exhausting its
 *                 reconnect budget rather than through a successful probe
 */
public record ConnectionStatus(
        ConnectionState state,
        boolean ready,
        boolean degraded,
        boolean reconnecting,
        int failedAttempts,
        String lastError,
        int queueLength,
        Instant changedAt
) {
}

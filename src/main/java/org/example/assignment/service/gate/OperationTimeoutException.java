package org.example.assignment.service.gate;

import java.time.Duration;

/**
 * An operation handed to the gate did not finish within its deadline.
 */
public class OperationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public OperationTimeoutException(String operationId, Duration timeout) {
        super("Operation " + operationId + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

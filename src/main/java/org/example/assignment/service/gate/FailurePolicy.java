package org.example.assignment.service.gate;

/**
 * What a gate does once its reconnect budget is spent.
 */
public enum FailurePolicy {
    /** Force READY and run queued work anyway; status reports degraded. */
    FAIL_OPEN,
    /** Stay in ERROR and reject queued and new work until a manual retry. */
    STRICT
}

package org.example.assignment.service.gate;

/**
 * Backend connectivity as seen by a {@link ReadinessGate}.
 */
public enum ConnectionState {
    INITIALIZING,
    CONNECTING,
    READY,
    ERROR;

    boolean canTransitionTo(ConnectionState next) {
        if (next == ERROR) {
            return this != ERROR;
        }
        return switch (this) {
            case INITIALIZING -> next == CONNECTING;
            case CONNECTING -> next == READY;
            case READY -> next == INITIALIZING;
            case ERROR -> next == INITIALIZING || next == READY;
        };
    }
}

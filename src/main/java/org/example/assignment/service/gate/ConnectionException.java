package org.example.assignment.service.gate;

/**
 * The backend could not be reached, or the gate refused work because of it.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

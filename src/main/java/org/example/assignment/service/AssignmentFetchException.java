package org.example.assignment.service;

/**
 * Thrown once every fetch attempt for an assignment has failed.
 */
public class AssignmentFetchException extends RuntimeException {

    private final int attempts;

    public AssignmentFetchException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public AssignmentFetchException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

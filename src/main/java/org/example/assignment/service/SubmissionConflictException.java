package org.example.assignment.service;

/**
 * A submit was requested while another submit of the same session is still running.
 * Callers should not retry this automatically.
 */
public class SubmissionConflictException extends RuntimeException {

    public SubmissionConflictException(String message) {
        super(message);
    }
}

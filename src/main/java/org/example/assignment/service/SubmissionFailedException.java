package org.example.assignment.service;

public class SubmissionFailedException extends RuntimeException {

    private final String submissionId;

    public SubmissionFailedException(String message, String submissionId, Throwable cause) {
        super(message, cause);
        this.submissionId = submissionId;
    }

    /**
     * @return the backend submission id a manual retry will reuse, or null if none was created
     */
    public String getSubmissionId() {
        return submissionId;
    }
}

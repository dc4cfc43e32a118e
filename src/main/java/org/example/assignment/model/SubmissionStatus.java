package org.example.assignment.model;

public enum SubmissionStatus {
    PENDING,
    SUBMITTING,
    SUBMITTED,
    FAILED
}

package org.example.assignment.model;

public record SubmissionSummary(
        String submissionId,
        String assignmentId,
        String userId,
        String status,
        Integer score,
        String startedAt,
        String submittedAt
) {
}

package org.example.assignment.model;

import java.time.Instant;

public record SessionSnapshot(
        String sessionId,
        String assignmentId,
        String userId,
        String submissionId,
        SubmissionStatus status,
        int totalQuestions,
        int answeredCount,
        int visitedCount,
        Instant startedAt,
        String lastError,
        SubmissionResult result
) {
}

package org.example.assignment.model;

import java.time.Instant;

public record SubmissionResult(
        String sessionId,
        String submissionId,
        int score,
        int correctCount,
        int totalQuestions,
        int responsesSubmitted,
        Instant submittedAt
) {
}

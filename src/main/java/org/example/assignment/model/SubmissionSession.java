package org.example.assignment.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One user's attempt at one assignment.
 *
 * <p>Responses are last-write-wins per question and are only accepted while the session is
 * {@link SubmissionStatus#PENDING} or {@link SubmissionStatus#FAILED}. The {@code submitting}
 * flag is a re-entrancy guard: {@link #tryBeginSubmit()} never blocks, it refuses.</p>
 */
public class SubmissionSession {

    private final String sessionId;
    private final String assignmentId;
    private final String userId;
    private final List<String> questionIds;
    private final Instant startedAt;

    private final Map<String, QuestionResponse> responses = new LinkedHashMap<>();
    private final Set<String> visited = new LinkedHashSet<>();

    private boolean submitting;
    private String submissionId;
    private SubmissionStatus status = SubmissionStatus.PENDING;
    private SubmissionResult result;
    private String lastError;
    private Instant lastActivityAt;

    public SubmissionSession(
            String sessionId,
            String assignmentId,
            String userId,
            List<String> questionIds,
            Instant startedAt) {
        this.sessionId = sessionId;
        this.assignmentId = assignmentId;
        this.userId = userId;
        this.questionIds = List.copyOf(questionIds);
        this.startedAt = startedAt;
        this.lastActivityAt = startedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getAssignmentId() {
        return assignmentId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getTotalQuestions() {
        return questionIds.size();
    }

    public synchronized SubmissionStatus getStatus() {
        return status;
    }

    public synchronized Optional<String> getSubmissionId() {
        return Optional.ofNullable(submissionId);
    }

    /**
     * Keep the first id the backend hands out; later ids are ignored.
     *
     * @return the id the session uses from now on
     */
    public synchronized String assignSubmissionId(String id) {
        if (submissionId == null && id != null && !id.isBlank()) {
            submissionId = id;
        }
        return submissionId;
    }

    public synchronized void recordResponse(QuestionResponse response) {
        requireKnownQuestion(response.questionId());
        requireOpen();
        visited.add(response.questionId());
        responses.put(response.questionId(), response);
    }

    public synchronized void markVisited(String questionId) {
        requireKnownQuestion(questionId);
        requireOpen();
        visited.add(questionId);
    }

    public synchronized Optional<SubmissionResult> completedResult() {
        return status == SubmissionStatus.SUBMITTED ? Optional.ofNullable(result) : Optional.empty();
    }

    /**
     * @return false if a submission is already in flight or has completed
     */
    public synchronized boolean tryBeginSubmit() {
        if (submitting || status == SubmissionStatus.SUBMITTED) {
            return false;
        }
        submitting = true;
        status = SubmissionStatus.SUBMITTING;
        lastError = null;
        return true;
    }

    /**
     * One entry per question this session touched, in assignment order. Visited questions
     * without an answer are reported as incorrect.
     */
    public synchronized List<QuestionResponse> responsesForSubmission() {
        List<QuestionResponse> submitted = new ArrayList<>();
        for (String questionId : questionIds) {
            QuestionResponse response = responses.get(questionId);
            if (response != null) {
                submitted.add(response);
            } else if (visited.contains(questionId)) {
                submitted.add(QuestionResponse.unanswered(questionId));
            }
        }
        return submitted;
    }

    public synchronized void markSubmitted(SubmissionResult submissionResult) {
        result = submissionResult;
        status = SubmissionStatus.SUBMITTED;
        submitting = false;
    }

    public synchronized void markFailed(String error) {
        lastError = error;
        status = SubmissionStatus.FAILED;
        submitting = false;
    }

    public synchronized void touch(Instant now) {
        if (now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
    }

    /**
     * @return true if nothing touched the session since {@code cutoff} and no submit is running
     */
    public synchronized boolean isIdleSince(Instant cutoff) {
        return !submitting && lastActivityAt.isBefore(cutoff);
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(
                sessionId,
                assignmentId,
                userId,
                submissionId,
                status,
                questionIds.size(),
                responses.size(),
                visited.size(),
                startedAt,
                lastError,
                result
        );
    }

    private void requireKnownQuestion(String questionId) {
        if (questionId == null || !questionIds.contains(questionId)) {
            throw new IllegalArgumentException("Question " + questionId + " is not part of assignment " + assignmentId);
        }
    }

    private void requireOpen() {
        if (status == SubmissionStatus.SUBMITTING || status == SubmissionStatus.SUBMITTED) {
            throw new IllegalStateException("Session " + sessionId + " no longer accepts responses (" + status + ")");
        }
    }
}

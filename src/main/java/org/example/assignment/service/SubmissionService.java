package org.example.assignment.service;

import com.fasterxml.jackson.core.type.TypeReference;
import org.example.assignment.model.Assignment;
import org.example.assignment.model.QuestionResponse;
import org.example.assignment.model.SessionSnapshot;
import org.example.assignment.model.SubmissionResult;
import org.example.assignment.model.SubmissionSession;
import org.example.assignment.model.SubmissionStatus;
import org.example.assignment.model.SubmissionSummary;
import org.example.assignment.service.cache.TtlCache;
import org.example.assignment.service.gate.ReadinessGate;
import org.example.assignment.service.remote.BackendTables;
import org.example.assignment.service.remote.RemoteDataSource;
import org.example.assignment.service.remote.RemoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns answering sessions and writes them to the backend.
 *
 * <p>A submit is written in two phases: response rows are upserted on
 * {@code (submission_id, question_id)}, then the submission row is marked submitted with its
 * score. Both phases are idempotent, so the automatic retry and any manual retry reuse the same
 * submission id without duplicating rows.</p>
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private static final String SUBMISSIONS_PREFIX = "submissions:";
    private static final TypeReference<List<SubmissionSummary>> SUMMARY_LIST = new TypeReference<>() {
    };
    private static final List<String> RESPONSE_KEY = List.of(BackendTables.SUBMISSION_ID, BackendTables.QUESTION_ID);

    private final AssignmentService assignmentService;
    private final ReadinessGate gate;
    private final RemoteDataSource remoteDataSource;
    private final TtlCache cache;
    private final Clock clock;
    private final int autoRetryAttempts;
    private final Duration retryDelay;
    private final Duration idleTtl;
    private final AtomicInteger cleanupTicker = new AtomicInteger();

    private final ConcurrentHashMap<String, SubmissionSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<String>> pendingRecords = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<List<SubmissionSummary>>> pendingListings =
            new ConcurrentHashMap<>();

    public SubmissionService(
            AssignmentService assignmentService,
            ReadinessGate gate,
            RemoteDataSource remoteDataSource,
            TtlCache cache,
            Clock clock,
            @Value("${session.submit.auto-retry-attempts:1}") int autoRetryAttempts,
            @Value("${session.submit.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${session.idle-ttl-minutes:120}") long idleTtlMinutes) {
        this.assignmentService = assignmentService;
        this.gate = gate;
        this.remoteDataSource = remoteDataSource;
        this.cache = cache;
        this.clock = clock;
        this.autoRetryAttempts = Math.max(0, autoRetryAttempts);
        this.retryDelay = Duration.ofMillis(Math.max(0, retryDelayMs));
        this.idleTtl = Duration.ofMinutes(Math.max(1, idleTtlMinutes));
    }

    /**
     * Percentage of correct answers over all questions of the assignment, rounded half up.
     */
    public static int scorePercent(int correctCount, int totalQuestions) {
        if (totalQuestions <= 0) {
            return 0;
        }
        return (int) Math.round(correctCount * 100.0 / totalQuestions);
    }

    static String submissionsKey(String userId) {
        return SUBMISSIONS_PREFIX + userId;
    }

    /**
     * Load the assignment and open a session for it. The backend submission row is created
     * right away when possible; if that fails it is created when the session is submitted.
     */
    public CompletableFuture<SessionSnapshot> startSession(String assignmentId, String userId) {
        if (userId == null || userId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("userId is required"));
        }
        return assignmentService.fetchAssignment(assignmentId).thenCompose(assignment -> {
            SubmissionSession session = openSession(assignment, userId);
            return ensureSubmissionRecord(session).handle((submissionId, error) -> {
                if (error != null) {
                    log.warn("Could not create submission record for session {}; will retry on submit: {}",
                            session.getSessionId(), Futures.describe(error));
                }
                return session.snapshot();
            });
        });
    }

    public Optional<SessionSnapshot> getSession(String sessionId) {
        SubmissionSession session = lookup(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.snapshot());
    }

    public SessionSnapshot recordResponse(String sessionId, String questionId, Map<String, Object> payload, boolean correct) {
        SubmissionSession session = requireSession(sessionId);
        session.recordResponse(new QuestionResponse(questionId, payload, correct));
        return session.snapshot();
    }

    public SessionSnapshot markVisited(String sessionId, String questionId) {
        SubmissionSession session = requireSession(sessionId);
        session.markVisited(questionId);
        return session.snapshot();
    }

    public boolean endSession(String sessionId) {
        SubmissionSession removed = sessions.remove(sessionId);
        pendingRecords.remove(sessionId);
        if (removed != null) {
            log.info("Ended session {} ({})", sessionId, removed.getStatus());
        }
        return removed != null;
    }

    /**
     * Submit every answer recorded in the session.
     *
     * <p>Fails with {@link SubmissionConflictException} if a submit of this session is already
     * running, and with {@link SubmissionFailedException} once the automatic retries are used up.
     * A session that was already submitted returns its stored result.</p>
     */
    public CompletableFuture<SubmissionResult> submit(String sessionId) {
        SubmissionSession session = lookup(sessionId);
        if (session == null) {
            return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId));
        }

        Optional<SubmissionResult> completed = session.completedResult();
        if (completed.isPresent()) {
            log.info("Session {} already submitted; returning stored result", sessionId);
            return CompletableFuture.completedFuture(completed.get());
        }
        if (!session.tryBeginSubmit()) {
            return session.completedResult()
                    .map(CompletableFuture::completedFuture)
                    .orElseGet(() -> CompletableFuture.failedFuture(new SubmissionConflictException(
                            "Session " + sessionId + " is already being submitted")));
        }

        List<QuestionResponse> responses = session.responsesForSubmission();
        int correctCount = (int) responses.stream().filter(QuestionResponse::correct).count();
        int score = scorePercent(correctCount, session.getTotalQuestions());
        log.info("Submitting session {}: {} responses, {}/{} correct, score {}",
                sessionId, responses.size(), correctCount, session.getTotalQuestions(), score);

        CompletableFuture<SubmissionResult> result = new CompletableFuture<>();
        attemptSubmit(session, responses, correctCount, score, 0, result);
        return result;
    }

    /**
     * Past submissions of a user, newest first. Cached for the cache TTL; {@code refresh}
     * bypasses the cached copy.
     */
    public CompletableFuture<List<SubmissionSummary>> listUserSubmissions(String userId, boolean refresh) {
        if (userId == null || userId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("userId is required"));
        }
        String key = submissionsKey(userId);
        if (refresh) {
            cache.remove(key);
        } else {
            Optional<List<SubmissionSummary>> cached = cache.get(key, SUMMARY_LIST);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        CompletableFuture<List<SubmissionSummary>> created = new CompletableFuture<>();
        CompletableFuture<List<SubmissionSummary>> existing = pendingListings.putIfAbsent(userId, created);
        if (existing != null) {
            return existing;
        }
        created.whenComplete((summaries, error) -> pendingListings.remove(userId, created));

        gate.executeWhenReady(() -> remoteDataSource.read(
                        BackendTables.SUBMISSION, Map.of(BackendTables.USER_ID, userId), 0))
                .thenApply(rows -> rows.stream()
                        .map(SubmissionService::toSummary)
                        .sorted(Comparator.comparing(SubmissionSummary::startedAt,
                                Comparator.nullsLast(Comparator.<String>reverseOrder())))
                        .toList())
                .whenComplete((summaries, error) -> {
                    if (error != null) {
                        log.warn("Could not list submissions of user {}: {}", userId, Futures.describe(error));
                        created.completeExceptionally(Futures.unwrap(error));
                        return;
                    }
                    cache.set(key, summaries);
                    created.complete(summaries);
                });
        return created;
    }

    private SubmissionSession openSession(Assignment assignment, String userId) {
        SubmissionSession session = new SubmissionSession(
                UUID.randomUUID().toString(),
                assignment.id(),
                userId,
                assignment.questionIds(),
                clock.instant()
        );
        sessions.put(session.getSessionId(), session);
        cleanupIfNeeded();
        log.info("Opened session {} for user {} on assignment {} ({} questions)",
                session.getSessionId(), userId, assignment.id(), session.getTotalQuestions());
        return session;
    }

    private SubmissionSession requireSession(String sessionId) {
        SubmissionSession session = lookup(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private SubmissionSession lookup(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        SubmissionSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        Instant now = clock.instant();
        if (session.isIdleSince(now.minus(idleTtl))) {
            discard(session);
            return null;
        }
        session.touch(now);
        cleanupIfNeeded();
        return session;
    }

    /**
     * Drop sessions idle for longer than the idle TTL. Sessions with a submit in flight are kept.
     *
     * @return number of sessions removed
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTtl);
        int evicted = 0;
        for (SubmissionSession session : sessions.values()) {
            if (session.isIdleSince(cutoff) && discard(session)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
        return evicted;
    }

    private void cleanupIfNeeded() {
        int tick = cleanupTicker.incrementAndGet();
        if ((tick & 0xFF) != 0) {
            return;
        }
        evictIdleSessions();
    }

    private boolean discard(SubmissionSession session) {
        if (!sessions.remove(session.getSessionId(), session)) {
            return false;
        }
        pendingRecords.remove(session.getSessionId());
        log.debug("Session {} expired after {} idle ({})", session.getSessionId(), idleTtl, session.getStatus());
        return true;
    }

    /**
     * Resolve the backend submission id, inserting a pending row the first time. Concurrent
     * callers share one insert; a failed insert is forgotten so the next caller tries again.
     */
    private CompletableFuture<String> ensureSubmissionRecord(SubmissionSession session) {
        Optional<String> known = session.getSubmissionId();
        if (known.isPresent()) {
            return CompletableFuture.completedFuture(known.get());
        }

        CompletableFuture<String> created = new CompletableFuture<>();
        CompletableFuture<String> existing = pendingRecords.putIfAbsent(session.getSessionId(), created);
        if (existing != null) {
            return existing;
        }

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(BackendTables.ASSIGNMENT_ID, session.getAssignmentId());
        row.put(BackendTables.USER_ID, session.getUserId());
        row.put("status", SubmissionStatus.PENDING.name());
        row.put("started_at", session.getStartedAt().toString());

        gate.executeWhenReady(() -> remoteDataSource.insert(BackendTables.SUBMISSION, List.of(row)))
                .whenComplete((rows, error) -> {
                    pendingRecords.remove(session.getSessionId(), created);
                    if (error != null) {
                        created.completeExceptionally(Futures.unwrap(error));
                        return;
                    }
                    Object id = rows == null || rows.isEmpty() ? null : rows.get(0).get(BackendTables.ID);
                    if (id == null) {
                        created.completeExceptionally(
                                new RemoteDataSourceException("Backend returned no id for the new submission"));
                        return;
                    }
                    String submissionId = session.assignSubmissionId(id.toString());
                    log.debug("Session {} uses submission {}", session.getSessionId(), submissionId);
                    created.complete(submissionId);
                });
        return created;
    }

    private void attemptSubmit(
            SubmissionSession session,
            List<QuestionResponse> responses,
            int correctCount,
            int score,
            int retriesUsed,
            CompletableFuture<SubmissionResult> result) {
        writeSubmission(session, responses, score).whenComplete((submittedAt, error) -> {
            if (error == null) {
                SubmissionResult submitted = new SubmissionResult(
                        session.getSessionId(),
                        session.getSubmissionId().orElse(null),
                        score,
                        correctCount,
                        session.getTotalQuestions(),
                        responses.size(),
                        submittedAt
                );
                session.markSubmitted(submitted);
                cache.remove(submissionsKey(session.getUserId()));
                log.info("Session {} submitted as {} with score {}",
                        session.getSessionId(), submitted.submissionId(), score);
                result.complete(submitted);
                return;
            }

            Throwable cause = Futures.unwrap(error);
            if (retriesUsed < autoRetryAttempts) {
                log.warn("Submit of session {} failed, retrying in {}ms: {}",
                        session.getSessionId(), retryDelay.toMillis(), Futures.describe(cause));
                CompletableFuture.runAsync(
                        () -> attemptSubmit(session, responses, correctCount, score, retriesUsed + 1, result),
                        CompletableFuture.delayedExecutor(retryDelay.toMillis(), TimeUnit.MILLISECONDS));
                return;
            }

            String message = Futures.describe(cause);
            session.markFailed(message);
            log.error("Submit of session {} failed after {} attempts: {}",
                    session.getSessionId(), retriesUsed + 1, message);
            result.completeExceptionally(new SubmissionFailedException(
                    "Could not submit session " + session.getSessionId() + ": " + message,
                    session.getSubmissionId().orElse(null),
                    cause));
        });
    }

    private CompletableFuture<Instant> writeSubmission(
            SubmissionSession session,
            List<QuestionResponse> responses,
            int score) {
        return ensureSubmissionRecord(session).thenCompose(submissionId -> {
            List<Map<String, Object>> rows = responses.stream()
                    .map(response -> responseRow(submissionId, response))
                    .toList();
            CompletableFuture<List<Map<String, Object>>> responsesWritten = rows.isEmpty()
                    ? CompletableFuture.completedFuture(List.of())
                    : gate.executeWhenReady(() -> remoteDataSource.upsert(BackendTables.RESPONSE, rows, RESPONSE_KEY));

            return responsesWritten.thenCompose(written -> {
                Instant submittedAt = clock.instant();
                Map<String, Object> patch = new LinkedHashMap<>();
                patch.put("status", SubmissionStatus.SUBMITTED.name());
                patch.put("score", score);
                patch.put("submitted_at", submittedAt.toString());
                return gate.executeWhenReady(() -> remoteDataSource.update(BackendTables.SUBMISSION, submissionId, patch))
                        .thenApply(updated -> submittedAt);
            });
        });
    }

    private static Map<String, Object> responseRow(String submissionId, QuestionResponse response) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(BackendTables.SUBMISSION_ID, submissionId);
        row.put(BackendTables.QUESTION_ID, response.questionId());
        row.put("response_data", response.payload());
        row.put("is_correct", response.correct());
        return row;
    }

    private static SubmissionSummary toSummary(Map<String, Object> row) {
        Object score = row.get("score");
        return new SubmissionSummary(
                text(row, BackendTables.ID),
                text(row, BackendTables.ASSIGNMENT_ID),
                text(row, BackendTables.USER_ID),
                text(row, "status"),
                score instanceof Number number ? Integer.valueOf(number.intValue()) : null,
                text(row, "started_at"),
                text(row, "submitted_at")
        );
    }

    private static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }
}

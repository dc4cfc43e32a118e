package org.example.assignment.service;

import org.example.assignment.model.Assignment;
import org.example.assignment.model.FetchState;
import org.example.assignment.model.Question;
import org.example.assignment.service.cache.TtlCache;
import org.example.assignment.service.gate.BackoffPolicy;
import org.example.assignment.service.gate.ReadinessGate;
import org.example.assignment.service.remote.BackendTables;
import org.example.assignment.service.remote.RemoteDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Loads assignments through the TTL cache, falling back to the backend via the readiness gate.
 *
 * <p>Concurrent requests for the same assignment share one in-flight load. Failed loads are
 * retried with backoff up to {@code assignment.fetch.max-attempts}; a missing assignment is
 * not retried.</p>
 */
@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private static final String CACHE_PREFIX = "assignment:";

    private final ReadinessGate gate;
    private final RemoteDataSource remoteDataSource;
    private final TtlCache cache;
    private final BackoffPolicy backoff;
    private final int maxAttempts;

    private final ConcurrentHashMap<String, CompletableFuture<Assignment>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FetchState> fetchStates = new ConcurrentHashMap<>();

    @Autowired
    public AssignmentService(
            ReadinessGate gate,
            RemoteDataSource remoteDataSource,
            TtlCache cache,
            @Value("${assignment.fetch.max-attempts:3}") int maxAttempts,
            @Value("${assignment.fetch.base-delay-ms:1500}") long baseDelayMs,
            @Value("${assignment.fetch.multiplier:1.5}") double multiplier,
            @Value("${assignment.fetch.max-delay-ms:5000}") long maxDelayMs) {
        this(gate, remoteDataSource, cache, BackoffPolicy.of(baseDelayMs, multiplier, maxDelayMs), maxAttempts);
    }

    AssignmentService(
            ReadinessGate gate,
            RemoteDataSource remoteDataSource,
            TtlCache cache,
            BackoffPolicy backoff,
            int maxAttempts) {
        this.gate = gate;
        this.remoteDataSource = remoteDataSource;
        this.cache = cache;
        this.backoff = backoff;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    static String cacheKey(String assignmentId) {
        return CACHE_PREFIX + assignmentId;
    }

    public CompletableFuture<Assignment> fetchAssignment(String assignmentId) {
        if (assignmentId == null || assignmentId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("assignmentId is required"));
        }

        Assignment cached = cache.get(cacheKey(assignmentId), Assignment.class).orElse(null);
        if (cached != null) {
            log.debug("Assignment {} served from cache", assignmentId);
            fetchStates.put(assignmentId, FetchState.LOADED);
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<Assignment> created = new CompletableFuture<>();
        CompletableFuture<Assignment> existing = inFlight.putIfAbsent(assignmentId, created);
        if (existing != null) {
            log.debug("Joining in-flight fetch of assignment {}", assignmentId);
            return existing;
        }

        fetchStates.put(assignmentId, FetchState.FETCHING);
        created.whenComplete((assignment, error) -> inFlight.remove(assignmentId, created));
        attempt(assignmentId, 1, created);
        return created;
    }

    public FetchState getFetchState(String assignmentId) {
        return fetchStates.getOrDefault(assignmentId, FetchState.NOT_REQUESTED);
    }

    public void invalidate(String assignmentId) {
        cache.remove(cacheKey(assignmentId));
        fetchStates.remove(assignmentId);
        log.info("Invalidated cached assignment {}", assignmentId);
    }

    /**
     * Drop every cached entry, used on logout.
     */
    public void clearCache() {
        cache.clear();
        fetchStates.clear();
    }

    private void attempt(String assignmentId, int attemptNumber, CompletableFuture<Assignment> result) {
        gate.executeWhenReady(() -> loadRemote(assignmentId)).whenComplete((assignment, error) -> {
            if (error == null) {
                cache.set(cacheKey(assignmentId), assignment);
                fetchStates.put(assignmentId, FetchState.LOADED);
                log.info("Loaded assignment {} with {} questions", assignmentId, assignment.questions().size());
                result.complete(assignment);
                return;
            }

            Throwable cause = Futures.unwrap(error);
            if (cause instanceof AssignmentNotFoundException notFound) {
                fetchStates.remove(notFound.getAssignmentId());
                log.warn("Assignment {} does not exist", notFound.getAssignmentId());
                result.completeExceptionally(cause);
                return;
            }
            fetchStates.put(assignmentId, FetchState.FAILED);
            if (attemptNumber >= maxAttempts) {
                log.error("Giving up on assignment {} after {} attempts: {}",
                        assignmentId, attemptNumber, Futures.describe(cause));
                result.completeExceptionally(new AssignmentFetchException(
                        "Could not load assignment " + assignmentId + " after " + attemptNumber + " attempts",
                        attemptNumber,
                        cause));
                return;
            }

            Duration delay = backoff.delayFor(attemptNumber - 1);
            log.warn("Fetch of assignment {} failed (attempt {}/{}), retrying in {}ms: {}",
                    assignmentId, attemptNumber, maxAttempts, delay.toMillis(), Futures.describe(cause));
            CompletableFuture.runAsync(() -> {
                fetchStates.put(assignmentId, FetchState.FETCHING);
                attempt(assignmentId, attemptNumber + 1, result);
            }, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        });
    }

    private CompletableFuture<Assignment> loadRemote(String assignmentId) {
        return remoteDataSource.read(BackendTables.ASSIGNMENT, Map.of(BackendTables.ID, assignmentId), 1)
                .thenCompose(rows -> {
                    if (rows == null || rows.isEmpty()) {
                        throw new AssignmentNotFoundException(assignmentId);
                    }
                    Map<String, Object> row = rows.get(0);
                    return remoteDataSource.read(
                                    BackendTables.QUESTION,
                                    Map.of(BackendTables.ASSIGNMENT_ID, assignmentId),
                                    0)
                            .thenApply(questionRows -> toAssignment(assignmentId, row, questionRows));
                });
    }

    private Assignment toAssignment(String assignmentId, Map<String, Object> row, List<Map<String, Object>> questionRows) {
        List<Question> questions = (questionRows == null ? List.<Map<String, Object>>of() : questionRows).stream()
                .map(this::toQuestion)
                .sorted(Comparator.comparingInt(Question::order))
                .toList();
        return new Assignment(
                assignmentId,
                text(row, "title"),
                text(row, "description"),
                text(row, "organization_id"),
                questions
        );
    }

    private Question toQuestion(Map<String, Object> row) {
        Object order = row.get("order");
        int position;
        if (order instanceof Number number) {
            position = number.intValue();
        } else if (order != null) {
            try {
                position = Integer.parseInt(order.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Question {} has non-numeric order '{}'", row.get(BackendTables.ID), order);
                position = Integer.MAX_VALUE;
            }
        } else {
            position = Integer.MAX_VALUE;
        }
        return new Question(
                text(row, BackendTables.ID),
                text(row, "question_type"),
                text(row, "question_text"),
                position
        );
    }

    private static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }
}

package org.example.assignment.service.gate;

import org.example.assignment.service.Futures;
import org.example.assignment.service.remote.RemoteDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Tracks backend connectivity and runs operations once the backend is usable.
 *
 * <p>All state and the operation queue are confined to the single scheduler thread handed
 * to the constructor; public methods only hand work to that thread. Queued operations are
 * drained one at a time in arrival order. Every operation, queued or run at once, has its own
 * deadline counted from when it was handed to the gate.</p>
 */
public class ReadinessGate {

    private static final Logger log = LoggerFactory.getLogger(ReadinessGate.class);

    private final RemoteDataSource remoteDataSource;
    private final ReadinessGateSettings settings;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Deque<QueuedOperation<?>> queue = new ArrayDeque<>();
    private boolean draining;
    private int probeCursor;

    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final AtomicLong operationSequence = new AtomicLong();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Object retryLock = new Object();
    private boolean retryRequested;
    private long lastRetryRequestMillis;

    private volatile ConnectionState state = ConnectionState.INITIALIZING;
    private volatile boolean degraded;
    private volatile boolean closed;
    private volatile int failedAttempts;
    private volatile int queueLength;
    private volatile String lastError;
    private volatile Instant changedAt;

    public ReadinessGate(
            RemoteDataSource remoteDataSource,
            ReadinessGateSettings settings,
            ScheduledExecutorService scheduler,
            Clock clock) {
        this.remoteDataSource = Objects.requireNonNull(remoteDataSource, "remoteDataSource");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.changedAt = clock.instant();
    }

    /**
     * Begin a reconnect cycle. A request made while a cycle is already running is ignored.
     *
     * @return true if a new cycle was started
     */
    public boolean start() {
        if (closed) {
            return false;
        }
        if (!reconnecting.compareAndSet(false, true)) {
            log.debug("Reconnect already in progress; ignoring start request");
            return false;
        }
        if (!runOnLoop(this::beginCycle)) {
            reconnecting.set(false);
            return false;
        }
        return true;
    }

    /**
     * Manually request a reconnect. Requests closer together than the configured debounce
     * window are ignored.
     *
     * @return true if a new reconnect cycle was started
     */
    public boolean retryConnection() {
        long now = clock.millis();
        synchronized (retryLock) {
            if (retryRequested && now - lastRetryRequestMillis < settings.retryDebounce().toMillis()) {
                log.info("Reconnect requested {}ms after the previous request; ignoring",
                        now - lastRetryRequestMillis);
                return false;
            }
            retryRequested = true;
            lastRetryRequestMillis = now;
        }
        log.info("Manual reconnect requested");
        return start();
    }

    public <T> CompletableFuture<T> executeWhenReady(Supplier<CompletableFuture<T>> operation) {
        return executeWhenReady(operation, settings.operationTimeout());
    }

    /**
     * Run {@code operation} now if the backend is ready and nothing is queued ahead of it,
     * otherwise queue it. The returned future fails with {@link OperationTimeoutException} if the
     * operation has not completed within {@code timeout}; a late result is dropped.
     */
    public <T> CompletableFuture<T> executeWhenReady(Supplier<CompletableFuture<T>> operation, Duration timeout) {
        Objects.requireNonNull(operation, "operation");
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        QueuedOperation<T> queued = QueuedOperation.of(
                "op-" + operationSequence.incrementAndGet(),
                operation,
                clock.instant(),
                timeout
        );
        if (!runOnLoop(() -> admit(queued))) {
            queued.result().completeExceptionally(new ConnectionException("Readiness gate is shut down"));
        }
        return queued.result();
    }

    public ConnectionState currentState() {
        return state;
    }

    public boolean isReady() {
        return state == ConnectionState.READY;
    }

    public int getQueueLength() {
        return queueLength;
    }

    public ConnectionStatus status() {
        ConnectionState current = state;
        return new ConnectionStatus(
                current,
                current == ConnectionState.READY,
                degraded,
                reconnecting.get(),
                failedAttempts,
                lastError,
                queueLength,
                changedAt
        );
    }

    public void onStateChange(ConnectionStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeStateListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        runOnLoop(() -> rejectQueued(new ConnectionException("Readiness gate is shut down")));
        scheduler.shutdown();
        log.info("Readiness gate shut down");
    }

    private void beginCycle() {
        failedAttempts = 0;
        runAttempt();
    }

    private void runAttempt() {
        if (closed) {
            reconnecting.set(false);
            return;
        }
        transition(ConnectionState.INITIALIZING);
        transition(ConnectionState.CONNECTING);

        String resource = settings.probeResources().get(probeCursor % settings.probeResources().size());
        probeCursor++;
        log.info("Probing backend via '{}' (attempt {}/{})", resource, failedAttempts + 1, settings.maxAttempts());

        CompletableFuture<List<Map<String, Object>>> probe;
        try {
            probe = Objects.requireNonNull(remoteDataSource.read(resource, Map.of(), 1), "probe returned no future");
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }
        probe.orTimeout(settings.probeTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenCompleteAsync((rows, error) -> {
                    if (error == null) {
                        onProbeSucceeded(resource);
                    } else {
                        onProbeFailed(resource, error);
                    }
                }, scheduler);
    }

    private void onProbeSucceeded(String resource) {
        failedAttempts = 0;
        lastError = null;
        degraded = false;
        reconnecting.set(false);
        log.info("Backend reachable via '{}'", resource);
        transition(ConnectionState.READY);
        drainQueue();
    }

    private void onProbeFailed(String resource, Throwable error) {
        failedAttempts++;
        lastError = Futures.describe(error);
        log.warn("Backend probe via '{}' failed (attempt {}/{}): {}",
                resource, failedAttempts, settings.maxAttempts(), lastError);
        transition(ConnectionState.ERROR);

        if (failedAttempts < settings.maxAttempts()) {
            Duration delay = settings.backoff().delayFor(failedAttempts - 1);
            log.info("Retrying backend connection in {}ms", delay.toMillis());
            if (!schedule(this::runAttempt, delay)) {
                reconnecting.set(false);
            }
            return;
        }

        reconnecting.set(false);
        if (settings.failurePolicy() == FailurePolicy.FAIL_OPEN) {
            degraded = true;
            log.warn("Reconnect budget of {} attempts exhausted; continuing in degraded mode",
                    settings.maxAttempts());
            transition(ConnectionState.READY);
            drainQueue();
        } else {
            log.error("Reconnect budget of {} attempts exhausted; rejecting {} queued operations",
                    settings.maxAttempts(), queue.size());
            rejectQueued(new ConnectionException("Backend unavailable: " + lastError, Futures.unwrap(error)));
        }
    }

    private <T> void admit(QueuedOperation<T> queued) {
        if (state == ConnectionState.READY && queue.isEmpty() && !draining) {
            scheduleDeadline(queued);
            run(queued);
            return;
        }
        if (state == ConnectionState.ERROR
                && !reconnecting.get()
                && settings.failurePolicy() == FailurePolicy.STRICT) {
            queued.result().completeExceptionally(new ConnectionException("Backend unavailable: " + lastError));
            return;
        }

        queue.addLast(queued);
        queueLength = queue.size();
        log.debug("Backend not ready ({}); queued {} ({} waiting)", state, queued.id(), queue.size());
        scheduleDeadline(queued);
    }

    private void scheduleDeadline(QueuedOperation<?> queued) {
        try {
            ScheduledFuture<?> deadline = scheduler.schedule(
                    () -> expire(queued), queued.timeout().toMillis(), TimeUnit.MILLISECONDS);
            queued.result().whenComplete((value, error) -> deadline.cancel(false));
        } catch (RejectedExecutionException e) {
            log.debug("Readiness gate scheduler rejected deadline of {}", queued.id(), e);
        }
    }

    private void expire(QueuedOperation<?> queued) {
        if (queued.result().isDone()) {
            return;
        }
        boolean stillQueued = queue.remove(queued);
        queueLength = queue.size();
        log.warn("Operation {} timed out after {}ms ({})",
                queued.id(), queued.timeout().toMillis(), stillQueued ? "never started" : "still running");
        queued.result().completeExceptionally(new OperationTimeoutException(queued.id(), queued.timeout()));
    }

    private <T> void run(QueuedOperation<T> queued) {
        CompletableFuture<T> pending;
        try {
            pending = Objects.requireNonNull(queued.operation().get(), "operation returned no future");
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        pending.whenComplete((value, error) -> {
            if (error != null) {
                queued.result().completeExceptionally(Futures.unwrap(error));
            } else {
                queued.result().complete(value);
            }
        });
    }

    private void drainQueue() {
        if (draining || queue.isEmpty()) {
            return;
        }
        draining = true;
        log.info("Draining {} queued operations", queue.size());
        drainNext();
    }

    private void drainNext() {
        if (state != ConnectionState.READY) {
            draining = false;
            return;
        }
        QueuedOperation<?> next;
        do {
            next = queue.pollFirst();
        } while (next != null && next.result().isDone());
        queueLength = queue.size();
        if (next == null) {
            draining = false;
            return;
        }
        run(next);
        next.result().whenCompleteAsync((value, error) -> drainNext(), scheduler);
    }

    private void rejectQueued(RuntimeException reason) {
        QueuedOperation<?> queued;
        while ((queued = queue.pollFirst()) != null) {
            queued.result().completeExceptionally(reason);
        }
        queueLength = 0;
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal connection state transition " + previous + " -> " + next);
        }
        state = next;
        changedAt = clock.instant();
        log.info("Connection state {} -> {}", previous, next);

        ConnectionStatus snapshot = status();
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, snapshot);
            } catch (RuntimeException e) {
                log.warn("Connection state listener failed on {} -> {}", previous, next, e);
            }
        }
    }

    private boolean runOnLoop(Runnable task) {
        try {
            scheduler.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Readiness gate scheduler rejected task", e);
            return false;
        }
    }

    private boolean schedule(Runnable task, Duration delay) {
        try {
            scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Readiness gate scheduler rejected delayed task", e);
            return false;
        }
    }
}

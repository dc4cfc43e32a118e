package org.example.assignment.service.gate;

import org.example.assignment.service.remote.RemoteDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReadinessGateTest {

    private static final List<String> CHECKED_RESOURCES = List.of("interactive_assignment", "user_progress");

    @Mock
    private RemoteDataSource remoteDataSource;

    private MutableClock clock;
    private ScheduledThreadPoolExecutor scheduler;
    private ReadinessGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "readiness-gate-test");
            thread.setDaemon(true);
            return thread;
        });
    }

    @AfterEach
    void tearDown() {
        if (gate != null) {
            gate.shutdown();
        }
        scheduler.shutdownNow();
    }

    @Test
    void start_backendReachable_becomesReady() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings());

        assertEquals(ConnectionState.INITIALIZING, gate.currentState());
        assertTrue(gate.start());

        awaitCondition(gate::isReady, 2000L, "gate to become ready");
        ConnectionStatus status = gate.status();
        assertFalse(status.degraded());
        assertFalse(status.reconnecting());
        assertEquals(0, status.failedAttempts());
        verify(remoteDataSource).read(eq("interactive_assignment"), eq(Map.of()), eq(1));
    }

    @Test
    void executeWhenReady_beforeReady_drainsInArrivalOrder() throws Exception {
        CompletableFuture<List<Map<String, Object>>> reachability = new CompletableFuture<>();
        when(remoteDataSource.read(anyString(), anyMap(), anyInt())).thenReturn(reachability);
        gate = newGate(fastSettings());
        List<Integer> executed = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Integer> first = gate.executeWhenReady(() -> record(executed, 1));
        CompletableFuture<Integer> second = gate.executeWhenReady(() -> record(executed, 2));
        CompletableFuture<Integer> third = gate.executeWhenReady(() -> record(executed, 3));
        gate.start();

        awaitCondition(() -> gate.getQueueLength() == 3, 2000L, "three queued operations");
        assertTrue(executed.isEmpty());

        reachability.complete(List.of());

        assertEquals(3, third.get(2, TimeUnit.SECONDS));
        assertEquals(1, first.get(2, TimeUnit.SECONDS));
        assertEquals(2, second.get(2, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), executed);
        awaitCondition(() -> gate.getQueueLength() == 0, 2000L, "queue to empty");
    }

    @Test
    void failOpen_secondFailedCheck_forcesReadyInDegradedMode() throws Exception {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("backend down")));
        ReadinessGateSettings settings = fastSettings()
                .withMaxAttempts(2)
                .withBackoff(BackoffPolicy.of(200, 1.0, 200));
        gate = newGate(settings);

        CompletableFuture<String> queued = gate.executeWhenReady(() -> CompletableFuture.completedFuture("ran"));
        long startedNanos = System.nanoTime();
        gate.start();

        assertEquals("ran", queued.get(2, TimeUnit.SECONDS));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        long upperBound = settings.backoff().delayFor(0).plusSeconds(1).toMillis();
        assertTrue(elapsedMillis >= settings.backoff().delayFor(0).toMillis(),
                "ready after " + elapsedMillis + "ms, before the first backoff elapsed");
        assertTrue(elapsedMillis < upperBound,
                "ready after " + elapsedMillis + "ms, bound is " + upperBound + "ms");

        awaitCondition(gate::isReady, 2000L, "fail-open ready");
        ConnectionStatus status = gate.status();
        assertTrue(status.degraded());
        assertEquals(2, status.failedAttempts());
        assertEquals("backend down", status.lastError());
        verify(remoteDataSource, times(2)).read(anyString(), anyMap(), anyInt());
    }

    @Test
    void strict_exhaustedAttempts_rejectsQueuedAndNewOperations() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("backend down")));
        gate = newGate(fastSettings().withMaxAttempts(1).withFailurePolicy(FailurePolicy.STRICT));

        CompletableFuture<String> queued = gate.executeWhenReady(() -> CompletableFuture.completedFuture("ran"));
        gate.start();

        ExecutionException queuedFailure = assertThrows(ExecutionException.class,
                () -> queued.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionException.class, queuedFailure.getCause());
        awaitCondition(() -> !gate.status().reconnecting(), 2000L, "reconnect cycle to end");
        assertEquals(ConnectionState.ERROR, gate.currentState());

        CompletableFuture<String> rejected = gate.executeWhenReady(() -> CompletableFuture.completedFuture("ran"));
        ExecutionException newFailure = assertThrows(ExecutionException.class,
                () -> rejected.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionException.class, newFailure.getCause());
    }

    @Test
    void executeWhenReady_queuedOperationTimesOut_siblingStillRuns() throws Exception {
        CompletableFuture<List<Map<String, Object>>> reachability = new CompletableFuture<>();
        when(remoteDataSource.read(anyString(), anyMap(), anyInt())).thenReturn(reachability);
        gate = newGate(fastSettings());
        gate.start();

        CompletableFuture<String> impatient = gate.executeWhenReady(
                () -> CompletableFuture.completedFuture("late"), Duration.ofMillis(50));
        CompletableFuture<String> patient = gate.executeWhenReady(
                () -> CompletableFuture.completedFuture("done"), Duration.ofSeconds(5));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> impatient.get(2, TimeUnit.SECONDS));
        assertInstanceOf(OperationTimeoutException.class, failure.getCause());
        awaitCondition(() -> gate.getQueueLength() == 1, 2000L, "timed-out operation to leave the queue");

        reachability.complete(List.of());
        assertEquals("done", patient.get(2, TimeUnit.SECONDS));
    }

    @Test
    void executeWhenReady_whenReady_hungOperationTimesOut() throws Exception {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings().withOperationTimeout(Duration.ofMillis(100)));
        gate.start();
        awaitCondition(gate::isReady, 2000L, "gate to become ready");

        CompletableFuture<String> neverCompletes = new CompletableFuture<>();
        CompletableFuture<String> hung = gate.executeWhenReady(() -> neverCompletes);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> hung.get(2, TimeUnit.SECONDS));
        OperationTimeoutException timeout = assertInstanceOf(OperationTimeoutException.class, failure.getCause());
        assertEquals(Duration.ofMillis(100), timeout.getTimeout());

        neverCompletes.complete("too late");
        assertTrue(hung.isCompletedExceptionally());
        assertEquals("ok", gate.executeWhenReady(() -> CompletableFuture.completedFuture("ok"))
                .get(2, TimeUnit.SECONDS));
    }

    @Test
    void executeWhenReady_rejectsNonPositiveTimeout() {
        gate = newGate(fastSettings());

        assertThrows(IllegalArgumentException.class,
                () -> gate.executeWhenReady(() -> CompletableFuture.completedFuture("x"), Duration.ZERO));
    }

    @Test
    void executeWhenReady_operationThrows_failsOnlyThatOperation() throws Exception {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings());
        gate.start();
        awaitCondition(gate::isReady, 2000L, "gate to become ready");

        CompletableFuture<String> broken = gate.executeWhenReady(() -> {
            throw new IllegalArgumentException("bad operation");
        });
        CompletableFuture<String> healthy = gate.executeWhenReady(() -> CompletableFuture.completedFuture("ok"));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> broken.get(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, failure.getCause());
        assertEquals("ok", healthy.get(2, TimeUnit.SECONDS));
    }

    @Test
    void retryConnection_withinDebounceWindow_isIgnored() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings());

        assertTrue(gate.retryConnection());
        awaitCondition(() -> gate.isReady() && !gate.status().reconnecting(), 2000L, "first reconnect");

        clock.advanceMillis(1500);
        assertFalse(gate.retryConnection());

        clock.advanceMillis(1000);
        assertTrue(gate.retryConnection());
        awaitCondition(() -> gate.isReady() && !gate.status().reconnecting(), 2000L, "second reconnect");
        verify(remoteDataSource, times(2)).read(anyString(), anyMap(), anyInt());
    }

    @Test
    void start_whileReconnectInFlight_isNoOp() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt())).thenReturn(new CompletableFuture<>());
        gate = newGate(fastSettings());

        assertTrue(gate.start());
        assertFalse(gate.start());

        verify(remoteDataSource, timeout(1000)).read(anyString(), anyMap(), anyInt());
        assertTrue(gate.status().reconnecting());
        verify(remoteDataSource, times(1)).read(anyString(), anyMap(), anyInt());
    }

    @Test
    void reconnect_checksRotateAcrossResources() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));
        gate = newGate(fastSettings().withMaxAttempts(3));

        gate.start();
        awaitCondition(gate::isReady, 2000L, "fail-open ready");

        ArgumentCaptor<String> resources = ArgumentCaptor.forClass(String.class);
        verify(remoteDataSource, times(3)).read(resources.capture(), anyMap(), anyInt());
        assertEquals(List.of("interactive_assignment", "user_progress", "interactive_assignment"),
                resources.getAllValues());
    }

    @Test
    void onStateChange_notifiesEachTransition() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings());
        List<String> transitions = new CopyOnWriteArrayList<>();
        gate.onStateChange((previous, current) -> transitions.add(previous + "->" + current.state()));
        gate.onStateChange((previous, current) -> {
            throw new IllegalStateException("listener failure");
        });

        gate.start();
        awaitCondition(() -> transitions.size() == 2, 2000L, "two transitions");

        assertEquals(List.of("INITIALIZING->CONNECTING", "CONNECTING->READY"), transitions);
        assertTrue(gate.isReady());
    }

    @Test
    void removeStateListener_stopsNotifications() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        gate = newGate(fastSettings());
        List<String> removedSaw = new CopyOnWriteArrayList<>();
        List<String> keptSaw = new CopyOnWriteArrayList<>();
        ConnectionStateListener removed = (previous, current) -> removedSaw.add(current.state().name());
        gate.onStateChange(removed);
        gate.onStateChange((previous, current) -> keptSaw.add(current.state().name()));

        gate.removeStateListener(removed);
        gate.start();
        awaitCondition(() -> keptSaw.size() == 2, 2000L, "two transitions");

        assertTrue(removedSaw.isEmpty());
    }

    @Test
    void shutdown_rejectsQueuedOperations() {
        when(remoteDataSource.read(anyString(), anyMap(), anyInt())).thenReturn(new CompletableFuture<>());
        gate = newGate(fastSettings());
        gate.start();
        CompletableFuture<String> queued = gate.executeWhenReady(() -> CompletableFuture.completedFuture("never"));
        awaitCondition(() -> gate.getQueueLength() == 1, 2000L, "queued operation");

        gate.shutdown();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> queued.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionException.class, failure.getCause());
        assertFalse(gate.start());
    }

    private ReadinessGate newGate(ReadinessGateSettings settings) {
        return new ReadinessGate(remoteDataSource, settings, scheduler, clock);
    }

    private ReadinessGateSettings fastSettings() {
        return ReadinessGateSettings.defaults(CHECKED_RESOURCES).withBackoff(BackoffPolicy.of(5, 1.0, 5));
    }

    private CompletableFuture<Integer> record(List<Integer> executed, int value) {
        executed.add(value);
        return CompletableFuture.completedFuture(value);
    }

    private void awaitCondition(BooleanSupplier condition, long timeoutMillis, String description) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(10L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + description);
            }
        }
        fail("Timed out waiting for " + description + ", state=" + gate.currentState());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant current;

        private MutableClock(Instant initial) {
            this.current = initial;
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }

        private void advanceMillis(long millis) {
            current = current.plusMillis(millis);
        }
    }
}

package io.arbor.core.execution.control;

import io.arbor.core.exception.ExecutionStoppedException;
import io.arbor.core.execution.CancellationToken;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/// Pause/resume/stop handle for one execution.
///
/// The executing thread calls {@link #awaitStep()} at every step boundary; controlling
/// threads call {@link #pause()}, {@link #resume()} and {@link #stop()}. Stopping also
/// cancels the {@link CancellationToken} so the interpreter notices even without a
/// listener.
///
/// @implNote Thread-safe. Flags are guarded by a single lock; waiters park on a condition.
public final class ExecutionControl {

    private final String executionId;
    private final Instant createdAt;
    private final CancellationToken token = CancellationToken.create();

    private final Lock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private boolean paused;
    private boolean stopped;

    public ExecutionControl(String executionId, Instant createdAt) {
        this.executionId = Objects.requireNonNull(executionId, "executionId must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /// Returns the token to pass to the interpreter.
    ///
    /// @return cancellation token tied to {@link #stop()}, never null
    public CancellationToken getToken() {
        return token;
    }

    public void pause() {
        lock.lock();
        try {
            if (!stopped) {
                paused = true;
            }
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /// Requests a stop. A paused execution is woken so it can observe the stop.
    public void stop() {
        lock.lock();
        try {
            stopped = true;
            paused = false;
            token.cancel();
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    /// Blocks while paused, then fails if a stop was requested.
    ///
    /// @throws ExecutionStoppedException if stopped, or if the thread is interrupted while
    /// waiting
    public void awaitStep() {
        lock.lock();
        try {
            while (paused && !stopped) {
                stateChanged.await();
            }
            if (stopped) {
                throw new ExecutionStoppedException("Execution " + executionId + " stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException(
                    "Execution " + executionId + " interrupted while paused");
        } finally {
            lock.unlock();
        }
    }
}

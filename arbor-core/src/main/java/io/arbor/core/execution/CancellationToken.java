package io.arbor.core.execution;

import io.arbor.core.exception.ExecutionStoppedException;
import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag checked by the interpreter at every step boundary.
///
/// @implNote Thread-safe. Cancellation is one-way.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /// Returns a token that is never cancelled unless {@link #cancel()} is called on it.
    ///
    /// @return a fresh token, never null
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// @throws ExecutionStoppedException if the token has been cancelled
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ExecutionStoppedException("Execution cancelled");
        }
    }
}

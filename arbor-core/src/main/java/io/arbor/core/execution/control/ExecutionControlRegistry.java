package io.arbor.core.execution.control;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// Registry of live execution controls keyed by execution id.
///
/// Controls are created when an execution starts and removed when it ends. Records older
/// than the TTL, left by executions that never cleaned up, are dropped by
/// {@link #purgeStale()}, which every {@link #create(String)} runs first. Operations on one
/// id never affect another.
///
/// @implNote Thread-safe via ConcurrentHashMap.
public class ExecutionControlRegistry {

    private static final Logger logger = Logger.getLogger(ExecutionControlRegistry.class.getName());

    /// Default record lifetime.
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(600);

    private final Map<String, ExecutionControl> controls = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ExecutionControlRegistry() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    /// @param ttl lifetime after which a record is stale, not null
    /// @param clock time source, not null
    public ExecutionControlRegistry(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Creates and registers a control, replacing any previous one with the same id.
    ///
    /// Stale records are purged before the new control is registered.
    ///
    /// @param executionId execution id, not null
    /// @return the new control, never null
    public ExecutionControl create(String executionId) {
        purgeStale();
        ExecutionControl control = new ExecutionControl(executionId, clock.instant());
        ExecutionControl previous = controls.put(executionId, control);
        if (previous != null) {
            previous.stop();
        }
        return control;
    }

    public Optional<ExecutionControl> get(String executionId) {
        return Optional.ofNullable(controls.get(executionId));
    }

    /// @return `true` if the execution exists and was paused
    public boolean pause(String executionId) {
        return apply(executionId, ExecutionControl::pause);
    }

    /// @return `true` if the execution exists and was resumed
    public boolean resume(String executionId) {
        return apply(executionId, ExecutionControl::resume);
    }

    /// @return `true` if the execution exists and a stop was requested
    public boolean stop(String executionId) {
        return apply(executionId, ExecutionControl::stop);
    }

    public void remove(String executionId) {
        controls.remove(executionId);
    }

    public int size() {
        return controls.size();
    }

    /// Stops and drops every control older than the TTL.
    ///
    /// @return number of records removed
    public int purgeStale() {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        for (Map.Entry<String, ExecutionControl> entry : controls.entrySet()) {
            if (entry.getValue().getCreatedAt().isBefore(cutoff)
                    && controls.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().stop();
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged " + removed + " stale execution control(s)");
        }
        return removed;
    }

    /// Stops and drops every registered control.
    ///
    /// @return number of records removed
    public int stopAll() {
        int removed = 0;
        for (Map.Entry<String, ExecutionControl> entry : controls.entrySet()) {
            if (controls.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().stop();
                removed++;
            }
        }
        return removed;
    }

    private boolean apply(String executionId, Consumer<ExecutionControl> action) {
        ExecutionControl control = controls.get(executionId);
        if (control == null) {
            return false;
        }
        action.accept(control);
        return true;
    }
}

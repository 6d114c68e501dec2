package io.arbor.core.execution.control;

import static org.assertj.core.api.Assertions.assertThat;

import io.arbor.core.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ExecutionControlRegistryTest {

    private final MutableClock clock = new MutableClock();
    private final ExecutionControlRegistry registry =
            new ExecutionControlRegistry(Duration.ofMinutes(10), clock);

    @Test
    void shouldControlOnlyTheNamedExecution() {
        // Given
        ExecutionControl first = registry.create("a");
        ExecutionControl second = registry.create("b");

        // When
        boolean paused = registry.pause("a");
        boolean stopped = registry.stop("b");

        // Then
        assertThat(paused).isTrue();
        assertThat(stopped).isTrue();
        assertThat(first.isPaused()).isTrue();
        assertThat(first.isStopped()).isFalse();
        assertThat(second.isStopped()).isTrue();
        assertThat(registry.resume("a")).isTrue();
        assertThat(first.isPaused()).isFalse();
    }

    @Test
    void shouldReportUnknownExecutions() {
        assertThat(registry.pause("missing")).isFalse();
        assertThat(registry.resume("missing")).isFalse();
        assertThat(registry.stop("missing")).isFalse();
        assertThat(registry.get("missing")).isEmpty();
    }

    @Test
    void shouldStopReplacedControl() {
        // Given
        ExecutionControl previous = registry.create("a");

        // When
        ExecutionControl current = registry.create("a");

        // Then
        assertThat(previous.isStopped()).isTrue();
        assertThat(registry.get("a")).containsSame(current);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldPurgeOnlyStaleControls() {
        // Given
        ExecutionControl old = registry.create("old");
        clock.advance(Duration.ofMinutes(5));
        registry.create("fresh");
        clock.advance(Duration.ofMinutes(6));

        // When
        int removed = registry.purgeStale();

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(old.isStopped()).isTrue();
        assertThat(registry.get("old")).isEmpty();
        assertThat(registry.get("fresh")).isPresent();
    }

    @Test
    void shouldPurgeStaleControlsWhenCreating() {
        // Given
        ExecutionControl abandoned = registry.create("abandoned");
        clock.advance(Duration.ofMinutes(11));

        // When
        registry.create("next");

        // Then
        assertThat(abandoned.isStopped()).isTrue();
        assertThat(registry.get("abandoned")).isEmpty();
        assertThat(registry.get("next")).isPresent();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldStopEverythingOnStopAll() {
        // Given
        ExecutionControl a = registry.create("a");
        ExecutionControl b = registry.create("b");

        // When
        int removed = registry.stopAll();

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(a.isStopped()).isTrue();
        assertThat(b.isStopped()).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    void shouldForgetRemovedControl() {
        registry.create("a");

        registry.remove("a");

        assertThat(registry.get("a")).isEmpty();
    }
}

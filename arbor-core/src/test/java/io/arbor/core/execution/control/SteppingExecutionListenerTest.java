package io.arbor.core.execution.control;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.arbor.core.exception.ExecutionStoppedException;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.StepEvent;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SteppingExecutionListenerTest {

    @Mock private ExecutionListener delegate;

    private final StepEvent event = new StepEvent("s", "start", "Start", 0, Map.of(), null);

    @Test
    void shouldForwardEventWhileRunning() {
        // Given
        ExecutionControl control = new ExecutionControl("exec", Instant.EPOCH);
        SteppingExecutionListener listener = new SteppingExecutionListener(control, delegate);

        // When
        listener.onStep(event);

        // Then
        verify(delegate).onStep(event);
    }

    @Test
    void shouldNotForwardAfterStop() {
        // Given
        ExecutionControl control = new ExecutionControl("exec", Instant.EPOCH);
        control.stop();
        SteppingExecutionListener listener = new SteppingExecutionListener(control, delegate);

        // When / Then
        assertThatThrownBy(() -> listener.onStep(event))
                .isInstanceOf(ExecutionStoppedException.class)
                .hasMessage("Execution exec stopped");
        verify(delegate, never()).onStep(any());
    }
}

package io.arbor.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.arbor.core.execution.StepEvent;
import io.arbor.core.execution.SubflowContext;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseExecutionListenerTest {

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintStepLineWithVariables() {
        // Given
        VerboseExecutionListener listener = new VerboseExecutionListener(out, false);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("var_age_int", 30L);
        context.put("var_member_bool", true);

        // When
        listener.onStep(new StepEvent("n2", "decision", "Age >= 18?", 1, context, null));

        // Then
        assertThat(output())
                .isEqualTo("  [1] decision  Age >= 18? (n2)\n"
                        + "      var_age_int = 30\n"
                        + "      var_member_bool = true\n");
    }

    @Test
    void shouldIndentAndTagSubworkflowSteps() {
        // Given
        VerboseExecutionListener listener = new VerboseExecutionListener(out, false);
        SubflowContext subflow = new SubflowContext("p", "risk-check", 1);

        // When
        listener.onStep(new StepEvent("s1", "start", "Check", 0, Map.of(), subflow));

        // Then
        assertThat(output()).isEqualTo("    [0] start  Check (s1)  ↳ risk-check\n");
    }

    @Test
    void shouldColorOutputWhenEnabled() {
        // Given
        VerboseExecutionListener listener = new VerboseExecutionListener(out, true);

        // When
        listener.onStep(new StepEvent("e", "end", "Done", 2, Map.of(), null));

        // Then
        assertThat(output()).contains("\033[").contains("Done").contains("end");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }
}

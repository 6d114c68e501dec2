package io.arbor.cli.execution;

import io.arbor.cli.ui.AnsiStyles;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.StepEvent;
import io.arbor.core.execution.SubflowContext;
import java.io.PrintStream;
import java.util.Map;

/// Execution listener that prints every step to the terminal.
///
/// Sub-workflow steps are indented by their nesting depth and tagged with the called
/// workflow id. Variable values are listed after the step line, one per line.
///
/// ### Output Format
/// ```
///   [0] start  Begin (n1)
///   [1] decision  Age >= 18? (n2)
///       var_age_int = 30
///     [0] start  Check (s1)  ↳ risk-check
/// ```
///
/// @implNote **Not thread-safe**. Output may interleave if shared between executions.
public class VerboseExecutionListener implements ExecutionListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// Creates a verbose listener.
    ///
    /// @param out output stream for printing (typically System.out), not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseExecutionListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onStep(StepEvent event) {
        String indent = "  ".repeat(1 + event.subflowContext().map(SubflowContext::depth).orElse(0));
        StringBuilder line = new StringBuilder(indent)
                .append(styles.gray("[" + event.stepIndex() + "]"))
                .append(' ')
                .append(styles.accent(event.nodeType()))
                .append("  ")
                .append(styles.bold(String.valueOf(event.nodeLabel())))
                .append(styles.gray(" (" + event.nodeId() + ")"));
        event.subflowContext()
                .ifPresent(subflow -> line.append("  ").append(styles.gray("↳ " + subflow.subworkflowId())));
        out.println(line);

        for (Map.Entry<String, Object> entry : event.context().entrySet()) {
            out.println(indent + "    " + styles.gray(entry.getKey() + " = " + entry.getValue()));
        }
    }
}

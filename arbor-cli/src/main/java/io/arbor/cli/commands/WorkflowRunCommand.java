package io.arbor.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.arbor.cli.execution.VerboseExecutionListener;
import io.arbor.cli.ui.AnsiStyles;
import io.arbor.core.ArborEnvironment;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.ExecutionResult;
import io.arbor.core.execution.SubflowResult;
import io.arbor.core.workflow.Workflow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command for executing a workflow.
///
/// Validates the workflow in the configured mode, then interprets it with the given inputs
/// and prints the output, the visited path and every sub-workflow call.
///
/// ### Usage
/// ```bash
/// arbor run [-v] [--no-color] [-i <inputs>] [-w <workflows-dir>] <workflow.json>
/// ```
///
/// ### Options
/// - `-i, --inputs` - Inputs as a JSON object, or `@path` to a JSON file
/// - `-v, --verbose` - Print each step with the current variable values
/// - `--no-color` - Disable ANSI color output
///
/// @see io.arbor.core.execution.WorkflowInterpreter
@Command(name = "run", description = "Run a workflow")
public class WorkflowRunCommand extends WorkflowCommand {

    @Option(
            names = {"-i", "--inputs"},
            description = "Inputs as a JSON object, or @path to a JSON file")
    private String inputs;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show every step with variable values")
    private boolean verbose = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Override
    protected void execute() throws IOException {
        AnsiStyles styles = AnsiStyles.of(color);
        Workflow workflow = loadWorkflow();
        Map<String, Object> inputValues = parseInputs(inputs);

        System.out.printf(
                "%s %s%n",
                styles.bullet(),
                styles.bold("Running workflow: " + workflow.getName()));

        try (ArborEnvironment environment = createEnvironment(workflow)) {
            ExecutionListener listener =
                    verbose ? new VerboseExecutionListener(System.out, color) : ExecutionListener.NOOP;
            ExecutionResult result =
                    environment.getConfig().getStepDelay().isZero()
                            ? environment.execute(workflow, inputValues, listener)
                            : environment.executeStepped(
                                    UUID.randomUUID().toString(), workflow, inputValues, listener);
            printResult(styles, result);
        }
    }

    private void printResult(AnsiStyles styles, ExecutionResult result) {
        if (!result.path().isEmpty()) {
            System.out.println("  Path: " + String.join(" " + styles.arrow() + " ", result.path()));
        }
        for (SubflowResult call : result.subflowResults()) {
            System.out.printf(
                    "  Subflow %s (%s) from %s: %s%n",
                    call.subworkflowId(),
                    call.subworkflowName(),
                    call.nodeId(),
                    call.success() ? String.valueOf(call.output()) : "failed - " + call.error());
        }

        if (result.success()) {
            System.out.printf(
                    "%s %s%n",
                    styles.checkmark(),
                    styles.bold("Output: " + result.output()));
        } else if (result.stopped()) {
            System.out.printf("%s %s%n", styles.crossmark(), styles.warn("Stopped: " + result.error()));
            fail("Execution stopped");
        } else {
            System.err.println(result.error());
            fail("Execution failed");
        }
    }

    /// Parses `--inputs` as a JSON object, reading the file when prefixed with `@`.
    ///
    /// Integral numbers are read as `Long` so they match `int` variables directly.
    ///
    /// @param raw option value, may be null
    /// @return input map, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the JSON is not an object
    static Map<String, Object> parseInputs(String raw) throws IOException {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        String json = raw.startsWith("@") ? Files.readString(Path.of(raw.substring(1))) : raw;
        ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);
        try {
            return mapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Inputs must be a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}

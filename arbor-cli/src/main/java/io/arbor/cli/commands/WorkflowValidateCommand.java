package io.arbor.cli.commands;

import io.arbor.core.ArborEnvironment;
import io.arbor.core.validation.ValidationMode;
import io.arbor.core.validation.ValidationResult;
import io.arbor.core.workflow.Workflow;
import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command for validating a workflow document.
///
/// Runs the validator and prints every finding; exits with status 1 when any error is
/// reported.
///
/// ### Usage
/// ```bash
/// arbor validate [--lenient] [-w <workflows-dir>] <workflow.json>
/// ```
///
/// ### Options
/// - `--lenient` - Structural checks only; skips branching, reachability and semantic rules
///
/// @see io.arbor.core.validation.WorkflowValidator
@Command(name = "validate", description = "Validate a workflow document")
public class WorkflowValidateCommand extends WorkflowCommand {

    @Option(
            names = {"--lenient"},
            description = "Only check structure (ids, edges, start node, cycles)")
    private boolean lenient = false;

    @Override
    protected void execute() throws IOException {
        Workflow workflow = loadWorkflow();
        try (ArborEnvironment environment = createEnvironment(workflow)) {
            ValidationMode mode = lenient ? ValidationMode.LENIENT : ValidationMode.STRICT;
            ValidationResult result = environment.getValidator().validate(workflow, mode);

            if (result.valid()) {
                System.out.println(" [OK] Workflow is valid!");
                System.out.println("   Name: " + workflow.getName());
                System.out.println("   Nodes: " + workflow.getNodes().size());
                System.out.println("   Edges: " + workflow.getEdges().size());
                System.out.println("   Inputs: " + workflow.inputVariables().size());
            } else {
                System.err.println(result.format());
                fail("Validation failed with " + result.errors().size() + " error(s)");
            }
        }
    }
}

package io.arbor.cli;

import io.arbor.cli.commands.WorkflowCompileCommand;
import io.arbor.cli.commands.WorkflowRunCommand;
import io.arbor.cli.commands.WorkflowValidateCommand;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Arbor CLI application.
///
/// Registers the workflow subcommands:
/// - `validate` - Check a workflow document and list every finding
/// - `run` - Execute a workflow with JSON inputs
/// - `compile` - Emit the Java source equivalent of a workflow
///
/// @see WorkflowValidateCommand
/// @see WorkflowRunCommand
/// @see WorkflowCompileCommand
@Command(
        name = "arbor",
        description = "Arbor workflow engine",
        mixinStandardHelpOptions = true,
        version = "arbor 0.1.0",
        subcommands = {
            WorkflowValidateCommand.class,
            WorkflowRunCommand.class,
            WorkflowCompileCommand.class
        })
public class ArborCli {

    public static void main(String[] args) {
        configureLogging();
        System.exit(new CommandLine(new ArborCli()).execute(args));
    }

    private static void configureLogging() {
        try (InputStream config = ArborCli.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }
}

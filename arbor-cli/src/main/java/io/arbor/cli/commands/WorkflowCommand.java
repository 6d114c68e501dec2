package io.arbor.cli.commands;

import io.arbor.core.ArborConfig;
import io.arbor.core.ArborEnvironment;
import io.arbor.core.ArborFactory;
import io.arbor.core.workflow.InMemoryWorkflowRepository;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.WorkflowRepository;
import io.arbor.serialization.JacksonValueDecoder;
import io.arbor.serialization.WorkflowFiles;
import io.arbor.serialization.WorkflowSerializer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for all workflow-related CLI commands.
///
/// Provides the shared options and the workflow loading pipeline. Subclasses implement the
/// command behavior in {@link #execute()} and report failure through {@link #fail(String)},
/// which sets a non-zero exit code.
///
/// ### Configuration Resolution
/// `arbor.*` properties are read from, in increasing priority:
/// 1. the file given with `-c` / `--config`
/// 2. JVM system properties
///
/// ### Sub-workflows
/// Every `*.json` document in the `-w` / `--workflows-dir` directory is loaded into the
/// repository the interpreter and compiler resolve subprocess calls against. The workflow
/// given as the positional parameter is saved there too, so it can call itself by id
/// (which the cycle guard then reports).
///
/// @implNote Subclasses must be annotated with `@Command`.
/// @see WorkflowRunCommand
/// @see WorkflowValidateCommand
/// @see WorkflowCompileCommand
public abstract class WorkflowCommand implements Runnable, IExitCodeGenerator {

    @Parameters(index = "0", description = "Workflow JSON document")
    protected Path workflowFile;

    @Option(
            names = {"-w", "--workflows-dir"},
            description = "Directory of workflow JSON documents available as sub-workflows")
    protected Path workflowsDir;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with arbor.* settings")
    protected Path configFile;

    private int exitCode;

    @Override
    public final void run() {
        try {
            execute();
        } catch (IOException | RuntimeException e) {
            fail(e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    protected abstract void execute() throws IOException;

    /// Prints a failure line to stderr and marks the command as failed.
    ///
    /// @param message failure description, may be null
    protected void fail(String message) {
        System.err.println(" [FAIL] " + (message != null ? message : "unexpected error"));
        exitCode = 1;
    }

    /// Loads the workflow named by the positional parameter.
    ///
    /// @return parsed workflow, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the document is malformed
    protected Workflow loadWorkflow() throws IOException {
        if (!Files.isRegularFile(workflowFile)) {
            throw new IOException("Workflow file not found: " + workflowFile);
        }
        return WorkflowSerializer.read(workflowFile);
    }

    /// Builds an engine environment from the resolved configuration, with sub-workflows
    /// from `--workflows-dir` and the given workflow registered.
    ///
    /// @param workflow the workflow being processed, not null
    /// @return new environment, never null; the caller closes it
    /// @throws IOException if the configuration or a sub-workflow file cannot be read
    protected ArborEnvironment createEnvironment(Workflow workflow) throws IOException {
        WorkflowRepository repository = new InMemoryWorkflowRepository();
        if (workflowsDir != null) {
            WorkflowFiles.loadDirectory(workflowsDir, repository);
        }
        if (workflow.getId() != null && !workflow.getId().isBlank()) {
            repository.save(workflow);
        }
        return ArborFactory.createEnvironment(
                loadConfig(), repository, new JacksonValueDecoder());
    }

    /// Resolves the configuration from `--config` and system properties.
    ///
    /// @return configuration, never null
    /// @throws IOException if the config file cannot be read
    protected ArborConfig loadConfig() throws IOException {
        Properties properties = new Properties();
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(configFile)) {
                properties.load(in);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("arbor.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return ArborConfig.fromProperties(properties);
    }
}

package io.arbor.core;

import io.arbor.core.compiler.CompilationResult;
import io.arbor.core.compiler.JavaWorkflowCompiler;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.ExecutionResult;
import io.arbor.core.execution.WorkflowInterpreter;
import io.arbor.core.execution.control.ExecutionControl;
import io.arbor.core.execution.control.ExecutionControlRegistry;
import io.arbor.core.execution.control.SteppingExecutionListener;
import io.arbor.core.validation.ValidationMode;
import io.arbor.core.validation.ValidationResult;
import io.arbor.core.validation.WorkflowValidator;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.WorkflowRepository;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Container for the wired engine components.
///
/// Created by {@link ArborFactory}. Besides the component getters it offers the common
/// flows: validate, execute (optionally stepped under an {@link ExecutionControl}) and
/// compile, each applying the configured validation mode first.
///
/// @implNote Thread-safe as long as the repository is. Closing stops every execution still
/// registered with the control registry.
public final class ArborEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ArborEnvironment.class.getName());

    private final ArborConfig config;
    private final WorkflowValidator validator;
    private final WorkflowInterpreter interpreter;
    private final JavaWorkflowCompiler compiler;
    private final ExecutionControlRegistry controlRegistry;
    private final WorkflowRepository workflowRepository;

    public ArborEnvironment(
            ArborConfig config,
            WorkflowValidator validator,
            WorkflowInterpreter interpreter,
            JavaWorkflowCompiler compiler,
            ExecutionControlRegistry controlRegistry,
            WorkflowRepository workflowRepository) {
        this.config = config;
        this.validator = validator;
        this.interpreter = interpreter;
        this.compiler = compiler;
        this.controlRegistry = controlRegistry;
        this.workflowRepository = workflowRepository;
    }

    public ArborConfig getConfig() {
        return config;
    }

    public WorkflowValidator getValidator() {
        return validator;
    }

    public WorkflowInterpreter getInterpreter() {
        return interpreter;
    }

    public JavaWorkflowCompiler getCompiler() {
        return compiler;
    }

    public ExecutionControlRegistry getControlRegistry() {
        return controlRegistry;
    }

    public WorkflowRepository getWorkflowRepository() {
        return workflowRepository;
    }

    /// Validates in the configured mode (strict unless `strictValidation` is off).
    ///
    /// @param workflow the workflow, not null
    /// @return the validation result, never null
    public ValidationResult validate(Workflow workflow) {
        return validator.validate(
                workflow, config.isStrictValidation() ? ValidationMode.STRICT : ValidationMode.LENIENT);
    }

    /// Validates, then executes the workflow.
    ///
    /// @param workflow the workflow, not null
    /// @param inputs input values keyed by variable id or name, not null
    /// @return the result; an invalid workflow yields a failure carrying the formatted errors
    public ExecutionResult execute(Workflow workflow, Map<String, Object> inputs) {
        return execute(workflow, inputs, ExecutionListener.NOOP);
    }

    /// Validates, then executes the workflow with a step listener.
    ///
    /// @param workflow the workflow, not null
    /// @param inputs input values keyed by variable id or name, not null
    /// @param listener step listener, not null
    /// @return the result, never null
    public ExecutionResult execute(
            Workflow workflow, Map<String, Object> inputs, ExecutionListener listener) {
        ValidationResult validation = validate(workflow);
        if (!validation.valid()) {
            return rejected(workflow, validation);
        }
        return interpreter.execute(workflow, inputs, listener);
    }

    /// Executes under a registered {@link ExecutionControl}, so other threads can pause,
    /// resume or stop the run through {@link #getControlRegistry()} using the execution id.
    ///
    /// Blocks the calling thread until the run ends. The control is removed afterwards.
    ///
    /// @param executionId id under which the control is registered, not null
    /// @param workflow the workflow, not null
    /// @param inputs input values keyed by variable id or name, not null
    /// @param listener receives every step after pause handling, not null
    /// @return the result; `stopped` is set when the run was stopped
    public ExecutionResult executeStepped(
            String executionId,
            Workflow workflow,
            Map<String, Object> inputs,
            ExecutionListener listener) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        ValidationResult validation = validate(workflow);
        if (!validation.valid()) {
            return rejected(workflow, validation);
        }
        ExecutionControl control = controlRegistry.create(executionId);
        try {
            return interpreter.execute(
                    workflow,
                    inputs,
                    new SteppingExecutionListener(control, listener, config.getStepDelay()),
                    control.getToken());
        } finally {
            controlRegistry.remove(executionId);
        }
    }

    /// Validates, then compiles the workflow with the configured class and package names.
    ///
    /// @param workflow the workflow, not null
    /// @return the compilation result; an invalid workflow yields a failure
    public CompilationResult compile(Workflow workflow) {
        ValidationResult validation = validate(workflow);
        if (!validation.valid()) {
            logger.fine(() -> "Refusing to compile invalid workflow '" + workflow.getId() + "'");
            return CompilationResult.failure(validation.format());
        }
        return compiler.compile(
                workflow, config.getCompiledClassName(), config.getCompiledPackage());
    }

    private static ExecutionResult rejected(Workflow workflow, ValidationResult validation) {
        logger.fine(() -> "Refusing to execute invalid workflow '" + workflow.getId() + "'");
        return ExecutionResult.failure(validation.format(), List.of(), Map.of(), List.of());
    }

    @Override
    public void close() {
        int stopped = controlRegistry.stopAll();
        if (stopped > 0) {
            logger.info("Stopped " + stopped + " running execution(s) on close");
        }
    }
}

package io.arbor.core;

import io.arbor.core.compiler.JavaWorkflowCompiler;
import io.arbor.core.execution.ValueDecoder;
import io.arbor.core.execution.WorkflowInterpreter;
import io.arbor.core.execution.control.ExecutionControlRegistry;
import io.arbor.core.template.SimpleTemplateResolver;
import io.arbor.core.template.TemplateResolver;
import io.arbor.core.validation.WorkflowValidator;
import io.arbor.core.workflow.InMemoryWorkflowRepository;
import io.arbor.core.workflow.WorkflowRepository;
import java.time.Clock;
import java.util.Objects;

/// Bootstrap entry point wiring the engine components into an {@link ArborEnvironment}.
///
/// The interpreter and the compiler share one {@link WorkflowRepository}, which doubles as
/// their sub-workflow resolver: saving a workflow makes it callable from subprocess nodes.
///
/// ### Usage
/// {@snippet :
/// try (ArborEnvironment env = ArborFactory.createEnvironment()) {
///     env.getWorkflowRepository().save(workflow);
///     ExecutionResult result = env.execute(workflow, Map.of("Age", 30));
/// }
/// }
///
/// @see ArborConfig
public final class ArborFactory {

    private ArborFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and an in-memory repository.
    ///
    /// @return a new environment, never null
    public static ArborEnvironment createEnvironment() {
        return createEnvironment(new ArborConfig());
    }

    /// Creates an environment with the given configuration and an in-memory repository.
    ///
    /// @param config configuration, not null
    /// @return a new environment, never null
    public static ArborEnvironment createEnvironment(ArborConfig config) {
        return createEnvironment(config, new InMemoryWorkflowRepository(), null);
    }

    /// Creates an environment with all collaborators.
    ///
    /// @param config configuration, not null
    /// @param repository workflow store used for sub-workflow resolution, not null
    /// @param valueDecoder decoder for `json` output, may be null (output stays text)
    /// @return a new environment, never null
    public static ArborEnvironment createEnvironment(
            ArborConfig config, WorkflowRepository repository, ValueDecoder valueDecoder) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(repository, "repository must not be null");

        TemplateResolver templateResolver = new SimpleTemplateResolver();
        WorkflowValidator validator = new WorkflowValidator(templateResolver);
        WorkflowInterpreter interpreter =
                new WorkflowInterpreter(
                        repository, valueDecoder, templateResolver, config.getMaxSteps());
        JavaWorkflowCompiler compiler = new JavaWorkflowCompiler(repository);
        ExecutionControlRegistry controlRegistry =
                new ExecutionControlRegistry(config.getControlTtl(), Clock.systemUTC());

        return new ArborEnvironment(
                config, validator, interpreter, compiler, controlRegistry, repository);
    }
}

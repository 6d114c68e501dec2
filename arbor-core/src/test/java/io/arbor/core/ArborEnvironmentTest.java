package io.arbor.core;

import static io.arbor.core.WorkflowFixtures.bmi;
import static io.arbor.core.WorkflowFixtures.end;
import static io.arbor.core.WorkflowFixtures.flow;
import static io.arbor.core.WorkflowFixtures.process;
import static io.arbor.core.WorkflowFixtures.start;
import static io.arbor.core.WorkflowFixtures.subprocess;
import static org.assertj.core.api.Assertions.assertThat;

import io.arbor.core.compiler.CompilationResult;
import io.arbor.core.compiler.JavaWorkflowCompiler;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.ExecutionResult;
import io.arbor.core.execution.StepEvent;
import io.arbor.core.execution.WorkflowInterpreter;
import io.arbor.core.execution.control.ExecutionControl;
import io.arbor.core.execution.control.ExecutionControlRegistry;
import io.arbor.core.validation.WorkflowValidator;
import io.arbor.core.workflow.InMemoryWorkflowRepository;
import io.arbor.core.workflow.Workflow;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class ArborEnvironmentTest {

    private final ArborEnvironment env = ArborFactory.createEnvironment();

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Test
    void shouldWireComponents() {
        assertThat(env.getValidator()).isNotNull();
        assertThat(env.getInterpreter()).isNotNull();
        assertThat(env.getCompiler()).isNotNull();
        assertThat(env.getControlRegistry().size()).isZero();
        assertThat(env.getWorkflowRepository().count()).isZero();
    }

    @Test
    void shouldExecuteValidWorkflow() {
        // When
        ExecutionResult result = env.execute(bmi(), Map.of("Weight", 40.0, "Height", 1.75));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Underweight");
    }

    @Test
    void shouldRefuseInvalidWorkflow() {
        // Given a node that nothing reaches
        Workflow workflow = flow("wf")
                .node(start("s"))
                .node(end("e", "Done"))
                .node(end("orphan", "Orphan"))
                .edge("s", "e")
                .build();

        // When
        ExecutionResult execution = env.execute(workflow, Map.of());
        CompilationResult compilation = env.compile(workflow);

        // Then
        assertThat(execution.success()).isFalse();
        assertThat(execution.error())
                .startsWith("Workflow validation failed:")
                .contains("Node 'Orphan' is not reachable from the start node");
        assertThat(compilation.success()).isFalse();
        assertThat(compilation.error()).startsWith("Workflow validation failed:");
    }

    @Test
    void shouldSkipSemanticChecksWhenNotStrict() {
        // Given
        ArborEnvironment lenient =
                ArborFactory.createEnvironment(ArborConfig.builder().strictValidation(false).build());
        Workflow workflow = flow("wf")
                .node(start("s"))
                .node(end("e", "Done"))
                .node(end("orphan", "Orphan"))
                .edge("s", "e")
                .build();

        // When / Then
        assertThat(lenient.validate(workflow).valid()).isTrue();
        assertThat(lenient.execute(workflow, Map.of()).output()).isEqualTo("Done");
    }

    @Test
    void shouldResolveSubworkflowsFromRepository() {
        // Given
        env.getWorkflowRepository().save(flow("child")
                .name("Child")
                .node(start("cs"))
                .node(end("ce", "42", "int", null))
                .edge("cs", "ce")
                .build());
        Workflow parent = flow("parent")
                .node(start("s"))
                .node(subprocess("p", "child", Map.of(), "answer"))
                .node(end("e", "{answer}"))
                .edge("s", "p")
                .edge("p", "e")
                .build();

        // When
        ExecutionResult result = env.execute(parent, Map.of());

        // Then
        assertThat(result.output()).isEqualTo("42");
        assertThat(result.context()).containsEntry("var_sub_answer_int", 42L);
    }

    @Test
    void shouldCompileWithConfiguredNames() {
        // Given
        ArborEnvironment configured = ArborFactory.createEnvironment(ArborConfig.builder()
                .compiledClassName("BmiRules")
                .compiledPackage("com.acme")
                .build());

        // When
        CompilationResult result = configured.compile(bmi());

        // Then
        assertThat(result.code()).startsWith("package com.acme;").contains("public final class BmiRules {");
    }

    @Test
    @Timeout(10)
    void shouldStopSteppedExecutionFromAnotherThread() throws Exception {
        // Given a workflow paused at its second step
        Workflow workflow = flow("wf")
                .node(start("s"))
                .node(process("p", "Work"))
                .node(end("e", "Done"))
                .edge("s", "p")
                .edge("p", "e")
                .build();
        CountDownLatch firstStep = new CountDownLatch(1);
        ExecutionListener listener = new ExecutionListener() {
            @Override
            public void onStep(StepEvent event) {
                if (event.stepIndex() == 0) {
                    env.getControlRegistry().pause("run-1");
                    firstStep.countDown();
                }
            }
        };

        // When
        CompletableFuture<ExecutionResult> run =
                CompletableFuture.supplyAsync(() -> env.executeStepped("run-1", workflow, Map.of(), listener));
        assertThat(firstStep.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(env.getControlRegistry().stop("run-1")).isTrue();
        ExecutionResult result = run.get(5, TimeUnit.SECONDS);

        // Then
        assertThat(result.stopped()).isTrue();
        assertThat(result.path()).containsExactly("s");
        assertThat(env.getControlRegistry().get("run-1")).isEmpty();
    }

    @Test
    void shouldPurgeAbandonedControlsWhenSteppedExecutionStarts() {
        // Given a control registered ten minutes too long ago and never removed
        MutableClock clock = new MutableClock();
        InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();
        ArborEnvironment clocked = new ArborEnvironment(
                ArborConfig.builder().build(),
                new WorkflowValidator(),
                new WorkflowInterpreter(repository),
                new JavaWorkflowCompiler(repository),
                new ExecutionControlRegistry(Duration.ofMinutes(10), clock),
                repository);
        ExecutionControl abandoned = clocked.getControlRegistry().create("abandoned");
        clock.advance(Duration.ofMinutes(11));
        Workflow workflow = flow("wf").node(start("s")).node(end("e", "Done")).edge("s", "e").build();

        // When
        ExecutionResult result =
                clocked.executeStepped("run-2", workflow, Map.of(), ExecutionListener.NOOP);

        // Then
        assertThat(result.output()).isEqualTo("Done");
        assertThat(abandoned.isStopped()).isTrue();
        assertThat(clocked.getControlRegistry().get("abandoned")).isEmpty();
        assertThat(clocked.getControlRegistry().size()).isZero();
    }
}

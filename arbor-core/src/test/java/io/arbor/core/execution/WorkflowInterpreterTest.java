package io.arbor.core.execution;

import static io.arbor.core.WorkflowFixtures.bmi;
import static io.arbor.core.WorkflowFixtures.calculation;
import static io.arbor.core.WorkflowFixtures.decision;
import static io.arbor.core.WorkflowFixtures.end;
import static io.arbor.core.WorkflowFixtures.flow;
import static io.arbor.core.WorkflowFixtures.input;
import static io.arbor.core.WorkflowFixtures.literal;
import static io.arbor.core.WorkflowFixtures.process;
import static io.arbor.core.WorkflowFixtures.ref;
import static io.arbor.core.WorkflowFixtures.start;
import static io.arbor.core.WorkflowFixtures.subprocess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.arbor.core.condition.Condition;
import io.arbor.core.exception.ExecutionStoppedException;
import io.arbor.core.template.SimpleTemplateResolver;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableType;
import io.arbor.core.workflow.Workflow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowInterpreterTest {

    @Mock private SubworkflowResolver resolver;

    private WorkflowInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new WorkflowInterpreter(resolver);
    }

    private static ExecutionListener collecting(List<StepEvent> events) {
        return new ExecutionListener() {
            @Override
            public void onStep(StepEvent event) {
                events.add(event);
            }
        };
    }

    @Nested
    @DisplayName("calculations and decisions")
    class CalculationsAndDecisions {

        @Test
        void shouldRenderTemplateWhenBmiIsAtThreshold() {
            // Given an exact BMI of 16, which is not below 16
            Map<String, Object> inputs = Map.of("Weight", 49, "Height", 1.75);

            // When
            ExecutionResult result = interpreter.execute(bmi(), inputs);

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.output()).isEqualTo("BMI 16.0");
            assertThat(result.path()).containsExactly("s", "sq", "calc", "d", "ok");
            assertThat(result.context())
                    .containsEntry("var_weight_float", 49.0)
                    .containsEntry("var_calc_height_squared_number", 3.0625)
                    .containsEntry("var_calc_bmi_number", 16.0);
        }

        @Test
        void shouldTakeTrueBranchBelowThreshold() {
            // When
            ExecutionResult result =
                    interpreter.execute(bmi(), Map.of("var_weight_float", 40.0, "var_height_float", 1.75));

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.output()).isEqualTo("Underweight");
            assertThat(result.path()).endsWith("d", "low");
            assertThat((Double) result.context().get("var_calc_bmi_number")).isCloseTo(13.06, within(0.01));
        }

        @Test
        void shouldFollowPositionalBranchesWhenEdgesAreUnlabeled() {
            // Given
            Workflow workflow = flow("wf")
                    .variable(input("var_x_int", "X", VariableType.INT))
                    .node(start("s"))
                    .node(decision("d", "X > 5"))
                    .node(end("hi", "High"))
                    .node(end("lo", "Low"))
                    .edge("s", "d")
                    .edge("d", "hi")
                    .edge("d", "lo")
                    .build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of("X", 10)).output()).isEqualTo("High");
            assertThat(interpreter.execute(workflow, Map.of("X", 5)).output()).isEqualTo("Low");
        }

        @Test
        void shouldTreatRangeBoundsAsInclusive() {
            // Given
            Workflow workflow = flow("wf")
                    .variable(input("var_score_float", "Score", VariableType.FLOAT))
                    .node(start("s"))
                    .node(decision("d", "In range?",
                            Condition.Structured.between("var_score_float", "within_range", 1, 10)))
                    .node(end("in", "Inside"))
                    .node(end("out", "Outside"))
                    .edge("s", "d")
                    .edge("d", "in", "true")
                    .edge("d", "out", "false")
                    .build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of("Score", 1)).output()).isEqualTo("Inside");
            assertThat(interpreter.execute(workflow, Map.of("Score", 10.0)).output()).isEqualTo("Inside");
            assertThat(interpreter.execute(workflow, Map.of("Score", 10.5)).output()).isEqualTo("Outside");
        }

        @Test
        void shouldReportConditionEvaluationFailure() {
            // Given
            Workflow workflow = flow("wf")
                    .node(start("s"))
                    .node(decision("d", "Missing > 1"))
                    .node(end("t", "T"))
                    .node(end("f", "F"))
                    .edge("s", "d")
                    .edge("d", "t", "yes")
                    .edge("d", "f", "no")
                    .build();

            // When
            ExecutionResult result = interpreter.execute(workflow, Map.of());

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error())
                    .isEqualTo("Failed to evaluate condition 'Missing > 1' at node 'd': "
                            + "Variable 'Missing' not found in context");
            assertThat(result.path()).containsExactly("s", "d");
        }

        @Test
        void shouldReportUnresolvableBranch() {
            // Given three unlabeled children
            Workflow workflow = flow("wf")
                    .variable(input("var_x_int", "X", VariableType.INT))
                    .node(start("s"))
                    .node(decision("d", "X > 5"))
                    .node(end("a", "A"))
                    .node(end("b", "B"))
                    .node(end("c", "C"))
                    .edge("s", "d")
                    .edge("d", "a")
                    .edge("d", "b")
                    .edge("d", "c")
                    .build();

            // When
            ExecutionResult result = interpreter.execute(workflow, Map.of("X", 1));

            // Then
            assertThat(result.error()).isEqualTo("No branch found for condition 'X > 5' = false at node 'd'");
        }

        @Test
        void shouldFailCalculationOnDivisionByZero() {
            // Given
            Workflow workflow = flow("wf")
                    .variable(input("var_a_float", "A", VariableType.FLOAT))
                    .node(start("s"))
                    .node(calculation("c", "Ratio", "divide", ref("A"), literal(0)))
                    .node(end("e", "{Ratio}"))
                    .edge("s", "c")
                    .edge("c", "e")
                    .build();

            // When
            ExecutionResult result = interpreter.execute(workflow, Map.of("A", 3.0));

            // Then
            assertThat(result.error())
                    .isEqualTo("Calculation node 'Ratio' failed: Operator 'divide' error: Division by zero");
        }
    }

    @Nested
    @DisplayName("inputs")
    class Inputs {

        @Test
        void shouldFailOnMissingInput() {
            // When
            ExecutionResult result = interpreter.execute(bmi(), Map.of("Weight", 60.0));

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Missing required input: var_height_float");
            assertThat(result.path()).isEmpty();
        }

        @Test
        void shouldEnforceRange() {
            // Given
            Workflow workflow = flow("wf")
                    .variable(Variable.builder().id("var_age").name("Age").type(VariableType.INT)
                            .range(10.0, 99.0).build())
                    .node(start("s"))
                    .node(end("e", "Done"))
                    .edge("s", "e")
                    .build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of("Age", 5)).error())
                    .isEqualTo("Value error: var_age=5 below minimum 10");
            assertThat(interpreter.execute(workflow, Map.of("Age", 100L)).error())
                    .isEqualTo("Value error: var_age=100 exceeds maximum 99");
            assertThat(interpreter.execute(workflow, Map.of("Age", 10)).success()).isTrue();
        }

        @Test
        void shouldRejectMistypedAndOutOfEnumInputs() {
            // Given
            Workflow workflow = flow("wf")
                    .variable(input("var_n", "N", VariableType.INT))
                    .variable(Variable.builder().id("var_tier").name("Tier").type(VariableType.ENUM)
                            .enumValues(List.of("gold", "silver")).build())
                    .node(start("s"))
                    .node(end("e", "Done"))
                    .edge("s", "e")
                    .build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of("N", 1.5, "Tier", "gold")).error())
                    .isEqualTo("var_n must be int, got Double");
            assertThat(interpreter.execute(workflow, Map.of("N", 1, "Tier", "Gold")).error())
                    .isEqualTo("Value error: var_tier must be one of [gold, silver], got 'Gold'");
        }
    }

    @Nested
    @DisplayName("output")
    class Output {

        @Test
        void shouldKeepRawValueForSinglePlaceholderOfNumericType() {
            // Given
            Workflow workflow = flow("wf")
                    .node(start("s"))
                    .node(calculation("c", "Total", "add", literal(2), literal(3)))
                    .node(end("e", "Total", "int", "{Total}"))
                    .edge("s", "c")
                    .edge("c", "e")
                    .build();

            // When
            ExecutionResult result = interpreter.execute(workflow, Map.of());

            // Then
            assertThat(result.output()).isEqualTo(5L);
        }

        @Test
        void shouldCastLabelToBool() {
            // Given
            Workflow workflow = flow("wf")
                    .node(start("s"))
                    .node(end("e", "Yes", "bool", null))
                    .edge("s", "e")
                    .build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of()).output()).isEqualTo(Boolean.TRUE);
        }

        @Test
        void shouldFailWhenOutputCannotBeCast() {
            // Given
            Workflow workflow = flow("wf")
                    .node(start("s"))
                    .node(end("e", "many", "int", null))
                    .edge("s", "e")
                    .build();

            // When
            ExecutionResult result = interpreter.execute(workflow, Map.of());

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Cannot cast output 'many' to int");
        }

        @Test
        void shouldDecodeJsonOutputWithDecoder() {
            // Given
            ValueDecoder decoder = text -> Map.of("decoded", text);
            WorkflowInterpreter decoding =
                    new WorkflowInterpreter(null, decoder, new SimpleTemplateResolver(), 100);
            Workflow workflow = flow("wf")
                    .node(start("s"))
                    .node(end("e", "[1, 2]", "json", null))
                    .edge("s", "e")
                    .build();

            // When
            ExecutionResult result = decoding.execute(workflow, Map.of());

            // Then
            assertThat(result.output()).isEqualTo(Map.of("decoded", "[1, 2]"));
        }
    }

    @Nested
    @DisplayName("sub-workflows")
    class Subworkflows {

        private Workflow child() {
            return flow("child")
                    .name("Child")
                    .variable(input("var_score_int", "Score", VariableType.INT))
                    .node(start("cs"))
                    .node(end("ce", "Score", "int", "{Score}"))
                    .edge("cs", "ce")
                    .build();
        }

        private Workflow parent(Map<String, String> mapping) {
            return flow("parent")
                    .name("Parent")
                    .variable(input("var_points_int", "Points", VariableType.INT))
                    .node(start("s"))
                    .node(subprocess("p", "child", mapping, "result"))
                    .node(decision("d", "High?", Condition.Structured.of("var_sub_result_int", "gte", 5)))
                    .node(end("hi", "High"))
                    .node(end("lo", "Low"))
                    .edge("s", "p")
                    .edge("p", "d")
                    .edge("d", "hi", "yes")
                    .edge("d", "lo", "no")
                    .build();
        }

        @Test
        void shouldInjectSubworkflowOutputAsDerivedVariable() {
            // Given
            when(resolver.resolve("child")).thenReturn(Optional.of(child()));

            // When
            ExecutionResult result = interpreter.execute(parent(Map.of("Points", "Score")), Map.of("Points", 7));

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.output()).isEqualTo("High");
            assertThat(result.context()).containsEntry("var_sub_result_int", 7L);
            assertThat(result.subflowResults())
                    .singleElement()
                    .satisfies(sub -> {
                        assertThat(sub.nodeId()).isEqualTo("p");
                        assertThat(sub.subworkflowName()).isEqualTo("Child");
                        assertThat(sub.inputs()).containsEntry("var_score_int", 7L);
                        assertThat(sub.success()).isTrue();
                        assertThat(sub.output()).isEqualTo(7L);
                    });
        }

        @Test
        void shouldPropagateSubworkflowFailure() {
            // Given no mapping, so the child misses its input
            when(resolver.resolve("child")).thenReturn(Optional.of(child()));

            // When
            ExecutionResult result = interpreter.execute(parent(Map.of()), Map.of("Points", 7));

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error())
                    .isEqualTo("Subprocess node 'Call child' failed: Subworkflow 'Child' returned error: "
                            + "Missing required input: var_score_int");
            assertThat(result.subflowResults()).singleElement().satisfies(sub -> assertThat(sub.success()).isFalse());
        }

        @Test
        void shouldFailOnUnknownSubworkflow() {
            // Given
            when(resolver.resolve("child")).thenReturn(Optional.empty());

            // When
            ExecutionResult result = interpreter.execute(parent(Map.of()), Map.of("Points", 7));

            // Then
            assertThat(result.error()).isEqualTo("Subprocess node 'Call child': subworkflow 'child' not found");
        }

        @Test
        void shouldDetectIndirectSelfCall() {
            // Given A calls B, which calls A again
            Workflow a = flow("A")
                    .node(start("s"))
                    .node(subprocess("p", "B", Map.of(), "out"))
                    .node(end("e", "Done"))
                    .edge("s", "p")
                    .edge("p", "e")
                    .build();
            Workflow b = flow("B")
                    .node(start("s"))
                    .node(subprocess("p", "A", Map.of(), "out"))
                    .node(end("e", "Done"))
                    .edge("s", "p")
                    .edge("p", "e")
                    .build();
            when(resolver.resolve("B")).thenReturn(Optional.of(b));

            // When
            ExecutionResult result = interpreter.execute(a, Map.of());

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error())
                    .isEqualTo("Circular subflow detected: A -> B -> A. "
                            + "A workflow cannot call itself directly or indirectly.");
            verify(resolver, never()).resolve("A");
        }

        @Test
        void shouldTagSubworkflowStepsWithDepth() {
            // Given
            when(resolver.resolve("child")).thenReturn(Optional.of(child()));
            List<StepEvent> events = new ArrayList<>();

            // When
            interpreter.execute(parent(Map.of("Points", "Score")), Map.of("Points", 3), collecting(events));

            // Then
            assertThat(events)
                    .extracting(StepEvent::nodeId)
                    .containsExactly("s", "p", "cs", "ce", "d", "lo");
            assertThat(events.get(2).subflowContext())
                    .hasValueSatisfying(ctx -> {
                        assertThat(ctx.parentNodeId()).isEqualTo("p");
                        assertThat(ctx.subworkflowId()).isEqualTo("child");
                        assertThat(ctx.depth()).isEqualTo(1);
                    });
            assertThat(events.get(2).stepIndex()).isZero();
            assertThat(events.get(4).isInSubflow()).isFalse();
        }
    }

    @Nested
    @DisplayName("listeners and control")
    class ListenersAndControl {

        @Test
        void shouldPublishOneEventPerVisitedNode() {
            // Given
            List<StepEvent> events = new ArrayList<>();

            // When
            interpreter.execute(bmi(), Map.of("Weight", 40.0, "Height", 1.75), collecting(events));

            // Then
            assertThat(events).extracting(StepEvent::stepIndex).containsExactly(0, 1, 2, 3, 4);
            assertThat(events.get(3).nodeType()).isEqualTo("decision");
            assertThat(events.get(3).context()).containsKey("var_calc_bmi_number");
            assertThat(events.get(0).context()).doesNotContainKey("var_calc_bmi_number");
        }

        @Test
        void shouldIgnoreFailingListener() {
            // Given
            ExecutionListener failing = new ExecutionListener() {
                @Override
                public void onStep(StepEvent event) {
                    throw new IllegalStateException("listener broke");
                }
            };

            // When
            ExecutionResult result = interpreter.execute(bmi(), Map.of("Weight", 40.0, "Height", 1.75), failing);

            // Then
            assertThat(result.success()).isTrue();
        }

        @Test
        void shouldStopWhenListenerRequestsIt() {
            // Given
            ExecutionListener stopping = new ExecutionListener() {
                @Override
                public void onStep(StepEvent event) {
                    if (event.stepIndex() == 2) {
                        throw new ExecutionStoppedException("Stopped by user");
                    }
                }
            };

            // When
            ExecutionResult result = interpreter.execute(bmi(), Map.of("Weight", 40.0, "Height", 1.75), stopping);

            // Then
            assertThat(result.stopped()).isTrue();
            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Stopped by user");
            assertThat(result.path()).containsExactly("s", "sq");
        }

        @Test
        void shouldStopOnCancelledToken() {
            // Given
            CancellationToken token = CancellationToken.create();
            token.cancel();

            // When
            ExecutionResult result =
                    interpreter.execute(bmi(), Map.of("Weight", 40.0, "Height", 1.75), ExecutionListener.NOOP, token);

            // Then
            assertThat(result.stopped()).isTrue();
            assertThat(result.error()).isEqualTo("Execution cancelled");
            assertThat(result.path()).isEmpty();
        }

        @Test
        void shouldBoundStepsOnUnvalidatedLoops() {
            // Given
            WorkflowInterpreter bounded = new WorkflowInterpreter(null, null, new SimpleTemplateResolver(), 10);
            Workflow workflow = flow("loop")
                    .node(start("s"))
                    .node(process("a", "A"))
                    .node(process("b", "B"))
                    .edge("s", "a")
                    .edge("a", "b")
                    .edge("b", "a")
                    .build();

            // When
            ExecutionResult result = bounded.execute(workflow, Map.of());

            // Then
            assertThat(result.error()).isEqualTo("Execution exceeded 10 steps without reaching an end node");
            assertThat(result.path()).hasSize(10);
        }

        @Test
        void shouldFailWithoutStartNode() {
            // Given
            Workflow workflow = flow("wf").node(end("e", "Done")).build();

            // When / Then
            assertThat(interpreter.execute(workflow, Map.of()).error()).isEqualTo("Workflow has no start node");
        }
    }

    @Test
    void shouldRejectNonPositiveStepLimit() {
        assertThatThrownBy(() -> new WorkflowInterpreter(null, null, new SimpleTemplateResolver(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxSteps must be positive, got 0");
    }
}

package io.arbor.core.execution;

import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.CalculationOperator;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.Condition;
import io.arbor.core.condition.StructuredConditionEvaluator;
import io.arbor.core.exception.ConditionSyntaxException;
import io.arbor.core.exception.EvaluationException;
import io.arbor.core.exception.ExecutionStoppedException;
import io.arbor.core.exception.InterpreterException;
import io.arbor.core.exception.SubflowCycleException;
import io.arbor.core.expression.ConditionParser;
import io.arbor.core.expression.ExpressionEvaluator;
import io.arbor.core.template.SimpleTemplateResolver;
import io.arbor.core.template.TemplateResolver;
import io.arbor.core.workflow.Identifiers;
import io.arbor.core.workflow.SuccessorIndex;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.SubprocessNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Tree-walking interpreter for workflows.
///
/// Walks from the start node until an end node produces the output:
/// - `start`/`process` advance to their first child
/// - `decision` evaluates its condition and follows the matching branch
/// - `calculation` applies an operator and stores the result as a derived variable
/// - `subprocess` runs another workflow and injects its output as a derived variable
/// - `end` resolves and casts the output
///
/// ### Sub-workflows
/// The ids of workflows in progress travel with the recursion as an explicit call stack.
/// Re-entering an id fails the whole execution with a cycle error.
///
/// ### Step events
/// Before each node the listener receives a {@link StepEvent}. Listener failures are
/// logged and ignored; {@link ExecutionStoppedException} ends the run with a stopped
/// result. The {@link CancellationToken} is checked at every step boundary.
///
/// ### Usage
/// {@snippet :
/// WorkflowInterpreter interpreter = new WorkflowInterpreter(repository);
/// ExecutionResult result = interpreter.execute(workflow, Map.of("BMI", 15.2));
/// if (result.success()) {
///     System.out.println(result.output());
/// }
/// }
///
/// @implNote Thread-safe: all per-run state lives on the stack of {@code execute}.
/// @see InputValidator
/// @see OutputTypes
public class WorkflowInterpreter {

    private static final Logger logger = Logger.getLogger(WorkflowInterpreter.class.getName());

    /// Default upper bound on nodes visited per (sub-)workflow run.
    public static final int DEFAULT_MAX_STEPS = 10_000;

    private final SubworkflowResolver resolver;
    private final ValueDecoder valueDecoder;
    private final TemplateResolver templateResolver;
    private final int maxSteps;
    private final InputValidator inputValidator = new InputValidator();
    private final StructuredConditionEvaluator structuredEvaluator =
            new StructuredConditionEvaluator();
    private final ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();

    /// Creates an interpreter without sub-workflow support.
    public WorkflowInterpreter() {
        this(null);
    }

    /// Creates an interpreter that resolves sub-workflows through the given resolver.
    ///
    /// @param resolver sub-workflow lookup, may be null (subprocess nodes then fail)
    public WorkflowInterpreter(SubworkflowResolver resolver) {
        this(resolver, null, new SimpleTemplateResolver(), DEFAULT_MAX_STEPS);
    }

    /// Creates an interpreter with all collaborators.
    ///
    /// @param resolver sub-workflow lookup, may be null
    /// @param valueDecoder decoder for `json` output, may be null (output stays text)
    /// @param templateResolver resolver for `{Name}` placeholders, not null
    /// @param maxSteps upper bound on nodes visited per run, must be positive
    public WorkflowInterpreter(
            SubworkflowResolver resolver,
            ValueDecoder valueDecoder,
            TemplateResolver templateResolver,
            int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        this.resolver = resolver;
        this.valueDecoder = valueDecoder;
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.maxSteps = maxSteps;
    }

    public ExecutionResult execute(Workflow workflow, Map<String, Object> inputs) {
        return execute(workflow, inputs, ExecutionListener.NOOP, CancellationToken.create());
    }

    public ExecutionResult execute(
            Workflow workflow, Map<String, Object> inputs, ExecutionListener listener) {
        return execute(workflow, inputs, listener, CancellationToken.create());
    }

    /// Executes a workflow.
    ///
    /// @param workflow the workflow to run, not null
    /// @param inputs input values keyed by variable id or name, not null
    /// @param listener step listener, not null (use {@link ExecutionListener#NOOP})
    /// @param token cancellation token checked at every step, not null
    /// @return the result, never null; failures are reported, not thrown
    public ExecutionResult execute(
            Workflow workflow,
            Map<String, Object> inputs,
            ExecutionListener listener,
            CancellationToken token) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Objects.requireNonNull(token, "token must not be null");

        logger.info("Executing workflow '" + workflow.getId() + "'");
        List<String> callStack =
                workflow.getId() != null ? List.of(workflow.getId()) : List.of();
        ExecutionResult result;
        try {
            result = run(workflow, inputs, new Frame(callStack, listener, token, null));
        } catch (SubflowCycleException e) {
            result = ExecutionResult.failure(e.getMessage(), List.of(), Map.of(), List.of());
        }
        logger.info(
                "Workflow '"
                        + workflow.getId()
                        + "' finished: "
                        + (result.stopped() ? "stopped" : result.success() ? "success" : "failed"));
        return result;
    }

    /// Per-run recursion state.
    private record Frame(
            List<String> callStack,
            ExecutionListener listener,
            CancellationToken token,
            SubflowContext subflow) {

        boolean isNested() {
            return subflow != null;
        }

        int depth() {
            return subflow == null ? 0 : subflow.depth();
        }
    }

    /// Mutable bookkeeping of one (sub-)workflow run.
    private static final class Run {
        final Workflow workflow;
        final VariableScope scope;
        final SuccessorIndex successors;
        final List<String> path = new ArrayList<>();
        final List<SubflowResult> subflowResults = new ArrayList<>();

        Run(Workflow workflow, VariableScope scope) {
            this.workflow = workflow;
            this.scope = scope;
            this.successors = SuccessorIndex.of(workflow);
        }
    }

    private ExecutionResult run(Workflow workflow, Map<String, Object> inputs, Frame frame)
            throws SubflowCycleException {
        Map<String, Object> inputsById;
        try {
            inputsById = inputValidator.validate(workflow, inputs);
        } catch (InterpreterException e) {
            return ExecutionResult.failure(e.getMessage(), List.of(), inputs, List.of());
        }

        Run run = new Run(workflow, VariableScope.of(workflow, inputsById));
        try {
            Node current = startNode(workflow);
            int stepIndex = 0;
            while (true) {
                frame.token().throwIfCancelled();
                if (stepIndex >= maxSteps) {
                    throw new InterpreterException(
                            "Execution exceeded " + maxSteps + " steps without reaching an end node");
                }
                fireStep(current, stepIndex, run, frame);
                stepIndex++;
                run.path.add(current.getId());
                logger.fine(() -> "Visiting " + run.path.get(run.path.size() - 1));

                switch (current.getNodeType()) {
                    case END -> {
                        Object output = resolveOutput((EndNode) current, run);
                        return ExecutionResult.success(
                                output, run.path, run.scope.snapshot(), run.subflowResults);
                    }
                    case START, PROCESS -> current = firstChild(current, run);
                    case DECISION -> current = decide((DecisionNode) current, run);
                    case CALCULATION -> {
                        calculate((CalculationNode) current, run);
                        current = firstChild(current, run);
                    }
                    case SUBPROCESS -> current = callSubworkflow((SubprocessNode) current, run, frame);
                    default ->
                            throw new InterpreterException(
                                    "Unknown node type '"
                                            + current.getTypeName()
                                            + "' at node '"
                                            + current.getId()
                                            + "'");
                }
            }
        } catch (ExecutionStoppedException e) {
            if (frame.isNested()) {
                throw e;
            }
            logger.info("Execution stopped: " + e.getMessage());
            return ExecutionResult.stopped(
                    e.getMessage(), run.path, run.scope.snapshot(), run.subflowResults);
        } catch (SubflowCycleException e) {
            if (frame.isNested()) {
                throw e;
            }
            return ExecutionResult.failure(
                    e.getMessage(), run.path, run.scope.snapshot(), run.subflowResults);
        } catch (InterpreterException e) {
            logger.fine(() -> "Execution failed: " + e.getMessage());
            return ExecutionResult.failure(
                    e.getMessage(), run.path, run.scope.snapshot(), run.subflowResults);
        }
    }

    private static Node startNode(Workflow workflow) throws InterpreterException {
        List<Node> starts = workflow.startNodes();
        if (starts.isEmpty()) {
            throw new InterpreterException("Workflow has no start node");
        }
        return starts.get(0);
    }

    private void fireStep(Node node, int stepIndex, Run run, Frame frame) {
        if (frame.listener() == ExecutionListener.NOOP) {
            return;
        }
        StepEvent event =
                new StepEvent(
                        node.getId(),
                        node.getTypeName(),
                        node.displayName(),
                        stepIndex,
                        run.scope.snapshot(),
                        frame.subflow());
        try {
            frame.listener().onStep(event);
        } catch (ExecutionStoppedException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING, "Step listener failed at node '" + node.getId() + "'", e);
        }
    }

    private static Node firstChild(Node node, Run run) throws InterpreterException {
        return run.successors
                .firstChild(node.getId())
                .orElseThrow(
                        () -> new InterpreterException("Node '" + node.getId() + "' has no children"));
    }

    // -- Decision -----------------------------------------------------------

    private Node decide(DecisionNode node, Run run) throws InterpreterException {
        Condition condition =
                node.effectiveCondition()
                        .orElseThrow(
                                () ->
                                        new InterpreterException(
                                                "Decision node '"
                                                        + node.getId()
                                                        + "' has no condition"));

        String description = describe(condition);
        boolean outcome;
        try {
            outcome = evaluate(condition, run.scope);
        } catch (EvaluationException | ConditionSyntaxException e) {
            throw new InterpreterException(
                    "Failed to evaluate condition '"
                            + description
                            + "' at node '"
                            + node.getId()
                            + "': "
                            + e.getMessage(),
                    e);
        }
        logger.fine(() -> "Decision '" + node.getId() + "' evaluated to " + outcome);

        List<SuccessorIndex.Successor> children = run.successors.childrenOf(node.getId());
        if (children.isEmpty()) {
            throw new InterpreterException("Decision node '" + node.getId() + "' has no children");
        }
        return SuccessorIndex.selectBranch(children, outcome)
                .orElseThrow(
                        () ->
                                new InterpreterException(
                                        "No branch found for condition '"
                                                + description
                                                + "' = "
                                                + outcome
                                                + " at node '"
                                                + node.getId()
                                                + "'"));
    }

    private boolean evaluate(Condition condition, VariableScope scope)
            throws EvaluationException, ConditionSyntaxException {
        if (condition instanceof Condition.Structured structured) {
            return structuredEvaluator.evaluate(structured, scope.idFirstView());
        }
        Condition.Expression expression = (Condition.Expression) condition;
        return expressionEvaluator.evaluate(
                ConditionParser.parse(expression.text()), scope.nameFirstView());
    }

    private static String describe(Condition condition) {
        if (condition instanceof Condition.Structured s) {
            return s.inputId()
                    + " "
                    + s.comparator()
                    + " "
                    + s.value()
                    + (s.value2() != null ? " " + s.value2() : "");
        }
        return ((Condition.Expression) condition).text();
    }

    // -- Calculation --------------------------------------------------------

    private void calculate(CalculationNode node, Run run) throws InterpreterException {
        Calculation calculation = node.getCalculation();
        String name = node.displayName();
        if (calculation == null || calculation.outputName() == null
                || calculation.outputName().isBlank()) {
            throw new InterpreterException(
                    "Calculation node '" + name + "' is missing an output name");
        }

        List<Operand> operands = calculation.operands();
        double[] values = new double[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            values[i] = operandValue(operands.get(i), name, run.scope);
        }

        double result;
        try {
            result = CalculationOperator.execute(calculation.operator(), values);
        } catch (EvaluationException e) {
            throw new InterpreterException(
                    "Calculation node '" + name + "' failed: " + e.getMessage(), e);
        }
        run.scope.put(calculation.derivedVariableId(), calculation.outputName(), result);
        logger.fine(() -> "Calculated " + calculation.outputName() + " = " + result);
    }

    private static double operandValue(Operand operand, String nodeName, VariableScope scope)
            throws InterpreterException {
        if (operand instanceof Operand.Literal literal) {
            return literal.value();
        }
        String ref = ((Operand.Reference) operand).ref();
        Object value =
                scope.resolveOperand(ref)
                        .orElseThrow(
                                () ->
                                        new InterpreterException(
                                                "Calculation node '"
                                                        + nodeName
                                                        + "': operand '"
                                                        + ref
                                                        + "' not found"));
        if (!(value instanceof Number number) || value instanceof Boolean) {
            throw new InterpreterException(
                    "Calculation node '" + nodeName + "': operand '" + ref + "' is not numeric");
        }
        return number.doubleValue();
    }

    // -- Sub-workflow -------------------------------------------------------

    private Node callSubworkflow(SubprocessNode node, Run run, Frame frame)
            throws InterpreterException {
        String label = node.displayName();
        String subworkflowId = node.getSubworkflowId();
        String outputVariable = node.getOutputVariable();
        if (subworkflowId == null || subworkflowId.isBlank()) {
            throw new InterpreterException(
                    "Subprocess node '" + label + "' missing subworkflow_id");
        }
        if (outputVariable == null || outputVariable.isBlank()) {
            throw new InterpreterException(
                    "Subprocess node '" + label + "' missing output_variable");
        }

        if (frame.callStack().contains(subworkflowId)) {
            List<String> cycle = new ArrayList<>(frame.callStack());
            cycle.add(subworkflowId);
            throw new SubflowCycleException(
                    "Circular subflow detected: "
                            + String.join(" -> ", cycle)
                            + ". A workflow cannot call itself directly or indirectly.");
        }
        if (resolver == null) {
            throw new InterpreterException(
                    "Subprocess node '"
                            + label
                            + "': no subworkflow resolver configured. "
                            + "Cannot execute subflows without access to workflow storage.");
        }
        Workflow subworkflow =
                resolver.resolve(subworkflowId)
                        .orElseThrow(
                                () ->
                                        new InterpreterException(
                                                "Subprocess node '"
                                                        + label
                                                        + "': subworkflow '"
                                                        + subworkflowId
                                                        + "' not found"));

        Map<String, Object> subInputs = mapInputs(node, run.scope, subworkflow);

        List<String> callStack = new ArrayList<>(frame.callStack());
        callStack.add(subworkflowId);
        Frame child =
                new Frame(
                        List.copyOf(callStack),
                        frame.listener(),
                        frame.token(),
                        new SubflowContext(node.getId(), subworkflowId, frame.depth() + 1));

        logger.fine(() -> "Calling subworkflow '" + subworkflowId + "' from " + node.getId());
        ExecutionResult subResult = run(subworkflow, subInputs, child);
        run.subflowResults.add(
                new SubflowResult(
                        node.getId(),
                        subworkflowId,
                        subworkflow.getName(),
                        subInputs,
                        outputVariable,
                        subResult.success(),
                        subResult.output(),
                        subResult.error()));

        if (!subResult.success()) {
            throw new InterpreterException(
                    "Subprocess node '"
                            + label
                            + "' failed: Subworkflow '"
                            + subworkflow.getName()
                            + "' returned error: "
                            + subResult.error());
        }

        Object output = subResult.output();
        run.scope.put(
                node.derivedVariableId(Identifiers.inferTypeName(output)), outputVariable, output);

        return run.successors
                .firstChild(node.getId())
                .orElseThrow(
                        () ->
                                new InterpreterException(
                                        "Subprocess node '"
                                                + label
                                                + "' has no children. Flow must continue after "
                                                + "subprocess or end explicitly."));
    }

    private static Map<String, Object> mapInputs(
            SubprocessNode node, VariableScope scope, Workflow subworkflow)
            throws InterpreterException {
        String label = node.displayName();
        Map<String, Object> subInputs = new LinkedHashMap<>();
        for (Map.Entry<String, String> mapping : node.getInputMapping().entrySet()) {
            String parentName = mapping.getKey();
            String subName = mapping.getValue();

            Map.Entry<String, Object> parent =
                    scope.lookup(parentName)
                            .orElseThrow(
                                    () ->
                                            new InterpreterException(
                                                    "Subprocess '"
                                                            + label
                                                            + "': input_mapping references "
                                                            + "non-existent parent input '"
                                                            + parentName
                                                            + "'"));

            Optional<Variable> target = subworkflow.findVariable(subName);
            if (target.isEmpty()) {
                throw new InterpreterException(
                        "Subprocess '"
                                + label
                                + "': input_mapping maps to non-existent subworkflow input '"
                                + subName
                                + "'");
            }
            subInputs.put(target.get().getId(), parent.getValue());
        }
        return subInputs;
    }

    // -- Output -------------------------------------------------------------

    private Object resolveOutput(EndNode node, Run run) throws InterpreterException {
        String type =
                OutputTypes.effectiveType(run.workflow.getOutputType(), node.effectiveOutputType());
        Map<String, Object> names = run.scope.nameFirstView();
        try {
            String template = outputTemplate(node);
            if (template != null) {
                Optional<String> single = templateResolver.singlePlaceholder(template);
                if (single.isPresent() && OutputTypes.keepsRawValue(type)) {
                    if (!names.containsKey(single.get())) {
                        throw new InterpreterException(
                                "Output template references unknown variable '"
                                        + single.get()
                                        + "'");
                    }
                    return OutputTypes.coerceRaw(type, names.get(single.get()), valueDecoder);
                }
                return OutputTypes.cast(
                        type, templateResolver.resolve(template, names), valueDecoder);
            }
            if (node.getOutputValue() != null) {
                return OutputTypes.cast(type, node.getOutputValue(), valueDecoder);
            }
            return OutputTypes.cast(type, node.getLabel() != null ? node.getLabel() : "", valueDecoder);
        } catch (EvaluationException e) {
            throw new InterpreterException(e.getMessage(), e);
        }
    }

    /// The explicit template, or the label when it carries placeholders and no static value
    /// is set.
    private String outputTemplate(EndNode node) {
        if (node.hasTemplate()) {
            return node.getOutputTemplate();
        }
        String label = node.getLabel();
        if (node.getOutputValue() == null
                && label != null
                && !templateResolver.placeholders(label).isEmpty()) {
            return label;
        }
        return null;
    }
}

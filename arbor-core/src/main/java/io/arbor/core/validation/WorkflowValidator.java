package io.arbor.core.validation;

import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.CalculationOperator;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.ComparatorFamily;
import io.arbor.core.condition.ComparatorType;
import io.arbor.core.condition.Condition;
import io.arbor.core.exception.ConditionSyntaxException;
import io.arbor.core.expression.ConditionParser;
import io.arbor.core.template.SimpleTemplateResolver;
import io.arbor.core.template.TemplateResolver;
import io.arbor.core.workflow.Edge;
import io.arbor.core.workflow.Identifiers;
import io.arbor.core.workflow.SuccessorIndex;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableType;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.NodeType;
import io.arbor.core.workflow.node.SubprocessNode;
import io.arbor.core.workflow.node.UnrecognizedNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Structural and semantic checker for workflows.
///
/// Every applicable rule runs and errors accumulate; nothing is thrown for an invalid
/// workflow. The input is never mutated.
///
/// ### Structural rules (always)
/// Node completeness and type, duplicate ids, edge endpoints, a single start node,
/// self-loops and cycles (three-color DFS, first cycle only).
///
/// ### Semantic rules (strict mode)
/// Missing start, outgoing-edge requirements per node type, decision branch labels,
/// reachability from start (BFS), condition/calculation/sub-workflow fields, template
/// placeholders and the workflow output type.
///
/// ### Usage
/// {@snippet :
/// ValidationResult result = new WorkflowValidator().validate(workflow, ValidationMode.STRICT);
/// if (!result.valid()) {
///     System.err.println(result.format());
/// }
/// }
///
/// @implNote Stateless and thread-safe.
/// @see ValidationCode
public class WorkflowValidator {

    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final TemplateResolver templateResolver;

    public WorkflowValidator() {
        this(new SimpleTemplateResolver());
    }

    public WorkflowValidator(TemplateResolver templateResolver) {
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
    }

    /// Validates in strict mode.
    ///
    /// @param workflow the workflow to check, not null
    /// @return the result, never null
    public ValidationResult validate(Workflow workflow) {
        return validate(workflow, ValidationMode.STRICT);
    }

    /// Validates a workflow.
    ///
    /// @param workflow the workflow to check, not null
    /// @param mode how much to check, not null
    /// @return the result with every error found, never null
    public ValidationResult validate(Workflow workflow, ValidationMode mode) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        List<ValidationError> errors = new ArrayList<>();
        List<Node> checkable = checkNodes(workflow, errors);
        Set<String> knownIds = knownNodeIds(workflow);
        checkEdges(workflow, knownIds, errors);
        checkStartNodes(workflow, mode, errors);
        checkCycles(workflow, knownIds, errors);

        if (mode == ValidationMode.STRICT) {
            SuccessorIndex successors = SuccessorIndex.of(workflow);
            VariableCatalog catalog = VariableCatalog.of(workflow);
            checkConnectivity(checkable, successors, errors);
            checkReachability(workflow, successors, errors);
            for (Node node : checkable) {
                checkSemantics(node, workflow, catalog, errors);
            }
        }

        logger.fine(
                () ->
                        "Validated workflow '"
                                + workflow.getId()
                                + "' ("
                                + mode
                                + "): "
                                + errors.size()
                                + " error(s)");
        return ValidationResult.of(errors);
    }

    // -- Structural ---------------------------------------------------------

    private List<Node> checkNodes(Workflow workflow, List<ValidationError> errors) {
        List<Node> checkable = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Node node : workflow.getNodes()) {
            List<String> missing = node.missingRequiredFields();
            if (!missing.isEmpty()) {
                String name = node.getId() != null ? node.getId() : "unknown";
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INCOMPLETE_NODE,
                                "Node missing required fields: "
                                        + name
                                        + " ("
                                        + String.join(", ", missing)
                                        + ")",
                                node.getId()));
                continue;
            }

            if (node instanceof UnrecognizedNode unknown) {
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INVALID_NODE_TYPE,
                                "Invalid node type '"
                                        + unknown.getRawType()
                                        + "' for node "
                                        + node.getId(),
                                node.getId()));
            }

            if (!seen.add(node.getId())) {
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.DUPLICATE_NODE_ID,
                                "Duplicate node ID: " + node.getId(),
                                node.getId()));
                continue;
            }
            if (!(node instanceof UnrecognizedNode)) {
                checkable.add(node);
            }
        }
        return checkable;
    }

    private static Set<String> knownNodeIds(Workflow workflow) {
        Set<String> ids = new HashSet<>();
        for (Node node : workflow.getNodes()) {
            if (node.getId() != null && !node.getId().isBlank()) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    private static void checkEdges(
            Workflow workflow, Set<String> knownIds, List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        for (Edge edge : workflow.getEdges()) {
            if (!knownIds.contains(edge.from())) {
                errors.add(
                        ValidationError.forEdge(
                                ValidationCode.INVALID_EDGE_SOURCE,
                                "Edge references non-existent source node: " + edge.from(),
                                edge.id()));
            }
            if (!knownIds.contains(edge.to())) {
                errors.add(
                        ValidationError.forEdge(
                                ValidationCode.INVALID_EDGE_TARGET,
                                "Edge references non-existent target node: " + edge.to(),
                                edge.id()));
            }
            if (!seen.add(edge.id())) {
                errors.add(
                        ValidationError.forEdge(
                                ValidationCode.DUPLICATE_EDGE_ID,
                                "Duplicate edge ID: " + edge.id(),
                                edge.id()));
            }
        }
    }

    private static void checkStartNodes(
            Workflow workflow, ValidationMode mode, List<ValidationError> errors) {
        List<Node> starts = workflow.startNodes();
        if (starts.size() > 1) {
            List<String> labels = starts.stream().map(Node::displayName).toList();
            errors.add(
                    ValidationError.global(
                            ValidationCode.MULTIPLE_START_NODES,
                            "Workflow must have exactly one start node, found "
                                    + starts.size()
                                    + ": "
                                    + String.join(", ", labels)));
        } else if (starts.isEmpty()
                && mode == ValidationMode.STRICT
                && !workflow.getNodes().isEmpty()) {
            errors.add(
                    ValidationError.global(
                            ValidationCode.NO_START_NODE, "Workflow has no start node"));
        }
    }

    private static void checkCycles(
            Workflow workflow, Set<String> knownIds, List<ValidationError> errors) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Node node : workflow.getNodes()) {
            if (node.getId() != null && knownIds.contains(node.getId())) {
                adjacency.putIfAbsent(node.getId(), new ArrayList<>());
            }
        }
        for (Edge edge : workflow.getEdges()) {
            if (!knownIds.contains(edge.from()) || !knownIds.contains(edge.to())) {
                continue;
            }
            if (edge.from().equals(edge.to())) {
                errors.add(
                        new ValidationError(
                                ValidationCode.SELF_LOOP_DETECTED,
                                "Node '" + edge.from() + "' has an edge to itself",
                                edge.from(),
                                edge.id()));
                continue;
            }
            adjacency.get(edge.from()).add(edge.to());
        }

        Map<String, Integer> color = new HashMap<>();
        Map<String, String> parent = new HashMap<>();
        for (String root : adjacency.keySet()) {
            if (color.getOrDefault(root, WHITE) != WHITE) {
                continue;
            }
            Optional<List<String>> cycle = findCycle(root, adjacency, color, parent);
            if (cycle.isPresent()) {
                List<String> path = cycle.get();
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.CYCLE_DETECTED,
                                "Workflow contains a cycle: " + String.join(" -> ", path),
                                path.get(0)));
                return;
            }
        }
    }

    /// Iterative three-color DFS. Returns the first back edge as a closed path.
    private static Optional<List<String>> findCycle(
            String root,
            Map<String, List<String>> adjacency,
            Map<String, Integer> color,
            Map<String, String> parent) {
        Deque<Map.Entry<String, Integer>> stack = new ArrayDeque<>();
        stack.push(Map.entry(root, 0));
        color.put(root, GRAY);

        while (!stack.isEmpty()) {
            Map.Entry<String, Integer> frame = stack.pop();
            String node = frame.getKey();
            int childIndex = frame.getValue();
            List<String> children = adjacency.getOrDefault(node, List.of());

            if (childIndex >= children.size()) {
                color.put(node, BLACK);
                continue;
            }
            stack.push(Map.entry(node, childIndex + 1));

            String child = children.get(childIndex);
            int childColor = color.getOrDefault(child, WHITE);
            if (childColor == GRAY) {
                return Optional.of(rebuildCycle(node, child, parent));
            }
            if (childColor == WHITE) {
                color.put(child, GRAY);
                parent.put(child, node);
                stack.push(Map.entry(child, 0));
            }
        }
        return Optional.empty();
    }

    private static List<String> rebuildCycle(
            String from, String backTarget, Map<String, String> parent) {
        List<String> path = new ArrayList<>();
        path.add(backTarget);
        String current = from;
        while (current != null && !current.equals(backTarget)) {
            path.add(current);
            current = parent.get(current);
        }
        path.add(backTarget);
        Collections.reverse(path);
        return path;
    }

    // -- Strict: graph shape ------------------------------------------------

    private static void checkConnectivity(
            List<Node> nodes, SuccessorIndex successors, List<ValidationError> errors) {
        for (Node node : nodes) {
            List<SuccessorIndex.Successor> outgoing = successors.childrenOf(node.getId());
            String name = node.displayName();

            switch (node.getNodeType()) {
                case START, PROCESS, CALCULATION, SUBPROCESS -> {
                    if (outgoing.isEmpty()) {
                        errors.add(
                                ValidationError.forNode(
                                        ValidationCode.MISSING_OUTGOING_EDGE,
                                        capitalize(node.getTypeName())
                                                + " node '"
                                                + name
                                                + "' has no outgoing connections",
                                        node.getId()));
                    }
                }
                case END -> {
                    if (!outgoing.isEmpty()) {
                        errors.add(
                                ValidationError.forNode(
                                        ValidationCode.END_HAS_OUTGOING,
                                        "End node '"
                                                + name
                                                + "' should not have outgoing connections",
                                        node.getId()));
                    }
                }
                case DECISION -> checkDecisionBranches(node, name, outgoing, errors);
                default -> {}
            }
        }
    }

    private static void checkDecisionBranches(
            Node node,
            String name,
            List<SuccessorIndex.Successor> outgoing,
            List<ValidationError> errors) {
        if (outgoing.size() < 2) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.DECISION_NEEDS_BRANCHES,
                            "Decision node '" + name + "' must have at least 2 branches",
                            node.getId()));
            return;
        }
        boolean hasTrue = false;
        boolean hasFalse = false;
        for (SuccessorIndex.Successor successor : outgoing) {
            Optional<Boolean> branch = successor.branchValue();
            if (branch.isPresent()) {
                hasTrue |= branch.get();
                hasFalse |= !branch.get();
            }
        }
        if (!hasTrue || !hasFalse) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.DECISION_MISSING_LABELS,
                            "Decision node '" + name + "' should have 'true' and 'false' branches",
                            node.getId()));
        }
    }

    private static void checkReachability(
            Workflow workflow, SuccessorIndex successors, List<ValidationError> errors) {
        List<Node> starts = workflow.startNodes();
        if (starts.isEmpty()) {
            return;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Node start : starts) {
            if (start.getId() != null && visited.add(start.getId())) {
                queue.add(start.getId());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (SuccessorIndex.Successor child : successors.childrenOf(current)) {
                if (visited.add(child.node().getId())) {
                    queue.add(child.node().getId());
                }
            }
        }

        Set<String> unreachable = new TreeSet<>();
        for (Node node : workflow.getNodes()) {
            if (node.getId() != null && !node.getId().isBlank() && !visited.contains(node.getId())) {
                unreachable.add(node.getId());
            }
        }
        for (String nodeId : unreachable) {
            String name = workflow.findNode(nodeId).map(Node::displayName).orElse(nodeId);
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.UNREACHABLE_NODE,
                            "Node '" + name + "' is not reachable from the start node",
                            nodeId));
        }
    }

    // -- Strict: node semantics ---------------------------------------------

    private void checkSemantics(
            Node node, Workflow workflow, VariableCatalog catalog, List<ValidationError> errors) {
        switch (node.getNodeType()) {
            case DECISION -> checkDecision((DecisionNode) node, catalog, errors);
            case CALCULATION -> checkCalculation((CalculationNode) node, catalog, errors);
            case SUBPROCESS -> checkSubprocess((SubprocessNode) node, catalog, errors);
            case END -> checkEnd((EndNode) node, workflow, catalog, errors);
            default -> {}
        }
    }

    private static void checkDecision(
            DecisionNode node, VariableCatalog catalog, List<ValidationError> errors) {
        Optional<Condition> effective = node.effectiveCondition();
        if (effective.isEmpty()) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_CONDITION,
                            "Decision node '" + node.displayName() + "' has no condition",
                            node.getId()));
            return;
        }
        Condition condition = effective.get();
        if (condition instanceof Condition.Structured structured) {
            checkStructuredCondition(node, structured, catalog, errors);
        } else if (condition instanceof Condition.Expression expression) {
            checkLabelCondition(node, expression, catalog, errors);
        }
    }

    private static void checkStructuredCondition(
            DecisionNode node,
            Condition.Structured condition,
            VariableCatalog catalog,
            List<ValidationError> errors) {
        String name = node.displayName();
        boolean complete = true;
        if (isBlank(condition.inputId())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_CONDITION_INPUT_ID,
                            "Decision node '" + name + "' condition is missing input_id",
                            node.getId()));
            complete = false;
        }
        if (isBlank(condition.comparator())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_CONDITION_COMPARATOR,
                            "Decision node '" + name + "' condition is missing comparator",
                            node.getId()));
            complete = false;
        }
        if (!complete) {
            return;
        }

        Optional<VariableType> inputType = catalog.typeOfId(condition.inputId());
        boolean knownInput = catalog.isKnownId(condition.inputId());
        if (!knownInput) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.INVALID_CONDITION_INPUT_ID,
                            "Decision node '"
                                    + name
                                    + "' references unknown variable '"
                                    + condition.inputId()
                                    + "'. Valid ids: "
                                    + String.join(", ", catalog.ids()),
                            node.getId()));
        }

        Optional<ComparatorType> comparator = ComparatorType.fromWireName(condition.comparator());
        if (comparator.isEmpty()) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.INVALID_COMPARATOR,
                            "Decision node '"
                                    + name
                                    + "' uses unknown comparator '"
                                    + condition.comparator()
                                    + "'",
                            node.getId()));
            return;
        }

        if (knownInput && inputType.isPresent()) {
            Optional<ComparatorFamily> family = ComparatorFamily.forType(inputType.get());
            if (family.isEmpty() || family.get() != comparator.get().family()) {
                String allowed =
                        family.map(f -> String.join(", ", ComparatorType.namesIn(f)))
                                .orElse("none");
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INVALID_COMPARATOR_FOR_TYPE,
                                "Comparator '"
                                        + comparator.get().wireName()
                                        + "' is not valid for variable type '"
                                        + inputType.get().wireName()
                                        + "'. Valid comparators: "
                                        + allowed,
                                node.getId()));
            }
        }

        if (comparator.get().isRange() && condition.value2() == null) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_CONDITION_VALUE2,
                            "Comparator '"
                                    + comparator.get().wireName()
                                    + "' on decision node '"
                                    + name
                                    + "' requires value2",
                            node.getId()));
        }
    }

    /// A label that does not parse is treated as descriptive text and accepted.
    private static void checkLabelCondition(
            DecisionNode node,
            Condition.Expression expression,
            VariableCatalog catalog,
            List<ValidationError> errors) {
        Set<String> referenced;
        try {
            referenced = ConditionParser.referencedNames(ConditionParser.parse(expression.text()));
        } catch (ConditionSyntaxException e) {
            logger.fine(
                    () ->
                            "Decision '"
                                    + node.getId()
                                    + "' label is not an expression: "
                                    + e.getMessage());
            return;
        }
        for (String ref : referenced) {
            if (!catalog.isKnownName(ref)) {
                String valid =
                        catalog.names().isEmpty()
                                ? "no variables are declared"
                                : "valid names: " + String.join(", ", catalog.names());
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INVALID_INPUT_REF,
                                "Decision node '"
                                        + node.getId()
                                        + "' references unknown variable '"
                                        + ref
                                        + "' ("
                                        + valid
                                        + ")",
                                node.getId()));
            }
        }
    }

    private static void checkCalculation(
            CalculationNode node, VariableCatalog catalog, List<ValidationError> errors) {
        String name = node.displayName();
        Calculation calculation = node.getCalculation();
        if (calculation == null || isBlank(calculation.outputName())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_CALCULATION_OUTPUT,
                            "Calculation node '" + name + "' is missing an output name",
                            node.getId()));
            if (calculation == null) {
                return;
            }
        }

        Optional<CalculationOperator> operator =
                CalculationOperator.fromWireName(calculation.operator());
        if (operator.isEmpty()) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.INVALID_OPERATOR,
                            "Calculation node '"
                                    + name
                                    + "' uses unknown operator '"
                                    + calculation.operator()
                                    + "'",
                            node.getId()));
        } else {
            operator.get()
                    .checkArity(calculation.operands().size())
                    .ifPresent(
                            message ->
                                    errors.add(
                                            ValidationError.forNode(
                                                    ValidationCode.INVALID_OPERAND_COUNT,
                                                    message,
                                                    node.getId())));
        }

        for (Operand operand : calculation.operands()) {
            if (operand instanceof Operand.Reference reference
                    && !catalog.resolvesOperand(reference.ref())) {
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INVALID_OPERAND_REF,
                                "Calculation node '"
                                        + name
                                        + "' references unknown variable '"
                                        + reference.ref()
                                        + "'",
                                node.getId()));
            }
        }
    }

    private static void checkSubprocess(
            SubprocessNode node, VariableCatalog catalog, List<ValidationError> errors) {
        String name = node.displayName();
        if (isBlank(node.getSubworkflowId())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_SUBWORKFLOW_ID,
                            "Subprocess node '" + name + "' is missing subworkflow_id",
                            node.getId()));
        }
        if (isBlank(node.getOutputVariable())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.MISSING_OUTPUT_VARIABLE,
                            "Subprocess node '" + name + "' is missing output_variable",
                            node.getId()));
        } else if (!Identifiers.isIdentifier(node.getOutputVariable())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.INVALID_OUTPUT_VARIABLE,
                            "Subprocess node '"
                                    + name
                                    + "' output_variable '"
                                    + node.getOutputVariable()
                                    + "' is not a valid identifier",
                            node.getId()));
        }
        for (String parentName : node.getInputMapping().keySet()) {
            if (!catalog.isKnownName(parentName) && !catalog.isKnownId(parentName)) {
                errors.add(
                        ValidationError.forNode(
                                ValidationCode.INVALID_INPUT_MAPPING,
                                "Subprocess node '"
                                        + name
                                        + "' input_mapping references non-existent parent input '"
                                        + parentName
                                        + "'",
                                node.getId()));
            }
        }
    }

    private void checkEnd(
            EndNode node, Workflow workflow, VariableCatalog catalog, List<ValidationError> errors) {
        if (node.hasTemplate()) {
            checkPlaceholders(
                    node,
                    node.getOutputTemplate(),
                    ValidationCode.INVALID_TEMPLATE_VARIABLE,
                    "Output template",
                    catalog,
                    errors);
        } else if (node.getOutputValue() == null && node.getLabel() != null) {
            checkPlaceholders(
                    node,
                    node.getLabel(),
                    ValidationCode.INVALID_LABEL_VARIABLE,
                    "Label",
                    catalog,
                    errors);
        }

        String declared = workflow.getOutputType();
        if (!isBlank(declared)
                && !declared.trim().equalsIgnoreCase(node.effectiveOutputType().trim())) {
            errors.add(
                    ValidationError.forNode(
                            ValidationCode.OUTPUT_TYPE_MISMATCH,
                            "End node '"
                                    + node.displayName()
                                    + "' has output type '"
                                    + node.effectiveOutputType()
                                    + "' but the workflow declares '"
                                    + declared
                                    + "'",
                            node.getId()));
        }
    }

    private void checkPlaceholders(
            EndNode node,
            String template,
            ValidationCode code,
            String what,
            VariableCatalog catalog,
            List<ValidationError> errors) {
        for (String placeholder : templateResolver.placeholders(template)) {
            if (!catalog.isKnownName(placeholder) && !catalog.isKnownId(placeholder)) {
                errors.add(
                        ValidationError.forNode(
                                code,
                                what
                                        + " of end node '"
                                        + node.getId()
                                        + "' references unknown variable '"
                                        + placeholder
                                        + "'. Valid names: "
                                        + String.join(", ", catalog.names()),
                                node.getId()));
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String capitalize(String value) {
        return value.isEmpty()
                ? value
                : value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    /// Variables a workflow can reference: declared ones plus those derived from
    /// calculation and sub-workflow nodes.
    private record VariableCatalog(
            Map<String, VariableType> typesById,
            Set<String> names,
            Set<String> subprocessPrefixes) {

        static VariableCatalog of(Workflow workflow) {
            Map<String, VariableType> typesById = new LinkedHashMap<>();
            Set<String> names = new LinkedHashSet<>();
            Set<String> prefixes = new LinkedHashSet<>();

            for (Variable variable : workflow.getVariables()) {
                typesById.put(variable.getId(), variable.getType());
                names.add(variable.getName());
            }
            for (Node node : workflow.getNodes()) {
                if (node instanceof CalculationNode calc
                        && calc.getCalculation() != null
                        && !isBlank(calc.getCalculation().outputName())) {
                    typesById.putIfAbsent(
                            calc.getCalculation().derivedVariableId(), VariableType.NUMBER);
                    names.add(calc.getCalculation().outputName());
                } else if (node instanceof SubprocessNode sub
                        && !isBlank(sub.getOutputVariable())) {
                    prefixes.add(
                            "var_sub_" + Identifiers.slugify(sub.getOutputVariable()) + "_");
                    names.add(sub.getOutputVariable());
                }
            }
            return new VariableCatalog(typesById, names, prefixes);
        }

        List<String> ids() {
            return new ArrayList<>(typesById.keySet());
        }

        boolean isKnownId(String id) {
            return typesById.containsKey(id) || subprocessType(id).isPresent();
        }

        boolean isKnownName(String name) {
            return names.contains(name);
        }

        Optional<VariableType> typeOfId(String id) {
            VariableType type = typesById.get(id);
            return type != null ? Optional.of(type) : subprocessType(id);
        }

        boolean resolvesOperand(String ref) {
            if (isKnownId(ref) || isKnownName(ref)) {
                return true;
            }
            String slug = Identifiers.slugify(ref);
            return names.stream().anyMatch(n -> Identifiers.slugify(n).equals(slug));
        }

        private Optional<VariableType> subprocessType(String id) {
            if (id == null) {
                return Optional.empty();
            }
            for (String prefix : subprocessPrefixes) {
                if (id.startsWith(prefix)) {
                    return VariableType.fromWireName(id.substring(prefix.length()));
                }
            }
            return Optional.empty();
        }
    }
}

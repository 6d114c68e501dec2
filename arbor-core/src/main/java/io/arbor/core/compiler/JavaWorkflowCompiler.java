package io.arbor.core.compiler;

import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.CalculationOperator;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.Condition;
import io.arbor.core.exception.CompilationException;
import io.arbor.core.exception.EvaluationException;
import io.arbor.core.execution.OutputTypes;
import io.arbor.core.execution.SubworkflowResolver;
import io.arbor.core.workflow.Identifiers;
import io.arbor.core.workflow.SuccessorIndex;
import io.arbor.core.workflow.ValueRange;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableType;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.SubprocessNode;
import io.arbor.core.workflow.node.UnrecognizedNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Compiles a workflow graph into a standalone Java class.
///
/// The generated class holds one `public static Object` method per workflow: the root
/// workflow plus one `subflow_<id>` method for every sub-workflow it reaches. Parameters are
/// the input variables, typed `long`, `double`, `boolean`, `String` or `Object`. Running a
/// generated method returns what {@link io.arbor.core.execution.WorkflowInterpreter} returns
/// for the same inputs.
///
/// ### Node lowering
/// - `start`/`process` → straight continuation to the first child
/// - `decision` → `if/else` over the compiled condition
/// - `calculation` → `double` local, with domain guards mirroring the interpreter
/// - `subprocess` → call to the sub-workflow method, or a `null` placeholder when unresolved
/// - `end` → `return` of a typed literal, a template concatenation or a coerced variable
///
/// ### Failure tiers
/// A workflow without nodes fails the compilation. Every node-level problem is recorded as a
/// warning and lowered to a marked comment plus a statement that throws
/// `IllegalStateException` when reached, so one bad node never blocks the rest.
///
/// @implNote Instances are stateless apart from the resolver and may be shared. Each call to
/// {@link #compile} uses its own name tables.
/// @see CompilationResult
public class JavaWorkflowCompiler {

    private static final Logger logger = Logger.getLogger(JavaWorkflowCompiler.class.getName());

    /// Class name used when none is given.
    public static final String DEFAULT_CLASS_NAME = "CompiledWorkflows";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}]+)}");
    private static final Pattern QUALIFIED_NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final SubworkflowResolver resolver;

    public JavaWorkflowCompiler() {
        this(null);
    }

    /// Creates a compiler that inlines sub-workflows.
    ///
    /// @param resolver looks sub-workflows up by id, may be null (subprocess nodes then
    /// compile to placeholders)
    public JavaWorkflowCompiler(SubworkflowResolver resolver) {
        this.resolver = resolver;
    }

    /// Compiles a workflow into a class named {@value #DEFAULT_CLASS_NAME} in the default
    /// package.
    ///
    /// @param workflow the workflow, not null
    /// @return the result, never null
    public CompilationResult compile(Workflow workflow) {
        return compile(workflow, DEFAULT_CLASS_NAME, null);
    }

    /// Compiles a workflow into a named class.
    ///
    /// @param workflow the workflow, not null
    /// @param className simple name of the generated class, not null
    /// @param packageName package of the generated class, null or blank for the default
    /// package
    /// @return the result, never null
    public CompilationResult compile(Workflow workflow, String className, String packageName) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(className, "className must not be null");
        if (!Identifiers.isIdentifier(className) || JavaNameResolver.RESERVED.contains(className)) {
            return CompilationResult.failure("Invalid class name: '" + className + "'");
        }
        if (packageName != null
                && !packageName.isBlank()
                && !QUALIFIED_NAME.matcher(packageName).matches()) {
            return CompilationResult.failure("Invalid package name: '" + packageName + "'");
        }

        Session session = new Session();
        if (workflow.getId() != null) {
            session.callChain.addLast(workflow.getId());
        }
        String methodName = methodName(workflow);
        String rootMethod;
        try {
            rootMethod = compileMethod(workflow, methodName, session, "");
        } catch (CompilationException e) {
            logger.warning(
                    () -> "Compilation of '" + workflow.getId() + "' failed: " + e.getMessage());
            return CompilationResult.failure(e.getMessage());
        }

        String code = assemble(workflow, className, packageName, rootMethod, session);
        session.warnings.forEach(w -> logger.warning(() -> "Compile warning: " + w));
        logger.fine(
                () ->
                        "Compiled workflow '"
                                + workflow.getId()
                                + "' into "
                                + className
                                + " with "
                                + session.warnings.size()
                                + " warning(s)");
        return CompilationResult.success(code, session.warnings);
    }

    /// Returns the name of the generated method for a root workflow.
    ///
    /// @param workflow the workflow, not null
    /// @return a legal Java method name derived from the workflow name, never null
    public static String methodName(Workflow workflow) {
        String slug = Identifiers.slugify(workflow.getName());
        if (slug.isEmpty()) {
            return "workflow";
        }
        if (Character.isDigit(slug.charAt(0)) || JavaNameResolver.RESERVED.contains(slug)) {
            return "workflow_" + slug;
        }
        return slug;
    }

    /// Returns the name of the generated helper method for a sub-workflow.
    ///
    /// @param subworkflowId the sub-workflow id, not null
    /// @return `subflow_` followed by the id with every non-identifier character replaced
    public static String subflowMethodName(String subworkflowId) {
        return "subflow_" + subworkflowId.replaceAll("[^A-Za-z0-9_]", "_");
    }

    // -- Assembly -----------------------------------------------------------

    private static String assemble(
            Workflow workflow,
            String className,
            String packageName,
            String rootMethod,
            Session session) {
        CodeWriter out = new CodeWriter(0);
        if (packageName != null && !packageName.isBlank()) {
            out.line("package " + packageName + ";").blank();
        }
        out.line("import java.util.List;");
        out.line("import java.util.Locale;");
        out.line("import java.util.Objects;");
        out.blank();
        out.line("/**");
        out.line(" * Generated from workflow " + javadoc(workflow.getName()) + ".");
        out.line(" */");
        out.line("public final class " + className + " {");
        out.blank();
        out.indent().line("private " + className + "() {}").outdent();
        StringBuilder sb = new StringBuilder(out.toString());

        sb.append('\n').append(rootMethod);
        for (String method : session.methods) {
            sb.append('\n').append(method);
        }
        for (RuntimeHelper helper : session.expandedHelpers()) {
            sb.append('\n');
            for (String line : helper.source().split("\n")) {
                sb.append(line.isEmpty() ? "" : "    " + line).append('\n');
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private String compileMethod(
            Workflow workflow, String methodName, Session session, String warningPrefix)
            throws CompilationException {
        if (workflow.getNodes().isEmpty()) {
            throw new CompilationException("Workflow has no nodes");
        }
        MethodContext method = new MethodContext(workflow, session, warningPrefix);

        List<Node> starts = workflow.startNodes();
        Node start;
        if (starts.isEmpty()) {
            start = workflow.getNodes().get(0);
            method.warn("Workflow has no start node; compiling from '" + start.getId() + "'");
        } else {
            start = starts.get(0);
        }

        List<Parameter> parameters = session.parametersOf(workflow);
        SymbolTable symbols = new SymbolTable();
        CodeWriter out = new CodeWriter(1);

        out.line("/**");
        out.line(" * " + javadoc(workflow.getName()));
        if (!parameters.isEmpty()) {
            out.line(" *");
        }
        for (Parameter parameter : parameters) {
            method.names.allocate(parameter.javaName());
            symbols.declare(
                    parameter.variable().getId(),
                    parameter.variable().getName(),
                    new SymbolTable.Symbol(parameter.javaName(), parameter.type()));
            out.line(" * @param " + parameter.javaName() + " " + javadoc(parameter.describe()));
        }
        out.line(" * @return the workflow output");
        out.line(" */");
        out.line(
                "public static Object "
                        + methodName
                        + "("
                        + String.join(
                                ", ", parameters.stream().map(Parameter::declaration).toList())
                        + ") {");
        out.indent();
        for (Parameter parameter : parameters) {
            emitInputGuards(parameter, out);
        }
        method.visit(start, symbols, out, Set.of());
        out.outdent();
        out.line("}");
        return out.toString();
    }

    private static void emitInputGuards(Parameter parameter, CodeWriter out) {
        Variable variable = parameter.variable();
        String name = parameter.javaName();
        ValueRange range = variable.getRange();
        if (range != null && parameter.type().isNumeric()) {
            if (range.min() != null && Double.isFinite(range.min())) {
                out.line("if (" + name + " < " + CodeWriter.doubleLiteral(range.min()) + ") {");
                out.indent()
                        .line(
                                "throw new IllegalStateException(\"Value error: "
                                        + variable.getId()
                                        + "=\" + "
                                        + name
                                        + " + "
                                        + CodeWriter.stringLiteral(
                                                " below minimum " + formatBound(range.min()))
                                        + ");")
                        .outdent();
                out.line("}");
            }
            if (range.max() != null && Double.isFinite(range.max())) {
                out.line("if (" + name + " > " + CodeWriter.doubleLiteral(range.max()) + ") {");
                out.indent()
                        .line(
                                "throw new IllegalStateException(\"Value error: "
                                        + variable.getId()
                                        + "=\" + "
                                        + name
                                        + " + "
                                        + CodeWriter.stringLiteral(
                                                " exceeds maximum " + formatBound(range.max()))
                                        + ");")
                        .outdent();
                out.line("}");
            }
        }
        if (variable.getType() == VariableType.ENUM && !variable.getEnumValues().isEmpty()) {
            String values =
                    String.join(
                            ", ",
                            variable.getEnumValues().stream()
                                    .map(CodeWriter::stringLiteral)
                                    .toList());
            out.line("if (!List.of(" + values + ").contains(" + name + ")) {");
            out.indent()
                    .line(
                            "throw new IllegalStateException("
                                    + CodeWriter.stringLiteral(
                                            "Value error: "
                                                    + variable.getId()
                                                    + " must be one of "
                                                    + variable.getEnumValues()
                                                    + ", got '")
                                    + " + "
                                    + name
                                    + " + \"'\");")
                    .outdent();
            out.line("}");
        }
    }

    private static String formatBound(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String javadoc(String text) {
        return text == null ? "" : CodeWriter.comment(text).replace("*/", "* /");
    }

    // -- Per-compilation state ----------------------------------------------

    /// A method parameter bound to an input variable.
    private record Parameter(Variable variable, String javaName, JavaType type) {

        String declaration() {
            return type.declaration() + " " + javaName;
        }

        String describe() {
            String description = variable.getDescription();
            return description != null && !description.isBlank() ? description : variable.getName();
        }
    }

    /// State shared by the root method and every sub-workflow method it spawns.
    private static final class Session {
        private final Set<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
        private final Set<String> processedSubflows = new HashSet<>();
        /// Ids of the workflows whose methods are being compiled, outermost first.
        private final Deque<String> callChain = new ArrayDeque<>();
        private final Map<String, List<Parameter>> signatures = new HashMap<>();
        private final List<String> methods = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final ConditionCompiler conditions = new ConditionCompiler(helpers);

        /// Parameter list of a workflow method; computed once per workflow id.
        List<Parameter> parametersOf(Workflow workflow) {
            return signatures.computeIfAbsent(
                    workflow.getId(),
                    id -> {
                        JavaNameResolver names = new JavaNameResolver();
                        List<Parameter> parameters = new ArrayList<>();
                        for (Variable variable : workflow.inputVariables()) {
                            parameters.add(
                                    new Parameter(
                                            variable,
                                            names.allocate(variable.getName()),
                                            JavaType.forVariable(variable.getType())));
                        }
                        return List.copyOf(parameters);
                    });
        }

        /// Helpers in declaration order, with their dependencies.
        Set<RuntimeHelper> expandedHelpers() {
            Set<RuntimeHelper> all = EnumSet.noneOf(RuntimeHelper.class);
            helpers.forEach(helper -> addWithDependencies(helper, all));
            return all;
        }

        private static void addWithDependencies(RuntimeHelper helper, Set<RuntimeHelper> all) {
            if (all.add(helper)) {
                helper.dependencies().forEach(dependency -> addWithDependencies(dependency, all));
            }
        }
    }

    /// Lowers the nodes of one workflow into the body of one method.
    private final class MethodContext {
        private final Workflow workflow;
        private final SuccessorIndex successors;
        private final Session session;
        private final String warningPrefix;
        private final JavaNameResolver names = new JavaNameResolver();

        MethodContext(Workflow workflow, Session session, String warningPrefix) {
            this.workflow = workflow;
            this.successors = SuccessorIndex.of(workflow);
            this.session = session;
            this.warningPrefix = warningPrefix;
        }

        void warn(String message) {
            session.warnings.add(warningPrefix + message);
        }

        void visit(Node node, SymbolTable symbols, CodeWriter out, Set<String> path) {
            if (path.contains(node.getId())) {
                warn("Cycle detected at node '" + node.getId() + "'");
                fail(out, "Cycle detected at node '" + node.getId() + "'");
                return;
            }
            Set<String> here = new LinkedHashSet<>(path);
            here.add(node.getId());

            switch (node.getNodeType()) {
                case START, PROCESS ->
                        continueTo(
                                node,
                                symbols,
                                out,
                                here,
                                "Node '" + node.getId() + "' has no children");
                case DECISION -> decision((DecisionNode) node, symbols, out, here);
                case CALCULATION -> calculation((CalculationNode) node, symbols, out, here);
                case SUBPROCESS -> subprocess((SubprocessNode) node, symbols, out, here);
                case END -> end((EndNode) node, symbols, out);
                case UNRECOGNIZED -> {
                    String message =
                            "Unknown node type '"
                                    + ((UnrecognizedNode) node).getRawType()
                                    + "' at node '"
                                    + node.getId()
                                    + "'";
                    warn(message);
                    fail(out, message);
                }
            }
        }

        private void continueTo(
                Node node, SymbolTable symbols, CodeWriter out, Set<String> path, String noChild) {
            Optional<Node> next = successors.firstChild(node.getId());
            if (next.isEmpty()) {
                warn(noChild);
                fail(out, noChild);
                return;
            }
            visit(next.get(), symbols, out, path);
        }

        // -- Decision -------------------------------------------------------

        private void decision(
                DecisionNode node, SymbolTable symbols, CodeWriter out, Set<String> path) {
            Optional<Condition> condition = node.effectiveCondition();
            List<SuccessorIndex.Successor> children = successors.childrenOf(node.getId());
            if (condition.isEmpty()) {
                warn(
                        "Decision node '"
                                + node.getId()
                                + "' has no condition; following the first child");
                out.line(
                        "// WARNING: decision '"
                                + CodeWriter.comment(node.displayName())
                                + "' has no condition, following the first child");
                continueTo(
                        node,
                        symbols,
                        out,
                        path,
                        "Decision node '" + node.getId() + "' has no children");
                return;
            }

            String description = describe(condition.get());
            String expression;
            try {
                expression = session.conditions.compile(condition.get(), symbols);
            } catch (CompilationException e) {
                warn(
                        "Decision node '"
                                + node.getId()
                                + "': cannot compile condition '"
                                + description
                                + "': "
                                + e.getMessage());
                out.line(
                        "// ERROR: cannot compile condition '"
                                + CodeWriter.comment(description)
                                + "': "
                                + CodeWriter.comment(e.getMessage()));
                fail(
                        out,
                        "Failed to evaluate condition '"
                                + description
                                + "' at node '"
                                + node.getId()
                                + "': "
                                + e.getMessage());
                return;
            }

            if (children.isEmpty()) {
                warn("Decision node '" + node.getId() + "' has no children");
                fail(out, "Decision node '" + node.getId() + "' has no children");
                return;
            }
            if (children.size() == 1) {
                out.line("// " + CodeWriter.comment(description) + ": single branch");
                visit(children.get(0).node(), symbols, out, path);
                return;
            }

            out.line("if (" + unwrap(expression) + ") {");
            out.indent();
            branch(
                    node,
                    SuccessorIndex.selectBranch(children, true),
                    true,
                    description,
                    symbols,
                    out,
                    path);
            out.outdent();
            out.line("} else {");
            out.indent();
            branch(
                    node,
                    SuccessorIndex.selectBranch(children, false),
                    false,
                    description,
                    symbols,
                    out,
                    path);
            out.outdent();
            out.line("}");
        }

        private void branch(
                DecisionNode decision,
                Optional<Node> target,
                boolean outcome,
                String description,
                SymbolTable symbols,
                CodeWriter out,
                Set<String> path) {
            if (target.isPresent()) {
                visit(target.get(), symbols.copy(), out, path);
                return;
            }
            String message =
                    "No branch found for condition '"
                            + description
                            + "' = "
                            + outcome
                            + " at node '"
                            + decision.getId()
                            + "'";
            warn(message);
            fail(out, message);
        }

        // -- Calculation ----------------------------------------------------

        private void calculation(
                CalculationNode node, SymbolTable symbols, CodeWriter out, Set<String> path) {
            Calculation calculation = node.getCalculation();
            String name = node.displayName();
            if (calculation == null
                    || calculation.outputName() == null
                    || calculation.outputName().isBlank()) {
                String message = "Calculation node '" + name + "' is missing an output name";
                warn(message);
                fail(out, message);
                return;
            }

            List<String> operands = new ArrayList<>();
            for (Operand operand : calculation.operands()) {
                Optional<String> code = operandCode(operand, name, symbols, out);
                if (code.isEmpty()) {
                    return;
                }
                operands.add(code.get());
            }

            String expression;
            Optional<CalculationOperator> operator =
                    CalculationOperator.fromWireName(calculation.operator());
            if (operator.isEmpty()) {
                warn(
                        "Calculation node '"
                                + name
                                + "': unknown operator '"
                                + calculation.operator()
                                + "', using 0");
                out.line(
                        "// WARNING: unknown operator '"
                                + CodeWriter.comment(calculation.operator())
                                + "', using 0");
                expression = "0.0";
            } else {
                Optional<String> arityError = operator.get().checkArity(operands.size());
                if (arityError.isPresent()) {
                    String message = "Calculation node '" + name + "' failed: " + arityError.get();
                    warn(message);
                    fail(out, message);
                    return;
                }
                emitDomainGuards(operator.get(), operands, name, out);
                expression = operatorExpression(operator.get(), operands);
            }

            String local = names.allocate(calculation.outputName());
            out.line("double " + local + " = " + expression + ";");
            symbols.declare(
                    calculation.derivedVariableId(),
                    calculation.outputName(),
                    new SymbolTable.Symbol(local, JavaType.DOUBLE));
            continueTo(node, symbols, out, path, "Node '" + node.getId() + "' has no children");
        }

        private Optional<String> operandCode(
                Operand operand, String nodeName, SymbolTable symbols, CodeWriter out) {
            if (operand instanceof Operand.Literal literal) {
                double value = literal.value();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    String message =
                            "Calculation node '"
                                    + nodeName
                                    + "': operand "
                                    + value
                                    + " is not a finite number";
                    warn(message);
                    fail(out, message);
                    return Optional.empty();
                }
                return Optional.of(CodeWriter.doubleLiteral(value));
            }
            String ref = ((Operand.Reference) operand).ref();
            Optional<SymbolTable.Symbol> symbol = symbols.forOperand(ref);
            if (symbol.isEmpty()) {
                String message =
                        "Calculation node '" + nodeName + "': operand '" + ref + "' not found";
                warn(message);
                fail(out, message);
                return Optional.empty();
            }
            String javaName = symbol.get().javaName();
            return switch (symbol.get().type()) {
                case DOUBLE -> Optional.of(javaName);
                case LONG -> Optional.of("(double) " + javaName);
                case OBJECT -> Optional.of("((Number) " + javaName + ").doubleValue()");
                default -> {
                    String message =
                            "Calculation node '"
                                    + nodeName
                                    + "': operand '"
                                    + ref
                                    + "' is not numeric";
                    warn(message);
                    fail(out, message);
                    yield Optional.empty();
                }
            };
        }

        private void emitDomainGuards(
                CalculationOperator operator,
                List<String> operands,
                String nodeName,
                CodeWriter out) {
            String a = operands.isEmpty() ? null : operands.get(0);
            String b = operands.size() > 1 ? operands.get(1) : null;
            switch (operator) {
                case SQRT -> guard(out, a + " < 0", nodeName, "sqrt",
                        "Cannot compute square root of negative number: ", a);
                case RECIPROCAL -> guard(out, a + " == 0", nodeName, "reciprocal",
                        "Cannot compute reciprocal of zero", null);
                case LN -> guard(out, a + " <= 0", nodeName, "ln",
                        "Cannot compute natural log of non-positive number: ", a);
                case LOG10 -> guard(out, a + " <= 0", nodeName, "log10",
                        "Cannot compute log10 of non-positive number: ", a);
                case ASIN, ACOS ->
                        guard(
                                out,
                                a + " < -1 || " + a + " > 1",
                                nodeName,
                                operator.wireName(),
                                operator.wireName() + " argument must be in [-1, 1], got: ",
                                a);
                case DIVIDE ->
                        guard(out, b + " == 0", nodeName, "divide", "Division by zero", null);
                case FLOOR_DIVIDE ->
                        guard(
                                out,
                                b + " == 0",
                                nodeName,
                                "floor_divide",
                                "Floor division by zero",
                                null);
                case MODULO -> guard(out, b + " == 0", nodeName, "modulo", "Modulo by zero", null);
                case LOG -> {
                    guard(out, a + " <= 0", nodeName, "log",
                            "Cannot compute log of non-positive number: ", a);
                    guard(out, b + " <= 0 || " + b + " == 1", nodeName, "log",
                            "Log base must be positive and != 1, got: ", b);
                }
                case GEOMETRIC_MEAN -> {
                    for (String operand : operands) {
                        guard(out, operand + " < 0", nodeName, "geometric_mean",
                                "Cannot compute geometric mean with negative value: ", operand);
                    }
                }
                case HARMONIC_MEAN -> {
                    for (String operand : operands) {
                        guard(out, operand + " <= 0", nodeName, "harmonic_mean",
                                "Harmonic mean requires positive values, got: ", operand);
                    }
                }
                default -> {
                    // total over the reals
                }
            }
        }

        private void guard(
                CodeWriter out,
                String test,
                String nodeName,
                String operator,
                String message,
                String valueCode) {
            String prefix =
                    "Calculation node '"
                            + nodeName
                            + "' failed: Operator '"
                            + operator
                            + "' error: "
                            + message;
            out.line("if (" + test + ") {");
            out.indent().line("throw new IllegalStateException(" + CodeWriter.stringLiteral(prefix)
                    + (valueCode != null ? " + (" + valueCode + ")" : "") + ");").outdent();
            out.line("}");
        }

        private String operatorExpression(CalculationOperator operator, List<String> ops) {
            String a = ops.get(0);
            String b = ops.size() > 1 ? ops.get(1) : null;
            return switch (operator) {
                case NEGATE -> "-(" + a + ")";
                case ABS -> "Math.abs(" + a + ")";
                case SQRT -> "Math.sqrt(" + a + ")";
                case SQUARE -> a + " * " + a;
                case CUBE -> a + " * " + a + " * " + a;
                case RECIPROCAL -> "1.0 / " + a;
                case FLOOR -> "Math.floor(" + a + ")";
                case CEIL -> "Math.ceil(" + a + ")";
                case ROUND -> "Math.rint(" + a + ")";
                case SIGN -> "Math.signum(" + a + ")";
                case LN -> "Math.log(" + a + ")";
                case LOG10 -> "Math.log10(" + a + ")";
                case EXP -> "Math.exp(" + a + ")";
                case SIN -> "Math.sin(" + a + ")";
                case COS -> "Math.cos(" + a + ")";
                case TAN -> "Math.tan(" + a + ")";
                case ASIN -> "Math.asin(" + a + ")";
                case ACOS -> "Math.acos(" + a + ")";
                case ATAN -> "Math.atan(" + a + ")";
                case DEGREES -> "Math.toDegrees(" + a + ")";
                case RADIANS -> "Math.toRadians(" + a + ")";
                case SUBTRACT -> a + " - " + b;
                case DIVIDE -> a + " / " + b;
                case FLOOR_DIVIDE -> "Math.floor(" + a + " / " + b + ")";
                case MODULO -> a + " - " + b + " * Math.floor(" + a + " / " + b + ")";
                case POWER -> "Math.pow(" + a + ", " + b + ")";
                case LOG -> "Math.log(" + a + ") / Math.log(" + b + ")";
                case ATAN2 -> "Math.atan2(" + a + ", " + b + ")";
                case ADD, SUM -> String.join(" + ", ops);
                case MULTIPLY -> String.join(" * ", ops);
                case MIN -> fold("Math.min", ops);
                case MAX -> fold("Math.max", ops);
                case AVERAGE -> "(" + String.join(" + ", ops) + ") / " + ops.size() + ".0";
                case HYPOT -> helperCall(RuntimeHelper.HYPOT, "hypot", ops);
                case GEOMETRIC_MEAN ->
                        helperCall(RuntimeHelper.GEOMETRIC_MEAN, "geometricMean", ops);
                case HARMONIC_MEAN -> helperCall(RuntimeHelper.HARMONIC_MEAN, "harmonicMean", ops);
                case VARIANCE -> helperCall(RuntimeHelper.VARIANCE, "variance", ops);
                case STD_DEV -> helperCall(RuntimeHelper.STD_DEV, "stdDev", ops);
                case RANGE -> helperCall(RuntimeHelper.RANGE, "range", ops);
            };
        }

        private String fold(String function, List<String> ops) {
            String result = ops.get(0);
            for (int i = 1; i < ops.size(); i++) {
                result = function + "(" + result + ", " + ops.get(i) + ")";
            }
            return result;
        }

        private String helperCall(RuntimeHelper helper, String function, List<String> ops) {
            session.helpers.add(helper);
            return function + "(" + String.join(", ", ops) + ")";
        }

        // -- Sub-workflow ---------------------------------------------------

        private void subprocess(
                SubprocessNode node, SymbolTable symbols, CodeWriter out, Set<String> path) {
            String label = node.displayName();
            String subworkflowId = node.getSubworkflowId();
            String outputVariable = node.getOutputVariable();
            if (subworkflowId == null || subworkflowId.isBlank()) {
                String message = "Subprocess node '" + label + "' missing subworkflow_id";
                warn(message);
                fail(out, message);
                return;
            }
            if (outputVariable == null || outputVariable.isBlank()) {
                String message = "Subprocess node '" + label + "' missing output_variable";
                warn(message);
                fail(out, message);
                return;
            }

            if (session.callChain.contains(subworkflowId)) {
                List<String> cycle = new ArrayList<>(session.callChain);
                cycle.add(subworkflowId);
                String message =
                        "Circular subflow detected: "
                                + String.join(" -> ", cycle)
                                + ". A workflow cannot call itself directly or indirectly.";
                warn(message);
                fail(out, message);
                return;
            }

            String local = names.allocate(outputVariable);
            Optional<Workflow> subworkflow =
                    resolver == null ? Optional.empty() : resolver.resolve(subworkflowId);
            if (subworkflow.isEmpty()) {
                warn(
                        resolver == null
                                ? "Subprocess node '"
                                        + label
                                        + "': no subworkflow resolver configured; "
                                        + "emitted a placeholder for '"
                                        + subworkflowId
                                        + "'"
                                : "Subprocess node '"
                                        + label
                                        + "': subworkflow '"
                                        + subworkflowId
                                        + "' not found; emitted a placeholder");
                out.line(
                        "// WARNING: subworkflow '"
                                + CodeWriter.comment(subworkflowId)
                                + "' not resolved, placeholder value");
                out.line("Object " + local + " = null;");
            } else {
                Optional<String> arguments = arguments(node, subworkflow.get(), symbols, out);
                if (arguments.isEmpty()) {
                    return;
                }
                String method = subflowMethodName(subworkflowId);
                if (session.processedSubflows.add(subworkflowId)) {
                    compileSubflow(subworkflow.get(), method);
                }
                out.line("Object " + local + " = " + method + "(" + arguments.get() + ");");
            }

            symbols.declarePrefix(
                    "var_sub_" + Identifiers.slugify(outputVariable) + "_",
                    outputVariable,
                    new SymbolTable.Symbol(local, JavaType.OBJECT));
            continueTo(
                    node,
                    symbols,
                    out,
                    path,
                    "Subprocess node '"
                            + label
                            + "' has no children. Flow must continue after subprocess or end"
                            + " explicitly.");
        }

        private void compileSubflow(Workflow subworkflow, String method) {
            String prefix = "Subflow '" + subworkflow.getId() + "': ";
            String source;
            session.callChain.addLast(subworkflow.getId());
            try {
                source = compileMethod(subworkflow, method, session, prefix);
            } catch (CompilationException e) {
                session.warnings.add(prefix + e.getMessage());
                source = failingStub(method, session.parametersOf(subworkflow), e.getMessage());
            } finally {
                session.callChain.removeLast();
            }
            session.methods.add(source);
        }

        private String failingStub(
                String method, List<Parameter> parameters, String message) {
            CodeWriter stub = new CodeWriter(1);
            stub.line(
                    "public static Object "
                            + method
                            + "("
                            + String.join(
                                    ", ", parameters.stream().map(Parameter::declaration).toList())
                            + ") {");
            stub.indent();
            stub.line("// ERROR: " + CodeWriter.comment(message));
            stub.line(
                    "throw new IllegalStateException("
                            + CodeWriter.stringLiteral(message)
                            + ");");
            stub.outdent();
            stub.line("}");
            return stub.toString();
        }

        /// Builds the argument list for a sub-workflow call, or emits a failure and returns empty.
        private Optional<String> arguments(
                SubprocessNode node, Workflow subworkflow, SymbolTable symbols, CodeWriter out) {
            String label = node.displayName();
            Map<String, SymbolTable.Symbol> boundByTarget = new HashMap<>();
            for (Map.Entry<String, String> mapping : node.getInputMapping().entrySet()) {
                Optional<SymbolTable.Symbol> parent = symbols.byNameFirst(mapping.getKey());
                if (parent.isEmpty()) {
                    String message =
                            "Subprocess '"
                                    + label
                                    + "': input_mapping references non-existent parent input '"
                                    + mapping.getKey()
                                    + "'";
                    warn(message);
                    fail(out, message);
                    return Optional.empty();
                }
                Optional<Variable> target = subworkflow.findVariable(mapping.getValue());
                if (target.isEmpty()) {
                    String message =
                            "Subprocess '"
                                    + label
                                    + "': input_mapping maps to non-existent subworkflow input '"
                                    + mapping.getValue()
                                    + "'";
                    warn(message);
                    fail(out, message);
                    return Optional.empty();
                }
                boundByTarget.put(target.get().getId(), parent.get());
            }

            List<String> arguments = new ArrayList<>();
            for (Parameter parameter : session.parametersOf(subworkflow)) {
                String inputId = parameter.variable().getId();
                SymbolTable.Symbol source = boundByTarget.get(inputId);
                if (source == null) {
                    String message = "Subprocess node '" + label + "' failed: Subworkflow '"
                            + subworkflow.getName() + "' returned error: Missing required input: "
                            + inputId;
                    warn(message);
                    fail(out, message);
                    return Optional.empty();
                }
                Optional<String> argument = convert(source, parameter.type());
                if (argument.isEmpty()) {
                    String message = "Subprocess node '" + label + "' failed: Subworkflow '"
                            + subworkflow.getName() + "' returned error: " + inputId + " must be "
                            + parameter.variable().getType().wireName() + ", got "
                            + source.type().declaration();
                    warn(message);
                    fail(out, message);
                    return Optional.empty();
                }
                arguments.add(argument.get());
            }
            return Optional.of(String.join(", ", arguments));
        }

        private Optional<String> convert(SymbolTable.Symbol source, JavaType target) {
            String name = source.javaName();
            if (source.type() == target || target == JavaType.OBJECT) {
                return Optional.of(name);
            }
            if (source.type() == JavaType.LONG && target == JavaType.DOUBLE) {
                return Optional.of("(double) " + name);
            }
            if (source.type() == JavaType.OBJECT) {
                return Optional.of(switch (target) {
                    case LONG -> "((Number) " + name + ").longValue()";
                    case DOUBLE -> "((Number) " + name + ").doubleValue()";
                    case BOOLEAN -> "(Boolean) " + name;
                    default -> "(String) " + name;
                });
            }
            return Optional.empty();
        }

        // -- Output ---------------------------------------------------------

        private void end(EndNode node, SymbolTable symbols, CodeWriter out) {
            String type = normalize(OutputTypes.effectiveType(
                    workflow.getOutputType(), node.effectiveOutputType()));
            String template = outputTemplate(node);

            if (template != null) {
                Matcher single = PLACEHOLDER.matcher(template.trim());
                if (single.matches() && OutputTypes.keepsRawValue(type)) {
                    String name = single.group(1).trim();
                    Optional<SymbolTable.Symbol> symbol = symbols.byNameFirst(name);
                    if (symbol.isEmpty()) {
                        unknownTemplateVariable(name, out);
                        return;
                    }
                    out.line("return " + rawOutput(type, symbol.get()) + ";");
                    return;
                }
                Optional<String> text = concatenation(template, symbols, out);
                if (text.isPresent()) {
                    if (type.equals("json")) {
                        warn("End node '" + node.getId() + "': json output is returned as text");
                    }
                    out.line("return " + castText(type, text.get()) + ";");
                }
                return;
            }

            Object value = node.getOutputValue() != null
                    ? node.getOutputValue()
                    : (node.getLabel() != null ? node.getLabel() : "");
            Object cast;
            try {
                cast = OutputTypes.cast(type, value, null);
            } catch (EvaluationException e) {
                warn("End node '" + node.getId() + "': " + e.getMessage());
                fail(out, e.getMessage());
                return;
            }
            out.line("return " + typedLiteral(cast, node) + ";");
        }

        private String outputTemplate(EndNode node) {
            if (node.hasTemplate()) {
                return node.getOutputTemplate();
            }
            String label = node.getLabel();
            if (node.getOutputValue() == null
                    && label != null
                    && PLACEHOLDER.matcher(label).find()) {
                return label;
            }
            return null;
        }

        private Optional<String> concatenation(
                String template, SymbolTable symbols, CodeWriter out) {
            List<String> parts = new ArrayList<>();
            Matcher matcher = PLACEHOLDER.matcher(template);
            int last = 0;
            while (matcher.find()) {
                if (matcher.start() > last) {
                    parts.add(CodeWriter.stringLiteral(template.substring(last, matcher.start())));
                }
                String name = matcher.group(1).trim();
                Optional<SymbolTable.Symbol> symbol = symbols.byNameFirst(name);
                if (symbol.isEmpty()) {
                    unknownTemplateVariable(name, out);
                    return Optional.empty();
                }
                parts.add("String.valueOf(" + symbol.get().javaName() + ")");
                last = matcher.end();
            }
            if (last < template.length()) {
                parts.add(CodeWriter.stringLiteral(template.substring(last)));
            }
            if (parts.isEmpty()) {
                return Optional.of("\"\"");
            }
            return Optional.of(String.join(" + ", parts));
        }

        private void unknownTemplateVariable(String name, CodeWriter out) {
            String message = "Output template references unknown variable '" + name + "'";
            warn(message);
            fail(out, message);
        }

        private String rawOutput(String type, SymbolTable.Symbol symbol) {
            String name = symbol.javaName();
            JavaType source = symbol.type();
            return switch (type) {
                case "int" -> switch (source) {
                    case LONG -> "Long.valueOf(" + name + ")";
                    case DOUBLE -> "Long.valueOf((long) " + name + ")";
                    default -> helper(RuntimeHelper.TO_LONG, "toLong(" + name + ")");
                };
                case "float", "number" -> switch (source) {
                    case LONG -> "Double.valueOf((double) " + name + ")";
                    case DOUBLE -> "Double.valueOf(" + name + ")";
                    default -> helper(RuntimeHelper.TO_DOUBLE, "toDouble(" + name + ")");
                };
                case "bool" -> source == JavaType.BOOLEAN
                        ? "Boolean.valueOf(" + name + ")"
                        : helper(RuntimeHelper.TO_BOOL, "toBool(" + name + ")");
                default -> name;
            };
        }

        private String castText(String type, String text) {
            return switch (type) {
                case "int" -> helper(RuntimeHelper.TO_LONG, "toLong(" + text + ")");
                case "float", "number" -> helper(RuntimeHelper.TO_DOUBLE, "toDouble(" + text + ")");
                case "bool" -> helper(RuntimeHelper.TO_BOOL, "toBool(" + text + ")");
                default -> text;
            };
        }

        private String helper(RuntimeHelper helper, String call) {
            session.helpers.add(helper);
            return call;
        }

        private String typedLiteral(Object value, EndNode node) {
            if (value instanceof Long l) {
                return "Long.valueOf(" + CodeWriter.longLiteral(l) + ")";
            }
            if (value instanceof Double d) {
                if (Double.isNaN(d)) {
                    return "Double.valueOf(Double.NaN)";
                }
                if (Double.isInfinite(d)) {
                    return d > 0
                            ? "Double.valueOf(Double.POSITIVE_INFINITY)"
                            : "Double.valueOf(Double.NEGATIVE_INFINITY)";
                }
                return "Double.valueOf(" + CodeWriter.doubleLiteral(d) + ")";
            }
            if (value instanceof Boolean b) {
                return b ? "Boolean.TRUE" : "Boolean.FALSE";
            }
            if (value != null && !(value instanceof String)) {
                warn("End node '" + node.getId() + "': "
                        + value.getClass().getSimpleName() + " output value is returned as text");
            }
            return CodeWriter.stringLiteral(String.valueOf(value));
        }

        private void fail(CodeWriter out, String message) {
            out.line("throw new IllegalStateException(" + CodeWriter.stringLiteral(message) + ");");
        }
    }

    // -- Utilities ----------------------------------------------------------

    private static String describe(Condition condition) {
        if (condition instanceof Condition.Structured s) {
            return s.inputId() + " " + s.comparator() + " " + s.value()
                    + (s.value2() != null ? " " + s.value2() : "");
        }
        return ((Condition.Expression) condition).text();
    }

    private static String normalize(String type) {
        return type == null ? "string" : type.trim().toLowerCase(Locale.ROOT);
    }

    /// Strips one pair of parentheses that encloses the whole expression.
    static String unwrap(String expression) {
        if (!expression.startsWith("(") || !expression.endsWith(")")) {
            return expression;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < expression.length() - 1) {
                    return expression;
                }
            }
        }
        return expression.substring(1, expression.length() - 1);
    }
}

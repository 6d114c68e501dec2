package io.arbor.core;

import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.Condition;
import io.arbor.core.workflow.Edge;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableType;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.ProcessNode;
import io.arbor.core.workflow.node.StartNode;
import io.arbor.core.workflow.node.SubprocessNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/// Builders for complete nodes and small workflows used across the core tests.
public final class WorkflowFixtures {

    private WorkflowFixtures() {}

    public static StartNode start(String id) {
        return StartNode.builder().id(id).label("Start").position(0.0, 0.0).build();
    }

    public static ProcessNode process(String id, String label) {
        return ProcessNode.builder().id(id).label(label).position(0.0, 0.0).build();
    }

    public static DecisionNode decision(String id, String label) {
        return DecisionNode.builder().id(id).label(label).position(0.0, 0.0).build();
    }

    public static DecisionNode decision(String id, String label, Condition.Structured condition) {
        return DecisionNode.builder()
                .id(id)
                .label(label)
                .position(0.0, 0.0)
                .condition(condition)
                .build();
    }

    public static CalculationNode calculation(
            String id, String output, String operator, Operand... operands) {
        return CalculationNode.builder()
                .id(id)
                .label(output)
                .position(0.0, 0.0)
                .calculation(new Calculation(output, operator, Arrays.asList(operands)))
                .build();
    }

    public static SubprocessNode subprocess(
            String id, String subworkflowId, Map<String, String> mapping, String outputVariable) {
        return SubprocessNode.builder()
                .id(id)
                .label("Call " + subworkflowId)
                .position(0.0, 0.0)
                .subworkflowId(subworkflowId)
                .inputMapping(mapping)
                .outputVariable(outputVariable)
                .build();
    }

    public static EndNode end(String id, String label) {
        return EndNode.builder().id(id).label(label).position(0.0, 0.0).build();
    }

    public static EndNode end(String id, String label, String outputType, String template) {
        return EndNode.builder()
                .id(id)
                .label(label)
                .position(0.0, 0.0)
                .outputType(outputType)
                .outputTemplate(template)
                .build();
    }

    public static Variable input(String id, String name, VariableType type) {
        return Variable.builder().id(id).name(name).type(type).build();
    }

    public static Operand ref(String ref) {
        return new Operand.Reference(ref);
    }

    public static Operand literal(double value) {
        return new Operand.Literal(value);
    }

    public static FlowBuilder flow(String id) {
        return new FlowBuilder(id);
    }

    /// Weight/Height inputs, BMI = Weight / Height², branch on `BMI lt 16`.
    public static Workflow bmi() {
        return flow("bmi")
                .name("BMI check")
                .variable(input("var_weight_float", "Weight", VariableType.FLOAT))
                .variable(input("var_height_float", "Height", VariableType.FLOAT))
                .node(start("s"))
                .node(calculation("sq", "Height Squared", "square", ref("Height")))
                .node(calculation("calc", "BMI", "divide", ref("Weight"), ref("var_calc_height_squared_number")))
                .node(decision("d", "Underweight?", Condition.Structured.of("var_calc_bmi_number", "lt", 16)))
                .node(end("low", "Underweight"))
                .node(end("ok", "BMI {BMI}", "string", null))
                .edge("s", "sq")
                .edge("sq", "calc")
                .edge("calc", "d")
                .edge("d", "low", "yes")
                .edge("d", "ok", "no")
                .build();
    }

    public static final class FlowBuilder {
        private final Workflow.Builder builder;
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<Variable> variables = new ArrayList<>();

        private FlowBuilder(String id) {
            this.builder = Workflow.builder().id(id).name(id);
        }

        public FlowBuilder name(String name) {
            builder.name(name);
            return this;
        }

        public FlowBuilder outputType(String outputType) {
            builder.outputType(outputType);
            return this;
        }

        public FlowBuilder variable(Variable variable) {
            variables.add(variable);
            return this;
        }

        public FlowBuilder node(Node node) {
            nodes.add(node);
            return this;
        }

        public FlowBuilder edge(String from, String to) {
            edges.add(Edge.of(from, to));
            return this;
        }

        public FlowBuilder edge(String from, String to, String label) {
            edges.add(Edge.of(from, to, label));
            return this;
        }

        public Workflow build() {
            return builder.nodes(nodes).edges(edges).variables(variables).build();
        }
    }
}

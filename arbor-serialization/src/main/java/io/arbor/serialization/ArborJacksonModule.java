package io.arbor.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.arbor.core.workflow.Edge;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.node.Node;
import io.arbor.serialization.mixin.WorkflowBuilderMixin;
import io.arbor.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Arbor serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs** (snake_case document fields, aliases and
/// validation of malformed input):
/// - `Node`: `NodeSerializer` / `NodeDeserializer`, discriminator: `"type"`
/// - `Edge`: `EdgeSerializer` / `EdgeDeserializer`, `source`/`target` accepted for
/// `from`/`to`
/// - `Variable`: `VariableSerializer` / `VariableDeserializer`
///
/// **Mixin/builder pair**:
/// - `Workflow` + `Workflow.Builder`
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see WorkflowSerializer for the convenience factory API
public class ArborJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3190482811675528027L;

    public ArborJacksonModule() {
        super("ArborJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(Edge.class, new EdgeSerializer());
        addDeserializer(Edge.class, new EdgeDeserializer());

        addSerializer(Variable.class, new VariableSerializer());
        addDeserializer(Variable.class, new VariableDeserializer());
    }

    /// Applies mixin annotations to the workflow and its builder.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);
    }
}

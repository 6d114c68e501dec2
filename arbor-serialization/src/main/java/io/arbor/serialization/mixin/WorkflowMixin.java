package io.arbor.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.arbor.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder and fixes the
/// document field names.
///
/// Applied to `Workflow.class` via `ArborJacksonModule.setupModule()`.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered so
/// Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see WorkflowBuilderMixin
/// @see io.arbor.serialization.ArborJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
@JsonPropertyOrder({"id", "name", "output_type", "variables", "nodes", "edges"})
public abstract class WorkflowMixin {

    @JsonProperty("output_type")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    abstract String getOutputType();
}

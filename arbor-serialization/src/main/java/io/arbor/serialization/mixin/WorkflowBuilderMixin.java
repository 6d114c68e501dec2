package io.arbor.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.Workflow;
import java.util.List;

/// Jackson mixin for `Workflow.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names.
/// `output_type` maps to `outputType`, and `inputs` is accepted as an alias of `variables`.
///
/// @see WorkflowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {

    @JsonProperty("output_type")
    abstract Workflow.Builder outputType(String outputType);

    @JsonAlias("inputs")
    abstract Workflow.Builder variables(List<Variable> variables);
}

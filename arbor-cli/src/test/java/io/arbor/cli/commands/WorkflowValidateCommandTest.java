package io.arbor.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class WorkflowValidateCommandTest extends BaseWorkflowCommandTest {

    @Test
    void shouldValidateWorkflowSuccessfully() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);

        // When
        int exitCode = execute("validate", file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out())
                .contains(" [OK] Workflow is valid!")
                .contains("Name: BMI check")
                .contains("Nodes: 6")
                .contains("Edges: 5")
                .contains("Inputs: 2");
        assertThat(err()).isEmpty();
    }

    @Test
    void shouldListFindingsAndFail() throws Exception {
        // Given
        Path file = writeWorkflow("orphan.json", ORPHAN_WORKFLOW);

        // When
        int exitCode = execute("validate", file.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err())
                .contains("Node 'Orphan' is not reachable from the start node")
                .contains(" [FAIL] Validation failed with 1 error(s)");
        assertThat(out()).doesNotContain("Workflow is valid");
    }

    @Test
    void shouldSkipGraphChecksWhenLenient() throws Exception {
        // Given
        Path file = writeWorkflow("orphan.json", ORPHAN_WORKFLOW);

        // When
        int exitCode = execute("validate", "--lenient", file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out()).contains("Workflow is valid!").contains("Nodes: 3");
    }

    @Test
    void shouldFailWhenFileIsMissing() {
        // When
        int exitCode = execute("validate", tempDir.resolve("missing.json").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains(" [FAIL] Workflow file not found: ");
    }

    @Test
    void shouldFailOnMalformedDocument() throws Exception {
        // Given
        Path file = writeWorkflow("broken.json", "{\"id\": \"x\", \"nodes\": [");

        // When
        int exitCode = execute("validate", file.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains(" [FAIL] Failed to deserialize workflow:");
    }

    @Test
    void shouldRejectMissingWorkflowArgument() {
        // When
        int exitCode = execute("validate");

        // Then
        assertThat(exitCode).isEqualTo(2);
        assertThat(err()).contains("Missing required parameter");
    }
}

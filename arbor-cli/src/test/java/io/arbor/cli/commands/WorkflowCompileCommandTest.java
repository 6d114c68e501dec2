package io.arbor.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class WorkflowCompileCommandTest extends BaseWorkflowCommandTest {

    private static final String MEDIAN_WORKFLOW =
            """
            {
              "id": "mid",
              "name": "Midpoint",
              "nodes": [
                {"id": "s", "type": "start", "label": "Start", "x": 0, "y": 0},
                {"id": "c", "type": "calculation", "label": "Mid", "x": 0, "y": 100,
                 "calculation": {"output": "Mid", "operator": "median", "operands": [1, 2]}},
                {"id": "e", "type": "end", "label": "{Mid}", "x": 0, "y": 200}
              ],
              "edges": [{"from": "s", "to": "c"}, {"from": "c", "to": "e"}]
            }
            """;

    @Test
    void shouldPrintGeneratedSourceToStdout() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);

        // When
        int exitCode = execute("compile", file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out())
                .startsWith("import java.util.List;")
                .contains("public final class CompiledWorkflows {")
                .contains("public static Object bmi_check(");
    }

    @Test
    void shouldApplyClassAndPackageOptions() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);

        // When
        int exitCode = execute(
                "compile", "--class-name", "BmiRules", "--package", "com.acme", file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out()).startsWith("package com.acme;").contains("public final class BmiRules {");
    }

    @Test
    void shouldWriteIntoPackageDirectory() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);
        Path outputDir = Files.createDirectories(tempDir.resolve("generated"));

        // When
        int exitCode = execute(
                "compile",
                "--class-name", "BmiRules",
                "--package", "com.acme",
                "-o", outputDir.toString(),
                file.toString());

        // Then
        Path expected = outputDir.resolve("com/acme/BmiRules.java");
        assertThat(exitCode).isZero();
        assertThat(expected).exists();
        assertThat(Files.readString(expected)).contains("public final class BmiRules {");
        assertThat(out()).contains(" [OK] Wrote " + expected);
    }

    @Test
    void shouldWriteToNamedFile() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);
        Path target = tempDir.resolve("src/Flows.java");

        // When
        int exitCode = execute("compile", "-o", target.toString(), file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("public static Object bmi_check(");
    }

    @Test
    void shouldFailOnInvalidClassName() throws Exception {
        // Given
        Path file = writeWorkflow("bmi.json", BMI_WORKFLOW);

        // When
        int exitCode = execute("compile", "--class-name", "1Flow", file.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err())
                .contains("Invalid class name: '1Flow'")
                .contains(" [FAIL] Compilation failed");
        assertThat(out()).isEmpty();
    }

    @Test
    void shouldRefuseInvalidWorkflow() throws Exception {
        // Given
        Path file = writeWorkflow("orphan.json", ORPHAN_WORKFLOW);

        // When
        int exitCode = execute("compile", file.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Workflow validation failed:").contains("Compilation failed");
    }

    @Test
    void shouldPrintWarningsToStderr() throws Exception {
        // Given an operator only lenient validation lets through
        Path file = writeWorkflow("mid.json", MEDIAN_WORKFLOW);
        Path config = Files.writeString(
                tempDir.resolve("arbor.properties"), "arbor.validation.strict=false\n");

        // When
        int exitCode = execute("compile", "-c", config.toString(), file.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(err()).contains(" [WARN] Calculation node 'Mid': unknown operator 'median', using 0");
        assertThat(out()).contains("double mid = 0.0;");
    }
}

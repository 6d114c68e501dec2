package io.arbor.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.execution.WorkflowInterpreter;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ArborConfigTest {

    @Test
    void shouldUseDefaults() {
        // When
        ArborConfig config = new ArborConfig();

        // Then
        assertThat(config.isStrictValidation()).isTrue();
        assertThat(config.getControlTtl()).isEqualTo(Duration.ofSeconds(600));
        assertThat(config.getStepDelay()).isZero();
        assertThat(config.getMaxSteps()).isEqualTo(WorkflowInterpreter.DEFAULT_MAX_STEPS);
        assertThat(config.getCompiledClassName()).isEqualTo("CompiledWorkflows");
        assertThat(config.getCompiledPackage()).isNull();
    }

    @Test
    void shouldLoadFromProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ArborConfig.STRICT_VALIDATION_KEY, "false");
        properties.setProperty(ArborConfig.CONTROL_TTL_KEY, "30");
        properties.setProperty(ArborConfig.STEP_DELAY_KEY, " 250 ");
        properties.setProperty(ArborConfig.MAX_STEPS_KEY, "500");
        properties.setProperty(ArborConfig.CLASS_NAME_KEY, "Rules");
        properties.setProperty(ArborConfig.PACKAGE_KEY, "com.acme.rules");

        // When
        ArborConfig config = ArborConfig.fromProperties(properties);

        // Then
        assertThat(config.isStrictValidation()).isFalse();
        assertThat(config.getControlTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getStepDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getMaxSteps()).isEqualTo(500);
        assertThat(config.getCompiledClassName()).isEqualTo("Rules");
        assertThat(config.getCompiledPackage()).isEqualTo("com.acme.rules");
    }

    @Test
    void shouldRejectNonNumericProperty() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ArborConfig.MAX_STEPS_KEY, "lots");

        // When / Then
        assertThatThrownBy(() -> ArborConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Property 'arbor.execution.max-steps' must be a whole number, got 'lots'");
    }

    @Test
    void shouldBuildFluently() {
        // When
        ArborConfig config = ArborConfig.builder()
                .strictValidation(false)
                .stepDelay(Duration.ofMillis(5))
                .compiledClassName("Flows")
                .build();

        // Then
        assertThat(config.isStrictValidation()).isFalse();
        assertThat(config.getStepDelay()).isEqualTo(Duration.ofMillis(5));
        assertThat(config.getCompiledClassName()).isEqualTo("Flows");
    }
}

package io.arbor.core;

import io.arbor.core.compiler.JavaWorkflowCompiler;
import io.arbor.core.execution.WorkflowInterpreter;
import io.arbor.core.execution.control.ExecutionControlRegistry;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for the Arbor engine environment.
///
/// Use the {@link Builder} for fluent configuration, set fields directly, or load them from
/// `arbor.*` properties with {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - `strictValidation`: `true` (validate in strict mode before run and compile)
/// - `controlTtl`: 600 s (lifetime of pause/resume/stop records)
/// - `stepDelay`: zero (no pause between stepped nodes)
/// - `maxSteps`: {@value WorkflowInterpreter#DEFAULT_MAX_STEPS}
/// - `compiledClassName`: `CompiledWorkflows`
/// - `compiledPackage`: none (default package)
///
/// ### Property keys
/// ```
/// arbor.validation.strict      true|false
/// arbor.control.ttl-seconds    long
/// arbor.step.delay-millis      long
/// arbor.execution.max-steps    int
/// arbor.compiler.class-name    Java identifier
/// arbor.compiler.package       dotted package name
/// ```
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link ArborFactory}. Do not modify after environment
/// creation.
///
/// @see ArborFactory#createEnvironment(ArborConfig)
/// @see Builder
public class ArborConfig {

    public static final String STRICT_VALIDATION_KEY = "arbor.validation.strict";
    public static final String CONTROL_TTL_KEY = "arbor.control.ttl-seconds";
    public static final String STEP_DELAY_KEY = "arbor.step.delay-millis";
    public static final String MAX_STEPS_KEY = "arbor.execution.max-steps";
    public static final String CLASS_NAME_KEY = "arbor.compiler.class-name";
    public static final String PACKAGE_KEY = "arbor.compiler.package";

    private boolean strictValidation = true;
    private Duration controlTtl = ExecutionControlRegistry.DEFAULT_TTL;
    private Duration stepDelay = Duration.ZERO;
    private int maxSteps = WorkflowInterpreter.DEFAULT_MAX_STEPS;
    private String compiledClassName = JavaWorkflowCompiler.DEFAULT_CLASS_NAME;
    private String compiledPackage;

    /// Creates a configuration with default values.
    public ArborConfig() {}

    /// Returns whether workflows are validated in strict mode before run and compile.
    ///
    /// @return `true` to reject workflows with any validation error
    public boolean isStrictValidation() {
        return strictValidation;
    }

    public void setStrictValidation(boolean strictValidation) {
        this.strictValidation = strictValidation;
    }

    public Duration getControlTtl() {
        return controlTtl;
    }

    /// Sets how long execution control records live before {@code purgeStale} drops them.
    ///
    /// @param controlTtl positive duration, not null
    public void setControlTtl(Duration controlTtl) {
        this.controlTtl = controlTtl;
    }

    public Duration getStepDelay() {
        return stepDelay;
    }

    /// Sets the pause inserted after every step of a stepped execution.
    ///
    /// @param stepDelay non-negative duration, not null
    public void setStepDelay(Duration stepDelay) {
        this.stepDelay = stepDelay;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public String getCompiledClassName() {
        return compiledClassName;
    }

    public void setCompiledClassName(String compiledClassName) {
        this.compiledClassName = compiledClassName;
    }

    /// Returns the package of generated classes.
    ///
    /// @return the package, or null for the default package
    public String getCompiledPackage() {
        return compiledPackage;
    }

    public void setCompiledPackage(String compiledPackage) {
        this.compiledPackage = compiledPackage;
    }

    /// Loads a configuration from `arbor.*` properties. Missing keys keep their defaults.
    ///
    /// @param properties the source, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a numeric property cannot be parsed
    public static ArborConfig fromProperties(Properties properties) {
        ArborConfig config = new ArborConfig();
        String strict = properties.getProperty(STRICT_VALIDATION_KEY);
        if (strict != null) {
            config.strictValidation = Boolean.parseBoolean(strict.trim());
        }
        String ttl = properties.getProperty(CONTROL_TTL_KEY);
        if (ttl != null) {
            config.controlTtl = Duration.ofSeconds(parseLong(CONTROL_TTL_KEY, ttl));
        }
        String delay = properties.getProperty(STEP_DELAY_KEY);
        if (delay != null) {
            config.stepDelay = Duration.ofMillis(parseLong(STEP_DELAY_KEY, delay));
        }
        String steps = properties.getProperty(MAX_STEPS_KEY);
        if (steps != null) {
            config.maxSteps = (int) parseLong(MAX_STEPS_KEY, steps);
        }
        config.compiledClassName =
                properties.getProperty(CLASS_NAME_KEY, config.compiledClassName).trim();
        String pkg = properties.getProperty(PACKAGE_KEY);
        if (pkg != null && !pkg.isBlank()) {
            config.compiledPackage = pkg.trim();
        }
        return config;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property '" + key + "' must be a whole number, got '" + value + "'", e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ArborConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ArborConfig config = new ArborConfig();

        public Builder strictValidation(boolean strictValidation) {
            config.strictValidation = strictValidation;
            return this;
        }

        public Builder controlTtl(Duration controlTtl) {
            config.controlTtl = controlTtl;
            return this;
        }

        public Builder stepDelay(Duration stepDelay) {
            config.stepDelay = stepDelay;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            config.maxSteps = maxSteps;
            return this;
        }

        public Builder compiledClassName(String compiledClassName) {
            config.compiledClassName = compiledClassName;
            return this;
        }

        public Builder compiledPackage(String compiledPackage) {
            config.compiledPackage = compiledPackage;
            return this;
        }

        /// Builds and returns the configured {@link ArborConfig} instance.
        ///
        /// @return the configured instance, never null
        public ArborConfig build() {
            return config;
        }
    }
}

/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Tunables of the flow compiler.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables using the pattern
 * {@code FLOW_COMPILER_<PROPERTY_NAME>}:
 * <pre>
 * FLOW_COMPILER_MAX_PATHS_PER_ACTION=4096
 * FLOW_COMPILER_MAX_CONDITIONS_PER_PATH=256
 * FLOW_COMPILER_MAX_TRACE_DEPTH=512
 * FLOW_COMPILER_MAX_TRACE_STEPS=50000
 * FLOW_COMPILER_DEFAULT_DELAY_SECONDS=120
 * FLOW_COMPILER_DEFAULT_FLOW_NAME=Visual Flow
 * FLOW_COMPILER_DELAY_CONFIG_KEY=_flowDelaySeconds
 * </pre>
 *
 * <p>Precedence, lowest first: built-in defaults, properties file, environment,
 * explicit builder calls.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults plus environment
 * CompilerConfig config = CompilerConfig.builder().build();
 *
 * // flow-compiler.properties from the classpath, then environment
 * CompilerConfig config = CompilerConfig.loadDefault();
 *
 * // Tighter guard for the interactive editor
 * CompilerConfig config = CompilerConfig.loadDefault()
 *     .toBuilder()
 *     .maxPathsPerAction(256)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_PATHS_PER_ACTION = "FLOW_COMPILER_MAX_PATHS_PER_ACTION";
    static final String ENV_MAX_CONDITIONS_PER_PATH = "FLOW_COMPILER_MAX_CONDITIONS_PER_PATH";
    static final String ENV_MAX_TRACE_DEPTH = "FLOW_COMPILER_MAX_TRACE_DEPTH";
    static final String ENV_MAX_TRACE_STEPS = "FLOW_COMPILER_MAX_TRACE_STEPS";
    static final String ENV_DEFAULT_DELAY_SECONDS = "FLOW_COMPILER_DEFAULT_DELAY_SECONDS";
    static final String ENV_DEFAULT_FLOW_NAME = "FLOW_COMPILER_DEFAULT_FLOW_NAME";
    static final String ENV_DELAY_CONFIG_KEY = "FLOW_COMPILER_DELAY_CONFIG_KEY";

    // ========================================================================
    // PROPERTIES FILE KEYS
    // ========================================================================

    static final String PROP_MAX_PATHS_PER_ACTION = "flow.compiler.max.paths.per.action";
    static final String PROP_MAX_CONDITIONS_PER_PATH = "flow.compiler.max.conditions.per.path";
    static final String PROP_MAX_TRACE_DEPTH = "flow.compiler.max.trace.depth";
    static final String PROP_MAX_TRACE_STEPS = "flow.compiler.max.trace.steps";
    static final String PROP_DEFAULT_DELAY_SECONDS = "flow.compiler.default.delay.seconds";
    static final String PROP_DEFAULT_FLOW_NAME = "flow.compiler.default.flow.name";
    static final String PROP_DELAY_CONFIG_KEY = "flow.compiler.delay.config.key";

    public static final String DEFAULT_PROPERTIES_FILE = "flow-compiler.properties";

    public static final int DEFAULT_MAX_PATHS_PER_ACTION = 1024;
    public static final int DEFAULT_MAX_CONDITIONS_PER_PATH = 256;
    public static final int DEFAULT_MAX_TRACE_DEPTH = 512;
    public static final int DEFAULT_MAX_TRACE_STEPS = 50_000;
    public static final int DEFAULT_DELAY_SECONDS = 300;
    public static final String DEFAULT_FLOW_NAME = "Visual Flow";
    public static final String DEFAULT_DELAY_CONFIG_KEY = "_flowDelaySeconds";

    private final int maxPathsPerAction;
    private final int maxConditionsPerPath;
    private final int maxTraceDepth;
    private final int maxTraceSteps;
    private final int defaultDelaySeconds;
    private final String defaultFlowName;
    private final String delayConfigKey;

    private CompilerConfig(Builder builder) {
        this.maxPathsPerAction = builder.maxPathsPerAction;
        this.maxConditionsPerPath = builder.maxConditionsPerPath;
        this.maxTraceDepth = builder.maxTraceDepth;
        this.maxTraceSteps = builder.maxTraceSteps;
        this.defaultDelaySeconds = builder.defaultDelaySeconds;
        this.defaultFlowName = builder.defaultFlowName;
        this.delayConfigKey = builder.delayConfigKey;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, ignoring environment and properties files.
     */
    public static CompilerConfig defaults() {
        return new Builder(key -> null).build();
    }

    public static Builder builder() {
        return new Builder(System::getenv);
    }

    /**
     * Builder reading overrides from the given environment lookup instead of
     * the process environment.
     */
    static Builder builder(Function<String, String> environment) {
        return new Builder(environment);
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE}, falling back to defaults when it
     * cannot be found.
     */
    public static CompilerConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Load configuration from a specific properties file.
     *
     * <p>Searches for the file in:
     * <ol>
     *   <li>Classpath root</li>
     *   <li>File system (absolute or relative path)</li>
     * </ol>
     *
     * <p>Environment variables override properties file values.
     *
     * @param propertiesPath path to the properties file
     * @return configuration loaded from the properties file
     */
    public static CompilerConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static CompilerConfig loadFromProperties(String propertiesPath, Function<String, String> environment) {
        logger.fine("Loading flow compiler configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = CompilerConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = new Builder(key -> null);
        builder.applyProperties(props);
        builder.applyEnvironment(environment);
        return builder.build();
    }

    /**
     * Creates a builder initialised with this config's values. The
     * environment is not consulted again.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(key -> null);
        builder.maxPathsPerAction = this.maxPathsPerAction;
        builder.maxConditionsPerPath = this.maxConditionsPerPath;
        builder.maxTraceDepth = this.maxTraceDepth;
        builder.maxTraceSteps = this.maxTraceSteps;
        builder.defaultDelaySeconds = this.defaultDelaySeconds;
        builder.defaultFlowName = this.defaultFlowName;
        builder.delayConfigKey = this.delayConfigKey;
        return builder;
    }

    public static final class Builder {

        private int maxPathsPerAction = DEFAULT_MAX_PATHS_PER_ACTION;
        private int maxConditionsPerPath = DEFAULT_MAX_CONDITIONS_PER_PATH;
        private int maxTraceDepth = DEFAULT_MAX_TRACE_DEPTH;
        private int maxTraceSteps = DEFAULT_MAX_TRACE_STEPS;
        private int defaultDelaySeconds = DEFAULT_DELAY_SECONDS;
        private String defaultFlowName = DEFAULT_FLOW_NAME;
        private String delayConfigKey = DEFAULT_DELAY_CONFIG_KEY;

        private Builder(Function<String, String> environment) {
            applyEnvironment(environment);
        }

        /**
         * Upper bound on the compiled paths a single gate may produce for one
         * action. Nested OR gates multiply path counts; past this bound the
         * gate is reported as an error instead of compiling.
         */
        public Builder maxPathsPerAction(int maxPathsPerAction) {
            this.maxPathsPerAction = maxPathsPerAction;
            return this;
        }

        /**
         * Upper bound on the conditions one compiled path may carry. AND gates
         * concatenate branch conditions, so chained AND gates over a shared
         * ancestor double the list at every level.
         */
        public Builder maxConditionsPerPath(int maxConditionsPerPath) {
            this.maxConditionsPerPath = maxConditionsPerPath;
            return this;
        }

        /**
         * Longest chain of nodes followed upstream from an action. Tracing is
         * recursive, so this also bounds stack usage.
         */
        public Builder maxTraceDepth(int maxTraceDepth) {
            this.maxTraceDepth = maxTraceDepth;
            return this;
        }

        /**
         * Node visits allowed while tracing one action. Shared ancestors are
         * re-traced once per branch reaching them.
         */
        public Builder maxTraceSteps(int maxTraceSteps) {
            this.maxTraceSteps = maxTraceSteps;
            return this;
        }

        /**
         * Delay applied by a delay gate whose configuration has no usable
         * {@code delaySeconds} value.
         */
        public Builder defaultDelaySeconds(int defaultDelaySeconds) {
            this.defaultDelaySeconds = defaultDelaySeconds;
            return this;
        }

        /**
         * Automation name prefix used when the caller supplies no flow name.
         */
        public Builder defaultFlowName(String defaultFlowName) {
            this.defaultFlowName = defaultFlowName;
            return this;
        }

        /**
         * Trigger config key the merged delay is stored under.
         */
        public Builder delayConfigKey(String delayConfigKey) {
            this.delayConfigKey = delayConfigKey;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }

        private void applyProperties(Properties props) {
            parseInt(PROP_MAX_PATHS_PER_ACTION, props.getProperty(PROP_MAX_PATHS_PER_ACTION))
                    .ifPresent(val -> this.maxPathsPerAction = val);
            parseInt(PROP_MAX_CONDITIONS_PER_PATH, props.getProperty(PROP_MAX_CONDITIONS_PER_PATH))
                    .ifPresent(val -> this.maxConditionsPerPath = val);
            parseInt(PROP_MAX_TRACE_DEPTH, props.getProperty(PROP_MAX_TRACE_DEPTH))
                    .ifPresent(val -> this.maxTraceDepth = val);
            parseInt(PROP_MAX_TRACE_STEPS, props.getProperty(PROP_MAX_TRACE_STEPS))
                    .ifPresent(val -> this.maxTraceSteps = val);
            parseInt(PROP_DEFAULT_DELAY_SECONDS, props.getProperty(PROP_DEFAULT_DELAY_SECONDS))
                    .ifPresent(val -> this.defaultDelaySeconds = val);
            nonBlank(props.getProperty(PROP_DEFAULT_FLOW_NAME))
                    .ifPresent(val -> this.defaultFlowName = val);
            nonBlank(props.getProperty(PROP_DELAY_CONFIG_KEY))
                    .ifPresent(val -> this.delayConfigKey = val);
        }

        private void applyEnvironment(Function<String, String> environment) {
            getEnvInt(environment, ENV_MAX_PATHS_PER_ACTION).ifPresent(val -> this.maxPathsPerAction = val);
            getEnvInt(environment, ENV_MAX_CONDITIONS_PER_PATH).ifPresent(val -> this.maxConditionsPerPath = val);
            getEnvInt(environment, ENV_MAX_TRACE_DEPTH).ifPresent(val -> this.maxTraceDepth = val);
            getEnvInt(environment, ENV_MAX_TRACE_STEPS).ifPresent(val -> this.maxTraceSteps = val);
            getEnvInt(environment, ENV_DEFAULT_DELAY_SECONDS).ifPresent(val -> this.defaultDelaySeconds = val);
            getEnv(environment, ENV_DEFAULT_FLOW_NAME).ifPresent(val -> this.defaultFlowName = val);
            getEnv(environment, ENV_DELAY_CONFIG_KEY).ifPresent(val -> this.delayConfigKey = val);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnv(Function<String, String> environment, String key) {
            Optional<String> value = nonBlank(environment.apply(key));
            value.ifPresent(val -> logger.fine("Loaded env var: " + key + "=" + val));
            return value;
        }

        private static Optional<Integer> getEnvInt(Function<String, String> environment, String key) {
            return getEnv(environment, key).flatMap(val -> parseInt(key, val));
        }

        private static Optional<Integer> parseInt(String key, String value) {
            return nonBlank(value).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<String> nonBlank(String value) {
            if (value != null && !value.trim().isEmpty()) {
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (maxPathsPerAction <= 0) {
            throw new IllegalArgumentException("maxPathsPerAction must be positive: " + maxPathsPerAction);
        }
        if (maxConditionsPerPath <= 0) {
            throw new IllegalArgumentException("maxConditionsPerPath must be positive: " + maxConditionsPerPath);
        }
        if (maxTraceDepth <= 0) {
            throw new IllegalArgumentException("maxTraceDepth must be positive: " + maxTraceDepth);
        }
        if (maxTraceSteps <= 0) {
            throw new IllegalArgumentException("maxTraceSteps must be positive: " + maxTraceSteps);
        }
        if (defaultDelaySeconds < 0) {
            throw new IllegalArgumentException("defaultDelaySeconds must not be negative: " + defaultDelaySeconds);
        }
        if (defaultFlowName == null || defaultFlowName.isBlank()) {
            throw new IllegalArgumentException("defaultFlowName is required");
        }
        if (delayConfigKey == null || delayConfigKey.isBlank()) {
            throw new IllegalArgumentException("delayConfigKey is required");
        }

        logger.fine("Flow compiler configuration validated: " + this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int getMaxPathsPerAction() { return maxPathsPerAction; }
    public int getMaxConditionsPerPath() { return maxConditionsPerPath; }
    public int getMaxTraceDepth() { return maxTraceDepth; }
    public int getMaxTraceSteps() { return maxTraceSteps; }
    public int getDefaultDelaySeconds() { return defaultDelaySeconds; }
    public String getDefaultFlowName() { return defaultFlowName; }
    public String getDelayConfigKey() { return delayConfigKey; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompilerConfig)) return false;
        CompilerConfig that = (CompilerConfig) o;
        return maxPathsPerAction == that.maxPathsPerAction
                && maxConditionsPerPath == that.maxConditionsPerPath
                && maxTraceDepth == that.maxTraceDepth
                && maxTraceSteps == that.maxTraceSteps
                && defaultDelaySeconds == that.defaultDelaySeconds
                && defaultFlowName.equals(that.defaultFlowName)
                && delayConfigKey.equals(that.delayConfigKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxPathsPerAction, maxConditionsPerPath, maxTraceDepth, maxTraceSteps,
                defaultDelaySeconds, defaultFlowName, delayConfigKey);
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "maxPathsPerAction=" + maxPathsPerAction +
                ", maxConditionsPerPath=" + maxConditionsPerPath +
                ", maxTraceDepth=" + maxTraceDepth +
                ", maxTraceSteps=" + maxTraceSteps +
                ", defaultDelaySeconds=" + defaultDelaySeconds +
                ", defaultFlowName='" + defaultFlowName + '\'' +
                ", delayConfigKey='" + delayConfigKey + '\'' +
                '}';
    }
}

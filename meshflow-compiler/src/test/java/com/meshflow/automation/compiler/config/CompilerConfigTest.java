/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should expose built-in defaults")
    void shouldExposeDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.getMaxPathsPerAction()).isEqualTo(1024);
        assertThat(config.getMaxConditionsPerPath()).isEqualTo(256);
        assertThat(config.getMaxTraceDepth()).isEqualTo(512);
        assertThat(config.getMaxTraceSteps()).isEqualTo(50_000);
        assertThat(config.getDefaultDelaySeconds()).isEqualTo(300);
        assertThat(config.getDefaultFlowName()).isEqualTo("Visual Flow");
        assertThat(config.getDelayConfigKey()).isEqualTo("_flowDelaySeconds");
    }

    @Test
    @DisplayName("Should apply environment overrides and ignore unparsable values")
    void shouldApplyEnvironmentOverrides() {
        Map<String, String> env = Map.of(
                "FLOW_COMPILER_MAX_PATHS_PER_ACTION", "2048",
                "FLOW_COMPILER_DEFAULT_DELAY_SECONDS", "not-a-number",
                "FLOW_COMPILER_DEFAULT_FLOW_NAME", "  Garage  ",
                "FLOW_COMPILER_MAX_TRACE_STEPS", "7500");

        CompilerConfig config = CompilerConfig.builder(env::get).build();

        assertThat(config.getMaxPathsPerAction()).isEqualTo(2048);
        assertThat(config.getDefaultDelaySeconds()).isEqualTo(CompilerConfig.DEFAULT_DELAY_SECONDS);
        assertThat(config.getDefaultFlowName()).isEqualTo("Garage");
        assertThat(config.getMaxTraceSteps()).isEqualTo(7500);
    }

    @Test
    @DisplayName("Explicit builder values should win over the environment")
    void explicitValuesShouldWin() {
        Map<String, String> env = Map.of("FLOW_COMPILER_MAX_PATHS_PER_ACTION", "2048");

        CompilerConfig config = CompilerConfig.builder(env::get).maxPathsPerAction(8).build();

        assertThat(config.getMaxPathsPerAction()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should load properties from the classpath")
    void shouldLoadFromClasspath() {
        CompilerConfig config = CompilerConfig.loadFromProperties("flow-compiler-test.properties", key -> null);

        assertThat(config.getMaxPathsPerAction()).isEqualTo(64);
        assertThat(config.getMaxTraceDepth()).isEqualTo(32);
        assertThat(config.getMaxConditionsPerPath()).isEqualTo(CompilerConfig.DEFAULT_MAX_CONDITIONS_PER_PATH);
        assertThat(config.getDefaultDelaySeconds()).isEqualTo(45);
        assertThat(config.getDefaultFlowName()).isEqualTo("Test Flow");
        assertThat(config.getDelayConfigKey()).isEqualTo("_testDelay");
    }

    @Test
    @DisplayName("Environment should override a properties file on disk")
    void environmentShouldOverrideFile() throws IOException {
        Path file = tempDir.resolve("compiler.properties");
        Files.writeString(file, """
                flow.compiler.max.paths.per.action=10
                flow.compiler.default.delay.seconds=20
                """);
        Map<String, String> env = Map.of("FLOW_COMPILER_DEFAULT_DELAY_SECONDS", "99");

        CompilerConfig config = CompilerConfig.loadFromProperties(file.toString(), env::get);

        assertThat(config.getMaxPathsPerAction()).isEqualTo(10);
        assertThat(config.getDefaultDelaySeconds()).isEqualTo(99);
    }

    @Test
    @DisplayName("Should fall back to defaults when the properties file is missing")
    void shouldFallBackWhenMissing() {
        CompilerConfig config = CompilerConfig.loadFromProperties(
                tempDir.resolve("absent.properties").toString(), key -> null);

        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).maxPathsPerAction(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxPathsPerAction");
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).maxConditionsPerPath(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConditionsPerPath");
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).maxTraceDepth(-3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTraceDepth");
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).maxTraceSteps(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTraceSteps");
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).defaultDelaySeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultDelaySeconds");
        assertThatThrownBy(() -> CompilerConfig.builder(key -> null).defaultFlowName(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultFlowName");
    }

    @Test
    @DisplayName("toBuilder should copy values without re-reading the environment")
    void toBuilderShouldCopyValues() {
        CompilerConfig original = CompilerConfig.builder(key -> null)
                .defaultFlowName("Porch")
                .delayConfigKey("_delay")
                .maxTraceDepth(64)
                .build();

        CompilerConfig copy = original.toBuilder().defaultDelaySeconds(10).build();

        assertThat(copy.getDefaultFlowName()).isEqualTo("Porch");
        assertThat(copy.getDelayConfigKey()).isEqualTo("_delay");
        assertThat(copy.getMaxTraceDepth()).isEqualTo(64);
        assertThat(copy.getDefaultDelaySeconds()).isEqualTo(10);
        assertThat(copy).isNotEqualTo(original);
        assertThat(original.toBuilder().build()).isEqualTo(original);
    }
}

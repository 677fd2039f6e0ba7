/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConditionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionInverterTest {

    @ParameterizedTest(name = "{0} <-> {1}")
    @CsvSource({
            "BATTERY_ABOVE, BATTERY_BELOW",
            "NODE_ONLINE, NODE_OFFLINE",
            "WITHIN_GEOFENCE, OUTSIDE_GEOFENCE",
            "TIME_RANGE, TIME_RANGE",
            "DAY_OF_WEEK, DAY_OF_WEEK"
    })
    @DisplayName("Should invert condition types symmetrically")
    void shouldInvertSymmetrically(ConditionType type, ConditionType inverse) {
        assertThat(ConditionInverter.invert(type)).isEqualTo(inverse);
        assertThat(ConditionInverter.invert(inverse)).isEqualTo(type);
    }

    @ParameterizedTest
    @EnumSource(ConditionType.class)
    @DisplayName("Inverting twice should give back the original type")
    void doubleInversionIsIdentity(ConditionType type) {
        assertThat(ConditionInverter.invert(ConditionInverter.invert(type))).isEqualTo(type);
    }

    @Test
    @DisplayName("Should keep the condition config when inverting")
    void shouldKeepConfig() {
        AutomationCondition condition = new AutomationCondition(ConditionType.BATTERY_ABOVE,
                Map.of("batteryThreshold", 20));

        AutomationCondition inverted = ConditionInverter.invert(condition);

        assertThat(inverted.type()).isEqualTo(ConditionType.BATTERY_BELOW);
        assertThat(inverted.config()).isEqualTo(condition.config());
        assertThat(ConditionInverter.hasDistinctInverse(ConditionType.TIME_RANGE)).isFalse();
        assertThat(ConditionInverter.hasDistinctInverse(ConditionType.NODE_ONLINE)).isTrue();
    }
}

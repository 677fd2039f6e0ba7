/*
 * Copyright (c) 2025 Meshflow Automation
 * Licensed under the Apache License, Version 2.0
 */
package com.meshflow.automation.compiler.trace;

import com.meshflow.automation.api.model.AutomationCondition;
import com.meshflow.automation.api.model.ConditionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompiledPathTest {

    private static final AutomationCondition ONLINE = new AutomationCondition(ConditionType.NODE_ONLINE, Map.of());
    private static final AutomationCondition WEEKDAY = new AutomationCondition(ConditionType.DAY_OF_WEEK, Map.of());

    private static CompiledPath bare(String triggerType) {
        return new CompiledPath(triggerType, Map.of(), "t-" + triggerType, List.of(), null);
    }

    @Test
    @DisplayName("Merging should concatenate conditions and keep this path's trigger")
    void mergeShouldConcatenate() {
        CompiledPath left = bare("manual").withConditionsPrepended(List.of(ONLINE)).withDelay(30);
        CompiledPath right = bare("scheduled").withConditionsPrepended(List.of(WEEKDAY)).withDelay(90);

        CompiledPath merged = left.mergedWith(right);

        assertThat(merged.triggerType()).isEqualTo("manual");
        assertThat(merged.conditions()).containsExactly(ONLINE, WEEKDAY);
        assertThat(merged.delaySeconds()).isEqualTo(90);
    }

    @Test
    @DisplayName("A missing delay should not override an existing one")
    void missingDelayShouldNotOverride() {
        CompiledPath merged = bare("manual").withDelay(45).mergedWith(bare("manual"));

        assertThat(merged.delaySeconds()).isEqualTo(45);
        assertThat(bare("manual").hasDelay()).isFalse();
        assertThat(bare("manual").withDelay(0).hasDelay()).isFalse();
    }

    @Test
    @DisplayName("Replacing the last condition requires one to exist")
    void replaceLastRequiresCondition() {
        CompiledPath path = bare("manual").withConditionsPrepended(List.of(ONLINE, WEEKDAY));

        assertThat(path.withLastConditionReplaced(ONLINE).conditions()).containsExactly(ONLINE, ONLINE);
        assertThat(path.lastCondition()).contains(WEEKDAY);
        assertThatThrownBy(() -> bare("manual").withLastConditionReplaced(ONLINE))
                .isInstanceOf(IllegalStateException.class);
    }
}

package com.zzf.orchestrator.core.plan;

import com.zzf.orchestrator.core.classify.OperationType;
import com.zzf.orchestrator.model.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionStrategySelectorTest {

    private final ExecutionStrategySelector selector = new ExecutionStrategySelector();

    @Test
    void singlePassDisablesStreamingWhenToolsAreEnabled() {
        for (OperationType type : OperationType.values()) {
            ExecutionPlan plan = selector.plan(type, ExecutionMode.SINGLE_PASS, true);
            assertEquals(1, plan.getPassCount());
            assertFalse(plan.isStreamFirstPass());
            assertTrue(plan.toolsEnabledInPass(1));
        }
    }

    @Test
    void noEnabledToolsAlwaysYieldsOneStreamedPass() {
        for (ExecutionMode mode : ExecutionMode.values()) {
            for (OperationType type : OperationType.values()) {
                ExecutionPlan plan = selector.plan(type, mode, false);
                assertEquals(1, plan.getPassCount());
                assertTrue(plan.isStreamFirstPass());
                assertFalse(plan.toolsEnabledInPass(1));
            }
        }
    }

    @Test
    void writeOnlyModeSplitsWriteTurns() {
        ExecutionPlan plan = selector.plan(OperationType.WRITE, ExecutionMode.DUAL_PASS_WRITE_ONLY, true);
        assertTrue(plan.isDualPass());
        assertTrue(plan.pass(1).isStreamed());
        assertFalse(plan.pass(1).isToolsEnabled());
        assertFalse(plan.pass(2).isStreamed());
        assertTrue(plan.pass(2).isToolsEnabled());
        assertTrue(plan.pass(2).isBackground());
        assertFalse(plan.isReadHazard());
    }

    @Test
    void writeOnlyModeRunsReadTurnsAsOneUnstreamedToolPass() {
        ExecutionPlan plan = selector.plan(OperationType.READ, ExecutionMode.DUAL_PASS_WRITE_ONLY, true);
        assertEquals(1, plan.getPassCount());
        assertFalse(plan.isStreamFirstPass());
        assertTrue(plan.toolsEnabledInPass(1));
    }

    @Test
    void writeOnlyModeStreamsGeneralTurnsWithoutTools() {
        ExecutionPlan plan = selector.plan(OperationType.GENERAL, ExecutionMode.DUAL_PASS_WRITE_ONLY, true);
        assertEquals(1, plan.getPassCount());
        assertTrue(plan.isStreamFirstPass());
        assertFalse(plan.toolsEnabledInPass(1));
    }

    @Test
    void dualPassAllFlagsReadTurnsAsHazard() {
        ExecutionPlan read = selector.plan(OperationType.READ, ExecutionMode.DUAL_PASS_ALL, true);
        assertTrue(read.isDualPass());
        assertFalse(read.toolsEnabledInPass(1));
        assertTrue(read.isReadHazard());

        ExecutionPlan general = selector.plan(OperationType.GENERAL, ExecutionMode.DUAL_PASS_ALL, true);
        assertTrue(general.isDualPass());
        assertFalse(general.isReadHazard());
    }

    @Test
    void toolsEnabledInPassIsFalseOutsideThePlan() {
        ExecutionPlan plan = selector.plan(OperationType.WRITE, ExecutionMode.DUAL_PASS_WRITE_ONLY, true);
        assertFalse(plan.toolsEnabledInPass(0));
        assertFalse(plan.toolsEnabledInPass(3));
    }

    @Test
    void stringModeIsValidated() {
        assertThrows(ConfigurationException.class, () -> selector.plan(OperationType.READ, "sometimes", true));
        assertEquals(ExecutionMode.SINGLE_PASS, selector.plan(OperationType.READ, "single_pass", true).getMode());
    }
}

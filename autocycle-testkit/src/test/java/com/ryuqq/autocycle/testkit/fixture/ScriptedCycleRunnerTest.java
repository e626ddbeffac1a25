package com.ryuqq.autocycle.testkit.fixture;

import com.ryuqq.autocycle.application.pipeline.CycleRequest;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptedCycleRunnerTest {

    @Test
    void testRunCycle_FollowsScriptThenRepeatsLast() {
        ScriptedCycleRunner runner = ScriptedCycleRunner.withErrorCounts(5, 1);
        CycleRequest request = CycleRequest.initial(CycleFixtures.BASE_TIME);

        assertEquals(5, runner.runCycle(CapabilitySet.empty(), request).errorCount());
        assertEquals(1, runner.runCycle(CapabilitySet.empty(), request).errorCount());
        assertEquals(1, runner.runCycle(CapabilitySet.empty(), request).errorCount());
        assertEquals(3, runner.callCount());
    }

    @Test
    void testRunCycle_InvokesHookBeforeReturning() {
        int[] seen = new int[1];
        ScriptedCycleRunner runner = ScriptedCycleRunner.withErrorCounts(0)
            .onCall(request -> seen[0] = request.attempt());

        runner.runCycle(CapabilitySet.empty(), CycleRequest.initial(CycleFixtures.BASE_TIME));

        assertEquals(1, seen[0]);
    }

    @Test
    void testResultWithErrors_ProducesCompleteResult() {
        var result = CycleFixtures.resultWithErrors(4);

        assertEquals(4, result.errorCount());
        assertEquals(10, result.phases().size());
        assertTrue(result.isComplete());
    }

    @Test
    void testWithErrorCounts_Empty_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ScriptedCycleRunner.withErrorCounts());
    }
}

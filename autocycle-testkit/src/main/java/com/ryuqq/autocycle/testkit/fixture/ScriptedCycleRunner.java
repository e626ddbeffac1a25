package com.ryuqq.autocycle.testkit.fixture;

import com.ryuqq.autocycle.application.pipeline.CycleRequest;
import com.ryuqq.autocycle.application.pipeline.CycleRunner;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * CycleRunner that returns results with a scripted number of errors per call.
 *
 * <p>When the script runs out, the last entry is repeated. Every request is recorded
 * so tests can assert attempt numbers and the totals passed in.</p>
 *
 * <pre>
 * ScriptedCycleRunner runner = ScriptedCycleRunner.withErrorCounts(5, 0);
 * // attempt 1 → 5 errors (fails with threshold 3), attempt 2 → 0 errors
 * </pre>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public class ScriptedCycleRunner implements CycleRunner {

    private final List<Integer> errorCounts;
    private final List<CycleRequest> requests = new ArrayList<>();
    private Consumer<CycleRequest> onCall = request -> { };

    private ScriptedCycleRunner(List<Integer> errorCounts) {
        if (errorCounts.isEmpty()) {
            throw new IllegalArgumentException("errorCounts cannot be empty");
        }
        this.errorCounts = errorCounts;
    }

    public static ScriptedCycleRunner withErrorCounts(Integer... errorCounts) {
        return new ScriptedCycleRunner(new ArrayList<>(Arrays.asList(errorCounts)));
    }

    /**
     * Registers a hook invoked at the start of every call (e.g. to request stop mid-run).
     */
    public ScriptedCycleRunner onCall(Consumer<CycleRequest> hook) {
        this.onCall = hook == null ? request -> { } : hook;
        return this;
    }

    @Override
    public synchronized CycleResult runCycle(CapabilitySet capabilities, CycleRequest request) {
        requests.add(request);
        onCall.accept(request);
        int index = Math.min(requests.size(), errorCounts.size()) - 1;
        return CycleFixtures.resultWithErrors(errorCounts.get(index));
    }

    public synchronized int callCount() {
        return requests.size();
    }

    public synchronized List<CycleRequest> requests() {
        return new ArrayList<>(requests);
    }
}

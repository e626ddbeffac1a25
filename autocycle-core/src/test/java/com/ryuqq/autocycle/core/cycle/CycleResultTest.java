package com.ryuqq.autocycle.core.cycle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CycleResult 테스트.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
class CycleResultTest {

    private static final Instant START = Instant.parse("2025-01-15T10:00:00Z");

    @Test
    void isComplete_AllPhasesInOrder_ReturnsTrue() {
        CycleResult result = resultWith(allPhases(), List.of());

        assertTrue(result.isComplete());
        assertEquals(Duration.ofSeconds(42), result.duration());
        assertEquals(PhaseName.METRICS_FLUSH, result.phase(PhaseName.METRICS_FLUSH).phase());
    }

    @Test
    void isComplete_MissingPhase_ReturnsFalse() {
        List<PhaseOutcome> phases = new ArrayList<>(allPhases());
        phases.remove(3);

        assertFalse(resultWith(phases, List.of()).isComplete());
    }

    @Test
    void errorCount_CountsCycleErrors() {
        CycleResult result = resultWith(allPhases(), List.of(
            CycleError.of(PhaseName.LOCALIZATION, "timeout"),
            CycleError.ofTarget(PhaseName.PUBLISH, "etsy", "HTTP 503")
        ));

        assertEquals(2, result.errorCount());
    }

    @Test
    void constructor_FinishedBeforeStarted_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CycleResult(
            "c-1", START, START.minusSeconds(1), List.of(), List.of(), 0, 0, 0, null, null
        ));
    }

    @Test
    void phases_AreDefensivelyCopied() {
        List<PhaseOutcome> phases = new ArrayList<>(allPhases());
        CycleResult result = resultWith(phases, List.of());

        phases.clear();

        assertEquals(PhaseName.values().length, result.phases().size());
        assertThrows(UnsupportedOperationException.class, () -> result.phases().clear());
    }

    private static List<PhaseOutcome> allPhases() {
        List<PhaseOutcome> phases = new ArrayList<>();
        for (PhaseName phase : PhaseName.values()) {
            phases.add(PhaseOutcome.fallback(phase, "default"));
        }
        return phases;
    }

    private static CycleResult resultWith(List<PhaseOutcome> phases, List<CycleError> errors) {
        return new CycleResult("c-1", START, START.plusSeconds(42), phases, errors, 2, 1, 0, "AI Productivity Template", null);
    }
}

package com.ryuqq.autocycle.core.cycle;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PhaseOutcome / TargetOutcome 불변식 테스트.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
class PhaseOutcomeTest {

    @Test
    void fallback_IsSuccessfulAndSkipped() {
        PhaseOutcome outcome = PhaseOutcome.fallback(PhaseName.PRICING, "placeholder price 49.00 USD");

        assertTrue(outcome.success());
        assertTrue(outcome.skipped());
        assertNull(outcome.errorMessage());
    }

    @Test
    void constructor_SkippedButFailed_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new PhaseOutcome(PhaseName.PUBLISH, false, true, "boom", null, List.of()));
    }

    @Test
    void failed_WithoutMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> PhaseOutcome.failed(PhaseName.LOCALIZATION, " ", null));
    }

    @Test
    void succeededTargets_CountsOnlySuccessfulTargets() {
        PhaseOutcome outcome = new PhaseOutcome(PhaseName.PUBLISH, true, false, null, "2 platforms", List.of(
            TargetOutcome.succeeded("gumroad", "https://gumroad.example/p/1"),
            TargetOutcome.failed("etsy", "HTTP 503"),
            TargetOutcome.succeeded("payhip", "https://payhip.example/p/1")
        ));

        assertEquals(2, outcome.succeededTargets());
        assertEquals("etsy", outcome.targets().get(1).target());
    }

    @Test
    void targetFailed_WithoutMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TargetOutcome.failed("etsy", null));
    }

    @Test
    void cycleError_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CycleError.of(PhaseName.PRICING, ""));
    }

    @Test
    void phaseName_FanOutPhasesArePublishAndPromotion() {
        for (PhaseName phase : PhaseName.values()) {
            boolean expected = phase == PhaseName.PUBLISH || phase == PhaseName.PROMOTION;
            assertEquals(expected, phase.isFanOut(), phase.name());
        }
    }
}

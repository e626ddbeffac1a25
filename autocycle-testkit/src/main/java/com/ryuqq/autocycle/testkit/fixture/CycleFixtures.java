package com.ryuqq.autocycle.testkit.fixture;

import com.ryuqq.autocycle.core.artifact.PriceQuote;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.health.HealthEvent;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.core.health.ResourceGauges;
import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.report.RunTotals;
import com.ryuqq.autocycle.core.report.SlotOutcome;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Factory methods for well-formed cycle values used across module tests.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class CycleFixtures {

    public static final Instant BASE_TIME = Instant.parse("2025-01-15T10:00:00Z");

    private CycleFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * A complete result whose first {@code errorCount} phases failed.
     *
     * @param errorCount number of failed phases (0..10)
     * @return CycleResult with exactly {@code errorCount} errors
     */
    public static CycleResult resultWithErrors(int errorCount) {
        PhaseName[] names = PhaseName.values();
        if (errorCount < 0 || errorCount > names.length) {
            throw new IllegalArgumentException(
                "errorCount must be between 0 and " + names.length + " (current: " + errorCount + ")"
            );
        }
        List<PhaseOutcome> phases = new ArrayList<>();
        List<CycleError> errors = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            if (i < errorCount) {
                String message = names[i].name().toLowerCase() + " unavailable";
                phases.add(PhaseOutcome.failed(names[i], message, null));
                errors.add(CycleError.of(names[i], message));
            } else {
                phases.add(PhaseOutcome.completed(names[i], "ok"));
            }
        }
        return new CycleResult(
            UUID.randomUUID().toString(),
            BASE_TIME,
            BASE_TIME.plusSeconds(12),
            phases,
            errors,
            2,
            5,
            3,
            "AI Productivity Template",
            new PriceQuote(new BigDecimal("49.00"), "USD", List.of("card"))
        );
    }

    /**
     * A snapshot with recorded events and non-trivial gauges.
     */
    public static HealthSnapshot snapshot(long cycleCount, long errorCount, HealthStatus status) {
        return new HealthSnapshot(
            BASE_TIME.plusSeconds(60),
            Duration.ofMinutes(90),
            new ResourceGauges(12.5, 41.0, 63.25, true),
            cycleCount,
            errorCount,
            status,
            BASE_TIME,
            errorCount > 0 ? "4 errors (threshold 3)" : null,
            List.of(
                new HealthEvent(BASE_TIME, HealthEvent.Type.CYCLE_SUCCEEDED, "0 errors (threshold 3)"),
                new HealthEvent(BASE_TIME.plusSeconds(30), HealthEvent.Type.STATUS_CHANGED, "status warning")
            )
        );
    }

    /**
     * A successful single-attempt report.
     */
    public static CycleReport report(SlotOutcome outcome, int attempts) {
        return new CycleReport(
            BASE_TIME.plusSeconds(120),
            outcome,
            attempts,
            Math.max(3, attempts),
            resultWithErrors(outcome.isSuccess() ? 0 : 4),
            snapshot(attempts, outcome.isSuccess() ? 0 : attempts, HealthStatus.HEALTHY),
            new RunTotals(1, outcome.isSuccess() ? 1 : 0, outcome == SlotOutcome.EXHAUSTED ? 1 : 0, attempts, 1, 2, 3)
        );
    }
}

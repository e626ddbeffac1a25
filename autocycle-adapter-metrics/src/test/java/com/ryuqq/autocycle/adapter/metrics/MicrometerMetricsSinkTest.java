package com.ryuqq.autocycle.adapter.metrics;

import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.testkit.fixture.CycleFixtures;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsSinkTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(registry);
    }

    @Test
    void testFlush_CountsCyclesByResult() {
        HealthSnapshot health = CycleFixtures.snapshot(1, 0, HealthStatus.HEALTHY);

        sink.flush(health, CycleFixtures.resultWithErrors(0));
        sink.flush(health, CycleFixtures.resultWithErrors(0));
        sink.flush(health, CycleFixtures.resultWithErrors(2));

        Counter clean = registry.find("autocycle.cycles").tag("result", "clean").counter();
        Counter withErrors = registry.find("autocycle.cycles").tag("result", "with_errors").counter();
        assertNotNull(clean);
        assertNotNull(withErrors);
        assertEquals(2.0, clean.count());
        assertEquals(1.0, withErrors.count());
        assertEquals(2.0, registry.find("autocycle.cycle.errors").counter().count());
        assertEquals(6.0, registry.find("autocycle.platforms.reached").counter().count());
    }

    @Test
    void testFlush_PhaseTagIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            sink.flush(CycleFixtures.snapshot(1, 1, HealthStatus.HEALTHY), CycleFixtures.resultWithErrors(1));
        } finally {
            Locale.setDefault(previous);
        }

        assertNotNull(registry.find("autocycle.phase.failures").tag("phase", "market_analysis").counter());
    }

    @Test
    void testClose_ClosesRegistry() {
        sink.close();
        sink.close();

        assertTrue(registry.isClosed());
    }

    @Test
    void testFlush_TagsFailedPhases() {
        sink.flush(CycleFixtures.snapshot(1, 1, HealthStatus.HEALTHY), CycleFixtures.resultWithErrors(2));

        Counter marketAnalysis = registry.find("autocycle.phase.failures").tag("phase", "market_analysis").counter();
        Counter contentGeneration = registry.find("autocycle.phase.failures").tag("phase", "content_generation").counter();
        assertNotNull(marketAnalysis);
        assertNotNull(contentGeneration);
        assertEquals(1.0, marketAnalysis.count());
        assertNull(registry.find("autocycle.phase.failures").tag("phase", "pricing").counter());
    }

    @Test
    void testFlush_CountsFallbackPhases() {
        CycleResult base = CycleFixtures.resultWithErrors(0);
        List<PhaseOutcome> phases = new ArrayList<>(base.phases());
        phases.set(PhaseName.PRICING.ordinal(), PhaseOutcome.fallback(PhaseName.PRICING, "USD 49.00"));
        CycleResult withFallback = new CycleResult(base.cycleId(), base.startedAt(), base.finishedAt(), phases,
            base.errors(), base.platformsReached(), base.languagesProduced(), base.campaignsExecuted(),
            base.templateName(), base.finalPrice());

        sink.flush(CycleFixtures.snapshot(1, 0, HealthStatus.HEALTHY), withFallback);

        Counter pricing = registry.find("autocycle.phase.fallbacks").tag("phase", "pricing").counter();
        assertNotNull(pricing);
        assertEquals(1.0, pricing.count());
    }

    @Test
    void testFlush_RecordsDuration() {
        sink.flush(CycleFixtures.snapshot(1, 0, HealthStatus.HEALTHY), CycleFixtures.resultWithErrors(0));

        Timer timer = registry.find("autocycle.cycle.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(12.0, timer.totalTime(TimeUnit.SECONDS), 0.001);
    }

    @Test
    void testHealthGauges_FollowLastFlush() {
        assertTrue(Double.isNaN(registry.get("autocycle.health.cpu").gauge().value()));

        sink.flush(CycleFixtures.snapshot(3, 2, HealthStatus.CRITICAL), CycleFixtures.resultWithErrors(0));

        assertEquals(12.5, registry.get("autocycle.health.cpu").gauge().value(), 0.001);
        assertEquals(63.25, registry.get("autocycle.health.disk").gauge().value(), 0.001);
        assertEquals(2.0, registry.get("autocycle.health.status").gauge().value(), 0.001);
        assertEquals(2.0, registry.get("autocycle.health.errors").gauge().value(), 0.001);
    }

    @Test
    void testFlush_NullArguments_ThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> sink.flush(null, CycleFixtures.resultWithErrors(0)));
        assertThrows(IllegalArgumentException.class,
            () -> sink.flush(CycleFixtures.snapshot(1, 0, HealthStatus.HEALTHY), null));
    }
}

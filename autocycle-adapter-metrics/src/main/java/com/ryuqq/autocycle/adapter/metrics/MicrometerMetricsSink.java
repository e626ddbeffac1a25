package com.ryuqq.autocycle.adapter.metrics;

import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.spi.MetricsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 사이클 결과와 헬스 스냅샷을 Micrometer 미터로 기록하는 MetricsSink.
 *
 * <p><strong>미터:</strong></p>
 * <ul>
 *   <li>{@code autocycle.cycles} (tag: result=clean|with_errors)</li>
 *   <li>{@code autocycle.cycle.errors}, {@code autocycle.platforms.reached},
 *       {@code autocycle.campaigns.executed}</li>
 *   <li>{@code autocycle.phase.failures}, {@code autocycle.phase.fallbacks} (tag: phase)</li>
 *   <li>{@code autocycle.cycle.duration} 타이머</li>
 *   <li>{@code autocycle.health.*} 게이지 (마지막 flush 기준)</li>
 * </ul>
 *
 * <p>{@link #close()}는 레지스트리를 닫습니다. 발행형(push) 레지스트리는
 * 닫힐 때 남은 값을 마지막으로 발행합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class MicrometerMetricsSink implements MetricsSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    private final MeterRegistry registry;
    private final AtomicReference<HealthSnapshot> lastHealth = new AtomicReference<>();

    public MicrometerMetricsSink() {
        this(new SimpleMeterRegistry());
    }

    /**
     * 생성자.
     *
     * @param registry 미터 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public MicrometerMetricsSink(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        registerHealthGauges();
    }

    @Override
    public void flush(HealthSnapshot health, CycleResult result) {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        lastHealth.set(health);

        Counter.builder("autocycle.cycles")
            .description("Cycles flushed to metrics")
            .tag("result", result.errorCount() == 0 ? "clean" : "with_errors")
            .register(registry)
            .increment();
        Counter.builder("autocycle.cycle.errors")
            .description("Non-fatal errors collected by cycles")
            .register(registry)
            .increment(result.errorCount());
        Counter.builder("autocycle.platforms.reached")
            .register(registry)
            .increment(result.platformsReached());
        Counter.builder("autocycle.campaigns.executed")
            .register(registry)
            .increment(result.campaignsExecuted());

        for (PhaseOutcome phase : result.phases()) {
            String name = phase.phase().name().toLowerCase(Locale.ROOT);
            if (!phase.success()) {
                Counter.builder("autocycle.phase.failures")
                    .tag("phase", name)
                    .register(registry)
                    .increment();
            } else if (phase.skipped()) {
                Counter.builder("autocycle.phase.fallbacks")
                    .tag("phase", name)
                    .register(registry)
                    .increment();
            }
        }

        Timer.builder("autocycle.cycle.duration")
            .description("Time from first phase start to last recorded phase end")
            .register(registry)
            .record(result.duration());

        log.debug("Metrics flushed for cycle {} ({} errors, health {})",
            result.cycleId(), result.errorCount(), health.status().label());
    }

    /**
     * 미터 레지스트리.
     */
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        if (!registry.isClosed()) {
            registry.close();
        }
    }

    private void registerHealthGauges() {
        Gauge.builder("autocycle.health.cpu", lastHealth, ref -> gauge(ref, Metric.CPU))
            .baseUnit("percent")
            .register(registry);
        Gauge.builder("autocycle.health.memory", lastHealth, ref -> gauge(ref, Metric.MEMORY))
            .baseUnit("percent")
            .register(registry);
        Gauge.builder("autocycle.health.disk", lastHealth, ref -> gauge(ref, Metric.DISK))
            .baseUnit("percent")
            .register(registry);
        Gauge.builder("autocycle.health.status", lastHealth, ref -> gauge(ref, Metric.STATUS))
            .description("0=healthy, 1=warning, 2=critical")
            .register(registry);
        Gauge.builder("autocycle.health.errors", lastHealth, ref -> gauge(ref, Metric.ERRORS))
            .description("Cumulative failed attempts")
            .register(registry);
    }

    private static double gauge(AtomicReference<HealthSnapshot> ref, Metric metric) {
        HealthSnapshot health = ref.get();
        if (health == null) {
            return Double.NaN;
        }
        return switch (metric) {
            case CPU -> health.gauges().cpuLoadPercent();
            case MEMORY -> health.gauges().memoryPercent();
            case DISK -> health.gauges().diskPercent();
            case STATUS -> health.status().ordinal();
            case ERRORS -> health.errorCount();
        };
    }

    private enum Metric {
        CPU,
        MEMORY,
        DISK,
        STATUS,
        ERRORS
    }
}

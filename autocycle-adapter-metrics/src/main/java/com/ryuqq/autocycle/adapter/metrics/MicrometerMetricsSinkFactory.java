package com.ryuqq.autocycle.adapter.metrics;

import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilityKey;
import com.ryuqq.autocycle.core.spi.CollaboratorFactory;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.NamingConvention;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * METRICS Capability용 CollaboratorFactory.
 *
 * <p>ServiceLoader로 발견됩니다. 기본 생성자는 {@link LoggingMeterRegistry}를 사용해
 * 매 발행 주기와 종료 시점에 미터 값을 로그로 발행합니다.
 * 발행 주기는 {@code -Dautocycle.metrics.step-ms}로 바꿀 수 있습니다 (기본 1시간).</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class MicrometerMetricsSinkFactory implements CollaboratorFactory {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSinkFactory.class);

    public static final String STEP_PROPERTY = "autocycle.metrics.step-ms";
    public static final Duration DEFAULT_STEP = Duration.ofHours(1);

    private final MeterRegistry registry;
    private final Duration step;
    private final Consumer<String> output;

    public MicrometerMetricsSinkFactory() {
        this(Duration.ofMillis(Long.getLong(STEP_PROPERTY, DEFAULT_STEP.toMillis())), log::info);
    }

    /**
     * 생성자.
     *
     * @param registry 사용할 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public MicrometerMetricsSinkFactory(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        this.step = null;
        this.output = null;
    }

    MicrometerMetricsSinkFactory(Duration step, Consumer<String> output) {
        if (step == null || step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive (current: " + step + ")");
        }
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        this.registry = null;
        this.step = step;
        this.output = output;
    }

    @Override
    public CapabilityKey key() {
        return CapabilityKey.of(Capability.METRICS);
    }

    @Override
    public Object create() {
        if (registry != null) {
            return new MicrometerMetricsSink(registry);
        }
        LoggingMeterRegistry publishing = LoggingMeterRegistry.builder(new PublishingConfig(step))
            .clock(Clock.SYSTEM)
            .loggingSink(output)
            .build();
        publishing.config().namingConvention(NamingConvention.dot);
        log.info("Publishing autocycle metrics to the log every {}", step);
        return new MicrometerMetricsSink(publishing);
    }

    private static final class PublishingConfig implements LoggingRegistryConfig {

        private final Duration step;

        PublishingConfig(Duration step) {
            this.step = step;
        }

        @Override
        public String get(String key) {
            return null;
        }

        @Override
        public Duration step() {
            return step;
        }
    }
}

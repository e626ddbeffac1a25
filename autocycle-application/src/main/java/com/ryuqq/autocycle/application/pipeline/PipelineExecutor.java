package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.application.pipeline.phase.AssetGenerationPhase;
import com.ryuqq.autocycle.application.pipeline.phase.CompetitiveIntelligencePhase;
import com.ryuqq.autocycle.application.pipeline.phase.ContentGenerationPhase;
import com.ryuqq.autocycle.application.pipeline.phase.LocalizationPhase;
import com.ryuqq.autocycle.application.pipeline.phase.MarketAnalysisPhase;
import com.ryuqq.autocycle.application.pipeline.phase.MetricsFlushPhase;
import com.ryuqq.autocycle.application.pipeline.phase.PricingPhase;
import com.ryuqq.autocycle.application.pipeline.phase.PromotionPhase;
import com.ryuqq.autocycle.application.pipeline.phase.PublishPhase;
import com.ryuqq.autocycle.application.pipeline.phase.ValidationPhase;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 10단계 파이프라인 실행자.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * runCycle(capabilities, request)
 *   ↓
 * MARKET_ANALYSIS → CONTENT_GENERATION → LOCALIZATION → ASSET_GENERATION
 *   → VALIDATION → PRICING → PUBLISH (fan-out) → PROMOTION (fan-out)
 *   → COMPETITIVE_INTELLIGENCE → METRICS_FLUSH
 *   ↓
 * CycleResult (항상 10개 PhaseOutcome)
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>어떤 Phase가 실패해도 다음 Phase는 실행됩니다.</li>
 *   <li>runCycle()은 예외를 던지지 않습니다.</li>
 *   <li>호출 사이에 유지되는 상태는 워커 풀뿐입니다. 재시도는 같은 인스턴스를 다시 호출합니다.</li>
 * </ul>
 *
 * <p>워커 풀은 {@link #close()}로 종료해야 합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class PipelineExecutor implements CycleRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);
    private static final long SHUTDOWN_WAIT_MS = 5000;

    private final PipelineConfig config;
    private final Clock clock;
    private final ExecutorService workers;
    private final List<CapabilityPhase> phases;

    /**
     * 생성자 (기본 설정, 시스템 시계).
     */
    public PipelineExecutor() {
        this(new PipelineConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 파이프라인 설정
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PipelineExecutor(PipelineConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(config.fanOutConcurrency(), new WorkerThreadFactory());

        TargetFanOut fanOut = new TargetFanOut(workers, config.targetTimeoutMs());
        this.phases = List.of(
            new MarketAnalysisPhase(),
            new ContentGenerationPhase(),
            new LocalizationPhase(),
            new AssetGenerationPhase(),
            new ValidationPhase(),
            new PricingPhase(),
            new PublishPhase(fanOut),
            new PromotionPhase(fanOut),
            new CompetitiveIntelligencePhase(),
            new MetricsFlushPhase(clock)
        );
    }

    @Override
    public CycleResult runCycle(CapabilitySet capabilities, CycleRequest request) {
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        String cycleId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        CycleContext context = new CycleContext(cycleId, startedAt, request, config);
        log.info("Cycle {} started (attempt {})", cycleId, request.attempt());

        for (CapabilityPhase phase : phases) {
            context.record(runPhase(phase, capabilities, context));
        }

        CycleResult result = context.toResult(clock.instant());
        log.info("Cycle {} finished in {} ms: {} errors, template '{}', {} platforms, {} languages, {} campaigns",
            cycleId, result.duration().toMillis(), result.errorCount(), result.templateName(),
            result.platformsReached(), result.languagesProduced(), result.campaignsExecuted());
        return result;
    }

    /**
     * Phase 하나 실행.
     *
     * <p>Phase 내부에서 처리되지 않은 RuntimeException은 해당 Phase의 실패로 변환됩니다.</p>
     */
    private PhaseOutcome runPhase(CapabilityPhase phase, CapabilitySet capabilities, CycleContext context) {
        try {
            return phase.execute(capabilities, context);
        } catch (RuntimeException e) {
            String message = "unexpected failure: " + Failures.describe(e);
            log.error("Phase {} escaped its error handling", phase.name(), e);
            context.addError(CycleError.of(phase.name(), message));
            return PhaseOutcome.failed(phase.name(), message, null);
        }
    }

    public PipelineConfig config() {
        return config;
    }

    /**
     * 워커 풀 종료.
     *
     * <p>진행 중인 대상 작업은 최대 5초까지 기다린 뒤 인터럽트합니다.</p>
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "autocycle-fanout-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.ChannelStatus;
import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.artifact.LocalizedBundle;
import com.ryuqq.autocycle.core.artifact.LocalizedContent;
import com.ryuqq.autocycle.core.artifact.MarketSignal;
import com.ryuqq.autocycle.core.artifact.PriceQuote;
import com.ryuqq.autocycle.core.artifact.PublishReceipt;
import com.ryuqq.autocycle.core.artifact.ValidationReport;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilityKey;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.spi.ContentGenerator;
import com.ryuqq.autocycle.core.spi.Localizer;
import com.ryuqq.autocycle.core.spi.MarketingDispatcher;
import com.ryuqq.autocycle.core.spi.MetricsSink;
import com.ryuqq.autocycle.core.spi.PaymentProcessor;
import com.ryuqq.autocycle.core.spi.PlatformPublisher;
import com.ryuqq.autocycle.core.spi.TrendSource;
import com.ryuqq.autocycle.core.spi.Validator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * PipelineExecutor 테스트.
 *
 * <ul>
 *   <li>Capability 없이도 10개 Phase 모두 기록</li>
 *   <li>협력자 실패는 해당 Phase만 실패, 이후 Phase 계속 실행</li>
 *   <li>Fan-out: 일부 대상 실패/타임아웃 처리</li>
 *   <li>검증 불통과 산출물도 다음 단계로 전달</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
class PipelineExecutorTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private PipelineExecutor executor;
    private CycleRequest request;

    @BeforeEach
    void setUp() {
        executor = new PipelineExecutor(new PipelineConfig().withTargetTimeoutMs(300), Clock.systemUTC());
        request = CycleRequest.initial(NOW);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    // ============================================================
    // 1. Capability 부재
    // ============================================================

    @Test
    void runCycle_빈_Capability_집합이면_모든_Phase가_skipped() {
        CycleResult result = executor.runCycle(CapabilitySet.empty(), request);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.phases()).allSatisfy(phase -> {
            assertThat(phase.success()).isTrue();
            assertThat(phase.skipped()).isTrue();
        });
        assertThat(result.errors()).isEmpty();
        assertThat(result.templateName()).isEqualTo("AI Productivity Template");
        assertThat(result.finalPrice().amount()).isEqualByComparingTo("49.00");
        assertThat(result.platformsReached()).isEqualTo(2);
        assertThat(result.languagesProduced()).isEqualTo(1);
        assertThat(result.campaignsExecuted()).isZero();
        assertThat(result.phase(PhaseName.MARKET_ANALYSIS).artifactRef()).contains("AI Productivity");
        assertThat(result.phase(PhaseName.PUBLISH).artifactRef()).isEqualTo("2 demo deployments");
        assertThat(result.finishedAt()).isAfterOrEqualTo(result.startedAt());
    }

    // ============================================================
    // 2. Phase 실패 격리
    // ============================================================

    @Test
    void runCycle_콘텐츠_생성_실패시_placeholder로_계속_진행() {
        List<ArtifactBundle> published = Collections.synchronizedList(new ArrayList<>());
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.CONTENT_GENERATION), (ContentGenerator) trend -> {
                throw new IllegalStateException("rate limited");
            })
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "gumroad"), (PlatformPublisher) bundle -> {
                published.add(bundle);
                return PublishReceipt.published("https://gumroad.example/l/1");
            })
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome content = result.phase(PhaseName.CONTENT_GENERATION);
        assertThat(content.success()).isFalse();
        assertThat(content.skipped()).isFalse();
        assertThat(content.errorMessage()).isEqualTo("rate limited");
        assertThat(result.errors()).containsExactly(CycleError.of(PhaseName.CONTENT_GENERATION, "rate limited"));
        assertThat(result.isComplete()).isTrue();
        assertThat(published).hasSize(1);
        assertThat(published.get(0).content().name()).isEqualTo("AI Productivity Template");
        assertThat(result.platformsReached()).isEqualTo(1);
    }

    @Test
    void runCycle_메시지_없는_예외는_클래스_이름으로_기록() {
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.PAYMENTS), (PaymentProcessor) bundle -> {
                throw new NullPointerException();
            })
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome pricing = result.phase(PhaseName.PRICING);
        assertThat(pricing.success()).isFalse();
        assertThat(pricing.errorMessage()).isEqualTo("NullPointerException");
        assertThat(result.finalPrice().amount()).isEqualByComparingTo("49.00");
    }

    @Test
    void runCycle_협력자가_null을_반환하면_실패로_기록() {
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.LOCALIZATION), (Localizer) (content, locales) -> null)
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        assertThat(result.phase(PhaseName.LOCALIZATION).errorMessage()).isEqualTo("Localizer returned null");
        assertThat(result.languagesProduced()).isEqualTo(1);
    }

    @Test
    void runCycle_present_협력자의_산출물이_다음_Phase로_전달() {
        List<String> seenLocales = new ArrayList<>();
        ContentSpec vault = new ContentSpec("t-1", "Second Brain Vault", "Notes", List.of("Knowledge"),
            List.of("notion"), new BigDecimal("79.00"), "USD");
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.TREND_ANALYSIS), (TrendSource) () -> List.of(
                new MarketSignal("Budget Tracker", 0.41, new BigDecimal("19.00")),
                new MarketSignal("Second Brain", 0.93, new BigDecimal("79.00"))
            ))
            .present(CapabilityKey.of(Capability.CONTENT_GENERATION), (ContentGenerator) trend -> {
                assertThat(trend.niche()).isEqualTo("Second Brain");
                return vault;
            })
            .present(CapabilityKey.of(Capability.LOCALIZATION), (Localizer) (content, locales) -> {
                seenLocales.addAll(locales);
                Map<String, LocalizedContent> translations = new LinkedHashMap<>();
                for (String locale : locales) {
                    translations.put(locale, new LocalizedContent(locale, content.name(), content.description()));
                }
                return new LocalizedBundle(translations);
            })
            .present(CapabilityKey.of(Capability.PAYMENTS), (PaymentProcessor) bundle ->
                new PriceQuote(bundle.price().amount().add(BigDecimal.TEN), "USD", List.of("card", "crypto")))
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        assertThat(result.errors()).isEmpty();
        assertThat(result.templateName()).isEqualTo("Second Brain Vault");
        assertThat(seenLocales).containsExactly("en", "es", "pt", "ja", "de");
        assertThat(result.languagesProduced()).isEqualTo(5);
        assertThat(result.finalPrice().amount()).isEqualByComparingTo("89.00");
        assertThat(result.phase(PhaseName.PRICING).skipped()).isFalse();
    }

    // ============================================================
    // 3. 검증 불통과
    // ============================================================

    @Test
    void runCycle_검증_불통과는_실패로_기록되지만_배포는_계속() {
        List<ArtifactBundle> published = Collections.synchronizedList(new ArrayList<>());
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.QUALITY_ASSURANCE), (Validator) bundle ->
                new ValidationReport(false, List.of("duplicate title", "trademark term"), 0.8))
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "gumroad"), (PlatformPublisher) bundle -> {
                published.add(bundle);
                return PublishReceipt.published("https://gumroad.example/l/2");
            })
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome validation = result.phase(PhaseName.VALIDATION);
        assertThat(validation.success()).isFalse();
        assertThat(validation.errorMessage()).isEqualTo("validation failed: duplicate title; trademark term");
        assertThat(result.errors()).hasSize(1);
        assertThat(published).hasSize(1);
        assertThat(result.phase(PhaseName.PUBLISH).success()).isTrue();
    }

    // ============================================================
    // 4. Fan-out
    // ============================================================

    @Test
    void runCycle_일부_플랫폼_실패는_대상별_오류로_기록하고_Phase는_성공() {
        CountDownLatch never = new CountDownLatch(1);
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "gumroad"),
                (PlatformPublisher) bundle -> PublishReceipt.published("https://gumroad.example/l/3"))
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "etsy"), (PlatformPublisher) bundle -> {
                throw new IllegalStateException("HTTP 503");
            })
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "payhip"), (PlatformPublisher) bundle -> {
                awaitQuietly(never, 5, TimeUnit.SECONDS);
                return PublishReceipt.published("too late");
            })
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "lemon"),
                (PlatformPublisher) bundle -> PublishReceipt.rejected("listing limit reached"))
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome publish = result.phase(PhaseName.PUBLISH);
        assertThat(publish.success()).isTrue();
        assertThat(publish.targets()).extracting(TargetOutcome::target)
            .containsExactly("gumroad", "etsy", "payhip", "lemon");
        assertThat(publish.targets()).extracting(TargetOutcome::success)
            .containsExactly(true, false, false, false);
        assertThat(publish.targets().get(2).errorMessage()).contains("timed out");
        assertThat(result.errors()).extracting(CycleError::target).containsExactly("etsy", "payhip", "lemon");
        assertThat(result.platformsReached()).isEqualTo(1);
    }

    @Test
    void runCycle_모든_플랫폼_실패시_Phase_실패() {
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "gumroad"), (PlatformPublisher) bundle -> {
                throw new IllegalStateException("unauthorized");
            })
            .present(CapabilityKey.of(Capability.PLATFORM_PUBLISH, "etsy"), (PlatformPublisher) bundle -> {
                throw new IllegalStateException("HTTP 503");
            })
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome publish = result.phase(PhaseName.PUBLISH);
        assertThat(publish.success()).isFalse();
        assertThat(publish.errorMessage()).isEqualTo("all 2 platforms failed");
        assertThat(result.errors()).hasSize(2);
        assertThat(result.platformsReached()).isZero();
    }

    @Test
    void runCycle_마케팅_채널별_결과를_집계() {
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.MARKETING), (MarketingDispatcher) (bundle, audience) -> List.of(
                new ChannelStatus("email", true, "sent to 120"),
                new ChannelStatus("telegram", false, null),
                new ChannelStatus("discord", true, "posted")
            ))
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        PhaseOutcome promotion = result.phase(PhaseName.PROMOTION);
        assertThat(promotion.success()).isTrue();
        assertThat(promotion.targets()).hasSize(3);
        assertThat(result.campaignsExecuted()).isEqualTo(2);
        assertThat(result.errors()).containsExactly(
            CycleError.ofTarget(PhaseName.PROMOTION, "telegram", "channel reported failure"));
    }

    // ============================================================
    // 5. 메트릭 / 재호출
    // ============================================================

    @Test
    void runCycle_메트릭_싱크에_잠정_결과와_헬스_스냅샷_전달() {
        MetricsSink sink = mock(MetricsSink.class);
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.METRICS), sink)
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        ArgumentCaptor<CycleResult> captor = ArgumentCaptor.forClass(CycleResult.class);
        verify(sink).flush(eq(request.health()), captor.capture());
        assertThat(captor.getValue().phases()).hasSize(9);
        assertThat(captor.getValue().cycleId()).isEqualTo(result.cycleId());
        assertThat(result.phase(PhaseName.METRICS_FLUSH).success()).isTrue();
    }

    @Test
    void runCycle_메트릭_싱크_실패도_사이클을_중단하지_않음() {
        MetricsSink sink = mock(MetricsSink.class);
        org.mockito.Mockito.doThrow(new IllegalStateException("statsd down"))
            .when(sink).flush(any(HealthSnapshot.class), any(CycleResult.class));
        CapabilitySet capabilities = CapabilitySet.builder()
            .present(CapabilityKey.of(Capability.METRICS), sink)
            .build();

        CycleResult result = executor.runCycle(capabilities, request);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.phase(PhaseName.METRICS_FLUSH).success()).isFalse();
        assertThat(result.errorCount()).isEqualTo(1);
    }

    @Test
    void runCycle_같은_인스턴스를_반복_호출해도_독립적인_결과() {
        CycleResult first = executor.runCycle(CapabilitySet.empty(), request);
        CycleResult second = executor.runCycle(CapabilitySet.empty(), new CycleRequest(request.health(), request.totals(), 2));

        assertThat(second.cycleId()).isNotEqualTo(first.cycleId());
        assertThat(second.phases()).hasSize(PhaseName.values().length);
        assertThat(second.errors()).isEmpty();
    }

    private static void awaitQuietly(CountDownLatch latch, long timeout, TimeUnit unit) {
        try {
            latch.await(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.AssetSet;
import com.ryuqq.autocycle.core.artifact.CompetitorInsights;
import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.artifact.LocalizedBundle;
import com.ryuqq.autocycle.core.artifact.PriceQuote;
import com.ryuqq.autocycle.core.artifact.TrendContext;
import com.ryuqq.autocycle.core.artifact.ValidationReport;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 사이클 한 번 동안의 Phase 간 산출물 보관소.
 *
 * <p>runCycle() 호출마다 새로 생성되며, 호출 스레드에서만 변경됩니다.
 * Fan-out 작업은 결과를 반환하기만 하고 이 객체를 직접 수정하지 않습니다.</p>
 *
 * <p>각 Phase는 성공, 부재, 실패 어느 경우에도 자신의 산출물을 채우므로
 * 이후 Phase는 null을 보지 않습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class CycleContext {

    private final String cycleId;
    private final Instant startedAt;
    private final CycleRequest request;
    private final PipelineConfig config;

    private final List<PhaseOutcome> outcomes = new ArrayList<>();
    private final List<CycleError> errors = new ArrayList<>();

    private TrendContext trend;
    private ContentSpec content;
    private LocalizedBundle localized;
    private AssetSet assets = AssetSet.none();
    private ValidationReport validation;
    private PriceQuote price;
    private List<TargetOutcome> deployments = List.of();
    private List<TargetOutcome> campaigns = List.of();
    private CompetitorInsights insights;

    public CycleContext(String cycleId, Instant startedAt, CycleRequest request, PipelineConfig config) {
        if (cycleId == null || cycleId.isBlank()) {
            throw new IllegalArgumentException("cycleId cannot be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cycleId = cycleId;
        this.startedAt = startedAt;
        this.request = request;
        this.config = config;
    }

    public String cycleId() {
        return cycleId;
    }

    public CycleRequest request() {
        return request;
    }

    public PipelineConfig config() {
        return config;
    }

    // ========== Phase 결과 ==========

    public void record(PhaseOutcome outcome) {
        outcomes.add(outcome);
    }

    public void addError(CycleError error) {
        errors.add(error);
    }

    public List<PhaseOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    public List<CycleError> errors() {
        return List.copyOf(errors);
    }

    // ========== 산출물 ==========

    public TrendContext trend() {
        return trend;
    }

    public void trend(TrendContext trend) {
        this.trend = trend;
    }

    /**
     * 상품 명세 (CONTENT_GENERATION 이전이면 placeholder).
     */
    public ContentSpec content() {
        return content != null ? content : FallbackArtifacts.placeholderContent();
    }

    public void content(ContentSpec content) {
        this.content = content;
    }

    public LocalizedBundle localized() {
        return localized != null ? localized : LocalizedBundle.single(FallbackArtifacts.DEFAULT_LOCALE, content());
    }

    public void localized(LocalizedBundle localized) {
        this.localized = localized;
    }

    public AssetSet assets() {
        return assets;
    }

    public void assets(AssetSet assets) {
        this.assets = assets;
    }

    public ValidationReport validation() {
        return validation;
    }

    public void validation(ValidationReport validation) {
        this.validation = validation;
    }

    /**
     * 현재 가격 (PRICING 이전이면 기본 가격).
     */
    public PriceQuote price() {
        return price != null ? price : PriceQuote.basePriceOf(content());
    }

    public void price(PriceQuote price) {
        this.price = price;
    }

    public List<TargetOutcome> deployments() {
        return deployments;
    }

    public void deployments(List<TargetOutcome> deployments) {
        this.deployments = List.copyOf(deployments);
    }

    public List<TargetOutcome> campaigns() {
        return campaigns;
    }

    public void campaigns(List<TargetOutcome> campaigns) {
        this.campaigns = List.copyOf(campaigns);
    }

    public CompetitorInsights insights() {
        return insights;
    }

    public void insights(CompetitorInsights insights) {
        this.insights = insights;
    }

    /**
     * 하위 Phase에 전달할 산출물 묶음.
     *
     * @return 현재까지의 산출물
     */
    public ArtifactBundle bundle() {
        return new ArtifactBundle(content(), localized(), assets, price());
    }

    /**
     * 현재까지 기록된 Phase로 결과 생성.
     *
     * <p>METRICS_FLUSH에는 직전 Phase까지의 잠정 결과가 전달되고,
     * 마지막에 전체 결과가 같은 방식으로 생성됩니다.</p>
     *
     * @param finishedAt 종료 시각
     * @return 사이클 결과
     */
    public CycleResult toResult(Instant finishedAt) {
        return new CycleResult(
            cycleId,
            startedAt,
            finishedAt.isBefore(startedAt) ? startedAt : finishedAt,
            outcomes,
            errors,
            countSucceeded(deployments),
            localized().locales().size(),
            countSucceeded(campaigns),
            content().name(),
            price()
        );
    }

    private static int countSucceeded(List<TargetOutcome> targets) {
        int count = 0;
        for (TargetOutcome target : targets) {
            if (target.success()) {
                count++;
            }
        }
        return count;
    }
}

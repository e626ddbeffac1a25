package com.ryuqq.autocycle.core.cycle;

import com.ryuqq.autocycle.core.capability.Capability;

/**
 * 사이클을 구성하는 고정된 Phase 순서.
 *
 * <p>열거 순서가 곧 실행 순서입니다.</p>
 *
 * <pre>
 * MARKET_ANALYSIS → CONTENT_GENERATION → LOCALIZATION → ASSET_GENERATION
 *   → VALIDATION → PRICING → PUBLISH → PROMOTION
 *   → COMPETITIVE_INTELLIGENCE → METRICS_FLUSH
 * </pre>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum PhaseName {

    MARKET_ANALYSIS(Capability.TREND_ANALYSIS),
    CONTENT_GENERATION(Capability.CONTENT_GENERATION),
    LOCALIZATION(Capability.LOCALIZATION),
    ASSET_GENERATION(Capability.ASSET_GENERATION),
    VALIDATION(Capability.QUALITY_ASSURANCE),
    PRICING(Capability.PAYMENTS),
    PUBLISH(Capability.PLATFORM_PUBLISH),
    PROMOTION(Capability.MARKETING),
    COMPETITIVE_INTELLIGENCE(Capability.COMPETITOR_INTEL),
    METRICS_FLUSH(Capability.METRICS);

    private final Capability requiredCapability;

    PhaseName(Capability requiredCapability) {
        this.requiredCapability = requiredCapability;
    }

    /**
     * 이 Phase의 선택 작업에 필요한 Capability.
     *
     * @return Capability
     */
    public Capability requiredCapability() {
        return requiredCapability;
    }

    /**
     * fan-out(대상별 독립 실행) Phase인지 여부.
     *
     * @return PUBLISH, PROMOTION이면 true
     */
    public boolean isFanOut() {
        return requiredCapability.isMultiTarget();
    }
}

package com.ryuqq.autocycle.core.artifact;

import java.math.BigDecimal;
import java.util.List;

/**
 * 시장 분석 Phase의 결과.
 *
 * <p>가장 높은 트렌드 점수를 가진 니치와, 판단에 사용된 전체 신호를 담습니다.</p>
 *
 * @param niche 선정된 니치
 * @param trendScore 선정된 니치의 트렌드 점수
 * @param referencePrice 선정된 니치의 평균 가격
 * @param signals 분석에 사용된 시장 신호
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record TrendContext(String niche, double trendScore, BigDecimal referencePrice, List<MarketSignal> signals) {

    public TrendContext {
        if (niche == null || niche.isBlank()) {
            throw new IllegalArgumentException("niche cannot be null or blank");
        }
        if (referencePrice == null) {
            throw new IllegalArgumentException("referencePrice cannot be null");
        }
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    /**
     * 신호 목록에서 트렌드 점수가 가장 높은 니치를 선정.
     *
     * @param signals 시장 신호 (비어 있으면 안 됨)
     * @return TrendContext
     * @throws IllegalArgumentException signals가 비어 있는 경우
     */
    public static TrendContext strongestOf(List<MarketSignal> signals) {
        if (signals == null || signals.isEmpty()) {
            throw new IllegalArgumentException("signals cannot be null or empty");
        }
        MarketSignal best = signals.get(0);
        for (MarketSignal signal : signals) {
            if (signal.trendScore() > best.trendScore()) {
                best = signal;
            }
        }
        return new TrendContext(best.niche(), best.trendScore(), best.averagePrice(), signals);
    }
}

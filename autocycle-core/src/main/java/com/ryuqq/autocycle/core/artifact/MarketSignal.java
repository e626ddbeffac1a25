package com.ryuqq.autocycle.core.artifact;

import java.math.BigDecimal;

/**
 * 시장 신호 (니치별 트렌드 점수와 평균 가격).
 *
 * @param niche 니치 이름
 * @param trendScore 트렌드 점수 (0.0 ~ 1.0)
 * @param averagePrice 평균 판매 가격
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record MarketSignal(String niche, double trendScore, BigDecimal averagePrice) {

    public MarketSignal {
        if (niche == null || niche.isBlank()) {
            throw new IllegalArgumentException("niche cannot be null or blank");
        }
        if (trendScore < 0.0 || trendScore > 1.0) {
            throw new IllegalArgumentException(
                "trendScore must be between 0.0 and 1.0 (current: " + trendScore + ")"
            );
        }
        if (averagePrice == null || averagePrice.signum() < 0) {
            throw new IllegalArgumentException("averagePrice cannot be null or negative");
        }
    }
}

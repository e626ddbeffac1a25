package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.CompetitorInsights;

/**
 * 경쟁사 분석 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface CompetitorIntelProvider {

    /**
     * 카테고리의 경쟁 현황 분석.
     *
     * @param category 카테고리
     * @return 인사이트
     * @throws RuntimeException 분석 실패 시
     */
    CompetitorInsights analyze(String category);
}

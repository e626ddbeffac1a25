package com.ryuqq.autocycle.core.artifact;

import java.util.List;

/**
 * 경쟁사 분석 결과.
 *
 * @param category 분석 대상 카테고리
 * @param insights 인사이트 목록
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CompetitorInsights(String category, List<String> insights) {

    public CompetitorInsights {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        insights = insights == null ? List.of() : List.copyOf(insights);
    }

    public static CompetitorInsights none(String category) {
        return new CompetitorInsights(category, List.of());
    }
}

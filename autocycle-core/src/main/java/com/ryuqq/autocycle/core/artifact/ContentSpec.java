package com.ryuqq.autocycle.core.artifact;

import java.math.BigDecimal;
import java.util.List;

/**
 * 콘텐츠 생성 결과 (판매할 디지털 상품 명세).
 *
 * @param id 상품 식별자
 * @param name 상품 이름
 * @param description 설명
 * @param features 주요 기능 목록 (첫 번째 항목이 카테고리로 사용됨)
 * @param seoKeywords SEO 키워드
 * @param basePrice 기본 가격
 * @param currency 통화 코드 (예: USD)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record ContentSpec(
    String id,
    String name,
    String description,
    List<String> features,
    List<String> seoKeywords,
    BigDecimal basePrice,
    String currency
) {

    public ContentSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (basePrice == null || basePrice.signum() < 0) {
            throw new IllegalArgumentException("basePrice cannot be null or negative");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency cannot be null or blank");
        }
        description = description == null ? "" : description;
        features = features == null ? List.of() : List.copyOf(features);
        seoKeywords = seoKeywords == null ? List.of() : List.copyOf(seoKeywords);
    }

    /**
     * 경쟁사 분석에 사용할 카테고리.
     *
     * @param fallback features가 비어 있을 때 사용할 값
     * @return 첫 번째 기능 또는 fallback
     */
    public String category(String fallback) {
        return features.isEmpty() ? fallback : features.get(0);
    }
}

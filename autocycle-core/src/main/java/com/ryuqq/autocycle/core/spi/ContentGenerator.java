package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.artifact.TrendContext;

/**
 * 콘텐츠 생성 협력자 (AI 기반 상품 명세 생성).
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface ContentGenerator {

    /**
     * 트렌드 분석 결과로부터 상품 명세 생성.
     *
     * @param trend 시장 분석 결과
     * @return 상품 명세
     * @throws RuntimeException 생성 실패 시
     */
    ContentSpec generate(TrendContext trend);
}

package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.PriceQuote;

/**
 * 결제/가격 협력자.
 *
 * <p>최종 가격과 지원 결제 수단을 결정합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface PaymentProcessor {

    /**
     * 산출물의 최종 가격 견적.
     *
     * @param bundle 가격을 매길 산출물 (현재 견적 포함)
     * @return 최종 견적
     * @throws RuntimeException 견적 실패 시
     */
    PriceQuote quote(ArtifactBundle bundle);
}

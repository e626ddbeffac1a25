package com.ryuqq.autocycle.core.artifact;

import java.math.BigDecimal;
import java.util.List;

/**
 * 가격 결정 결과.
 *
 * @param amount 최종 가격
 * @param currency 통화 코드
 * @param paymentMethods 지원 결제 수단 (예: card, usdc)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record PriceQuote(BigDecimal amount, String currency, List<String> paymentMethods) {

    public PriceQuote {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be null or negative");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency cannot be null or blank");
        }
        paymentMethods = paymentMethods == null ? List.of() : List.copyOf(paymentMethods);
    }

    /**
     * 콘텐츠의 기본 가격을 그대로 사용하는 견적.
     *
     * @param content 콘텐츠 명세
     * @return 기본 가격 견적
     */
    public static PriceQuote basePriceOf(ContentSpec content) {
        return new PriceQuote(content.basePrice(), content.currency(), List.of());
    }
}

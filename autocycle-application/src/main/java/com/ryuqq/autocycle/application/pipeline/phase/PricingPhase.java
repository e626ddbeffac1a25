package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.PriceQuote;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.PaymentProcessor;

/**
 * 6단계: 가격 및 결제 수단 결정.
 *
 * <p>결제 협력자가 없으면 상품 명세의 기본 가격을 그대로 사용합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class PricingPhase extends CapabilityPhase {

    public PricingPhase() {
        super(PhaseName.PRICING);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        PaymentProcessor processor = capabilities.find(Capability.PAYMENTS, PaymentProcessor.class).orElseThrow();
        PriceQuote quote = Failures.requireResult(processor.quote(context.bundle()), "PaymentProcessor");
        context.price(quote);
        return PhaseOutcome.completed(name(), describe(quote));
    }

    @Override
    protected String applyFallback(CycleContext context) {
        PriceQuote base = PriceQuote.basePriceOf(context.content());
        context.price(base);
        return "base price " + describe(base);
    }

    private static String describe(PriceQuote quote) {
        return quote.amount().toPlainString() + " " + quote.currency();
    }
}

package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.CompetitorInsights;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.CompetitorIntelProvider;

/**
 * 9단계: 경쟁사 분석.
 *
 * <p>카테고리는 상품 명세의 첫 번째 기능, 없으면 설정된 기본 카테고리입니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class CompetitiveIntelligencePhase extends CapabilityPhase {

    public CompetitiveIntelligencePhase() {
        super(PhaseName.COMPETITIVE_INTELLIGENCE);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        CompetitorIntelProvider provider =
            capabilities.find(Capability.COMPETITOR_INTEL, CompetitorIntelProvider.class).orElseThrow();
        String category = category(context);
        CompetitorInsights insights = Failures.requireResult(provider.analyze(category), "CompetitorIntelProvider");
        context.insights(insights);
        return PhaseOutcome.completed(name(), insights.insights().size() + " insights for " + category);
    }

    @Override
    protected String applyFallback(CycleContext context) {
        String category = category(context);
        context.insights(CompetitorInsights.none(category));
        return "no insights for " + category;
    }

    private static String category(CycleContext context) {
        return context.content().category(context.config().defaultCategory());
    }
}

package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.FallbackArtifacts;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.MarketSignal;
import com.ryuqq.autocycle.core.artifact.TrendContext;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.TrendSource;

import java.util.List;

/**
 * 1단계: 시장 트렌드 분석.
 *
 * <p>수집된 신호 중 trendScore가 가장 높은 니치를 선택합니다.
 * 수집기가 없으면 내장 기본 신호로 같은 선택을 수행합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class MarketAnalysisPhase extends CapabilityPhase {

    public MarketAnalysisPhase() {
        super(PhaseName.MARKET_ANALYSIS);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        TrendSource source = capabilities.find(Capability.TREND_ANALYSIS, TrendSource.class).orElseThrow();
        List<MarketSignal> signals = Failures.requireResult(source.collect(), "TrendSource");
        if (signals.isEmpty()) {
            throw new IllegalStateException("TrendSource returned no market signals");
        }
        TrendContext trend = TrendContext.strongestOf(signals);
        context.trend(trend);
        return PhaseOutcome.completed(name(), describe(trend));
    }

    @Override
    protected String applyFallback(CycleContext context) {
        TrendContext trend = TrendContext.strongestOf(FallbackArtifacts.DEFAULT_SIGNALS);
        context.trend(trend);
        return "default signals: " + describe(trend);
    }

    private static String describe(TrendContext trend) {
        return trend.niche() + " (score " + trend.trendScore() + ")";
    }
}

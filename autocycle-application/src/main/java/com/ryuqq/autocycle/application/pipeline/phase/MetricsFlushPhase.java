package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.MetricsSink;

import java.time.Clock;

/**
 * 10단계: 메트릭 전송.
 *
 * <p>요청의 헬스 스냅샷과 1~9단계까지의 잠정 결과를 전달합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class MetricsFlushPhase extends CapabilityPhase {

    private final Clock clock;

    public MetricsFlushPhase(Clock clock) {
        super(PhaseName.METRICS_FLUSH);
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        MetricsSink sink = capabilities.find(Capability.METRICS, MetricsSink.class).orElseThrow();
        CycleResult provisional = context.toResult(clock.instant());
        sink.flush(context.request().health(), provisional);
        return PhaseOutcome.completed(name(), "flushed " + provisional.phases().size() + " phases");
    }

    @Override
    protected String applyFallback(CycleContext context) {
        return "metrics disabled";
    }
}

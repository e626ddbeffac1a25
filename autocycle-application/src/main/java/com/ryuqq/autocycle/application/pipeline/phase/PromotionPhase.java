package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.FanOutPhase;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.application.pipeline.TargetFanOut;
import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.ChannelStatus;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;
import com.ryuqq.autocycle.core.spi.MarketingDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 8단계: 마케팅 캠페인 (대상별 독립 실행).
 *
 * <p>협력자가 보고한 채널 하나하나가 대상 결과가 됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class PromotionPhase extends FanOutPhase {

    public PromotionPhase(TargetFanOut fanOut) {
        super(PhaseName.PROMOTION, fanOut);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        Map<String, MarketingDispatcher> dispatchers =
            capabilities.named(Capability.MARKETING, MarketingDispatcher.class);
        ArtifactBundle bundle = context.bundle();
        String audience = context.config().audience();

        List<TargetOutcome> targets = fanOut().run(dispatchers, (dispatcherName, dispatcher) -> {
            List<ChannelStatus> channels =
                Failures.requireResult(dispatcher.launch(bundle, audience), "MarketingDispatcher");
            List<TargetOutcome> outcomes = new ArrayList<>();
            for (ChannelStatus channel : channels) {
                outcomes.add(toTarget(channel));
            }
            return outcomes;
        });

        context.campaigns(targets);
        return aggregate(context, targets, "campaigns");
    }

    @Override
    protected String applyFallback(CycleContext context) {
        context.campaigns(List.of());
        return "no campaigns";
    }

    private static TargetOutcome toTarget(ChannelStatus channel) {
        if (channel.success()) {
            return TargetOutcome.succeeded(channel.channel(), channel.detail());
        }
        String detail = channel.detail() == null || channel.detail().isBlank()
            ? "channel reported failure"
            : channel.detail();
        return TargetOutcome.failed(channel.channel(), detail);
    }
}

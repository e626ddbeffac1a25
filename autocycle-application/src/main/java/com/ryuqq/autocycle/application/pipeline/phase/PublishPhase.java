package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.FallbackArtifacts;
import com.ryuqq.autocycle.application.pipeline.FanOutPhase;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.application.pipeline.TargetFanOut;
import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.PublishReceipt;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;
import com.ryuqq.autocycle.core.spi.PlatformPublisher;

import java.util.List;
import java.util.Map;

/**
 * 7단계: 플랫폼 배포 (대상별 독립 실행).
 *
 * <p>배포 협력자가 하나도 없으면 데모 배포 두 건을 기록합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class PublishPhase extends FanOutPhase {

    public PublishPhase(TargetFanOut fanOut) {
        super(PhaseName.PUBLISH, fanOut);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        Map<String, PlatformPublisher> publishers =
            capabilities.named(Capability.PLATFORM_PUBLISH, PlatformPublisher.class);
        ArtifactBundle bundle = context.bundle();

        List<TargetOutcome> targets = fanOut().run(publishers, (platform, publisher) -> {
            PublishReceipt receipt = Failures.requireResult(publisher.publish(bundle), "PlatformPublisher");
            if (receipt.success()) {
                return List.of(TargetOutcome.succeeded(platform, receipt.reference()));
            }
            String reason = receipt.reference() == null || receipt.reference().isBlank()
                ? "publish rejected"
                : receipt.reference();
            return List.of(TargetOutcome.failed(platform, reason));
        });

        context.deployments(targets);
        return aggregate(context, targets, "platforms");
    }

    @Override
    protected String applyFallback(CycleContext context) {
        List<TargetOutcome> demo = FallbackArtifacts.demoDeployments();
        context.deployments(demo);
        return demo.size() + " demo deployments";
    }

    @Override
    protected String recoverFromFailure(CycleContext context) {
        context.deployments(List.of());
        return "no deployments";
    }
}

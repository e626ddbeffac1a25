package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.AssetSet;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.AssetGenerator;

/**
 * 4단계: 이미지/소셜 자산 생성.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class AssetGenerationPhase extends CapabilityPhase {

    public AssetGenerationPhase() {
        super(PhaseName.ASSET_GENERATION);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        AssetGenerator generator = capabilities.find(Capability.ASSET_GENERATION, AssetGenerator.class).orElseThrow();
        AssetSet assets = Failures.requireResult(generator.generate(context.content()), "AssetGenerator");
        context.assets(assets);
        return PhaseOutcome.completed(name(), assets.size() + " assets");
    }

    @Override
    protected String applyFallback(CycleContext context) {
        context.assets(AssetSet.none());
        return "no assets";
    }
}

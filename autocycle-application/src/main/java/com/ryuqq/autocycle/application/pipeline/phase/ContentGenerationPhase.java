package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.FallbackArtifacts;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.ContentGenerator;

/**
 * 2단계: 상품 명세 생성.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class ContentGenerationPhase extends CapabilityPhase {

    public ContentGenerationPhase() {
        super(PhaseName.CONTENT_GENERATION);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        ContentGenerator generator = capabilities.find(Capability.CONTENT_GENERATION, ContentGenerator.class).orElseThrow();
        ContentSpec content = Failures.requireResult(generator.generate(context.trend()), "ContentGenerator");
        context.content(content);
        return PhaseOutcome.completed(name(), content.name());
    }

    @Override
    protected String applyFallback(CycleContext context) {
        ContentSpec placeholder = FallbackArtifacts.placeholderContent();
        context.content(placeholder);
        return "placeholder: " + placeholder.name();
    }
}

package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.FallbackArtifacts;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.LocalizedBundle;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.Localizer;

/**
 * 3단계: 다국어 변환.
 *
 * <p>변환기가 없거나 실패하면 원본 콘텐츠로 단일 로케일(en) 묶음을 만듭니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class LocalizationPhase extends CapabilityPhase {

    public LocalizationPhase() {
        super(PhaseName.LOCALIZATION);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        Localizer localizer = capabilities.find(Capability.LOCALIZATION, Localizer.class).orElseThrow();
        LocalizedBundle bundle = Failures.requireResult(
            localizer.localize(context.content(), context.config().targetLocales()),
            "Localizer"
        );
        context.localized(bundle);
        return PhaseOutcome.completed(name(), "locales " + bundle.locales());
    }

    @Override
    protected String applyFallback(CycleContext context) {
        LocalizedBundle single = LocalizedBundle.single(FallbackArtifacts.DEFAULT_LOCALE, context.content());
        context.localized(single);
        return "single locale " + FallbackArtifacts.DEFAULT_LOCALE;
    }
}

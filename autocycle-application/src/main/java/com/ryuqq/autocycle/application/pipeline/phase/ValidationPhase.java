package com.ryuqq.autocycle.application.pipeline.phase;

import com.ryuqq.autocycle.application.pipeline.CapabilityPhase;
import com.ryuqq.autocycle.application.pipeline.CycleContext;
import com.ryuqq.autocycle.application.pipeline.Failures;
import com.ryuqq.autocycle.core.artifact.ValidationReport;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.spi.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 5단계: 품질 검증.
 *
 * <p>검증 불통과는 Phase 실패로 기록되지만 산출물은 그대로 다음 단계로 전달됩니다.
 * 불통과 산출물이 배포될 수 있다는 점은 알려진 위험입니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class ValidationPhase extends CapabilityPhase {

    private static final Logger log = LoggerFactory.getLogger(ValidationPhase.class);

    public ValidationPhase() {
        super(PhaseName.VALIDATION);
    }

    @Override
    protected PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) {
        Validator validator = capabilities.find(Capability.QUALITY_ASSURANCE, Validator.class).orElseThrow();
        ValidationReport report = Failures.requireResult(validator.validate(context.bundle()), "Validator");
        context.validation(report);

        String ref = "risk " + report.riskScore();
        if (report.passed()) {
            return PhaseOutcome.completed(name(), ref);
        }

        String message = report.issues().isEmpty()
            ? "validation failed (" + ref + ")"
            : "validation failed: " + String.join("; ", report.issues());
        log.warn("Content {} did not pass validation, continuing unvalidated: {}", context.content().name(), message);
        context.addError(CycleError.of(name(), message));
        return PhaseOutcome.failed(name(), message, ref);
    }

    @Override
    protected String applyFallback(CycleContext context) {
        context.validation(ValidationReport.uncheckedPass());
        return "not validated";
    }
}

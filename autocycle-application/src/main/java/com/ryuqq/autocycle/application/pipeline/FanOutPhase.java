package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;

import java.util.List;

/**
 * 대상 여러 개에 독립적으로 적용되는 Phase의 기반 클래스.
 *
 * <p>실패한 대상마다 CycleError 한 건이 추가되며, Phase 자체는
 * 모든 대상이 실패한 경우에만 실패로 기록됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public abstract class FanOutPhase extends CapabilityPhase {

    private final TargetFanOut fanOut;

    protected FanOutPhase(PhaseName name, TargetFanOut fanOut) {
        super(name);
        if (!name.isFanOut()) {
            throw new IllegalArgumentException(name + " is not a fan-out phase");
        }
        if (fanOut == null) {
            throw new IllegalArgumentException("fanOut cannot be null");
        }
        this.fanOut = fanOut;
    }

    protected final TargetFanOut fanOut() {
        return fanOut;
    }

    /**
     * 대상 결과를 Phase 결과로 집계.
     *
     * @param context 사이클 컨텍스트
     * @param targets 대상 결과 (등록 순서)
     * @param noun 산출물 설명에 사용할 명사 (예: "platforms")
     * @return Phase 결과
     */
    protected final PhaseOutcome aggregate(CycleContext context, List<TargetOutcome> targets, String noun) {
        int succeeded = 0;
        for (TargetOutcome target : targets) {
            if (target.success()) {
                succeeded++;
            } else {
                context.addError(CycleError.ofTarget(name(), target.target(), target.errorMessage()));
            }
        }

        String ref = succeeded + "/" + targets.size() + " " + noun;
        boolean allFailed = !targets.isEmpty() && succeeded == 0;
        String message = allFailed ? "all " + targets.size() + " " + noun + " failed" : null;
        return new PhaseOutcome(name(), !allFailed, false, message, ref, targets);
    }
}

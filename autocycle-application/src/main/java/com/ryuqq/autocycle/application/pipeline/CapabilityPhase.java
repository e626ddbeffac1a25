package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.PhaseName;
import com.ryuqq.autocycle.core.cycle.PhaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capability 하나에 대응하는 Phase의 기반 클래스.
 *
 * <p>Phase마다 두 가지 변형을 가집니다.</p>
 * <ul>
 *   <li>present: 협력자를 호출 ({@link #runPresent})</li>
 *   <li>absent: 결정적 기본 산출물을 기록 ({@link #applyFallback})</li>
 * </ul>
 *
 * <p><strong>처리 규칙:</strong></p>
 * <pre>
 * Capability 없음      → fallback 기록, success=true, skipped=true
 * 협력자 예외          → fallback 기록, success=false, CycleError 1건 추가
 * 협력자 정상 반환     → runPresent()가 만든 PhaseOutcome
 * </pre>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public abstract class CapabilityPhase {

    private static final Logger log = LoggerFactory.getLogger(CapabilityPhase.class);

    private final PhaseName name;

    protected CapabilityPhase(PhaseName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    public final PhaseName name() {
        return name;
    }

    /**
     * Phase 실행.
     *
     * <p>협력자 예외는 모두 이 메서드 안에서 PhaseOutcome으로 변환됩니다.</p>
     *
     * @param capabilities Capability 집합
     * @param context 사이클 컨텍스트
     * @return Phase 결과
     */
    public final PhaseOutcome execute(CapabilitySet capabilities, CycleContext context) {
        if (!capabilities.isPresent(name.requiredCapability())) {
            String ref = applyFallback(context);
            log.debug("Phase {} skipped (capability {} absent)", name, name.requiredCapability().key());
            return PhaseOutcome.fallback(name, ref);
        }

        try {
            return runPresent(capabilities, context);
        } catch (Exception e) {
            String message = Failures.describe(e);
            log.warn("Phase {} failed: {}", name, message, e);
            String ref = recoverFromFailure(context);
            context.addError(CycleError.of(name, message));
            return PhaseOutcome.failed(name, message, ref);
        }
    }

    /**
     * 협력자 호출.
     *
     * <p>구현은 성공 시 산출물을 컨텍스트에 기록하고, 협력자가 보고한 부분 실패
     * (검증 불통과, 대상 실패)는 직접 CycleError로 추가해야 합니다.</p>
     *
     * @param capabilities Capability 집합
     * @param context 사이클 컨텍스트
     * @return Phase 결과
     * @throws Exception 협력자 실패 시
     */
    protected abstract PhaseOutcome runPresent(CapabilitySet capabilities, CycleContext context) throws Exception;

    /**
     * 기본 산출물 기록.
     *
     * @param context 사이클 컨텍스트
     * @return 기본 산출물 설명
     */
    protected abstract String applyFallback(CycleContext context);

    /**
     * 협력자 실패 후 산출물 복구.
     *
     * <p>기본 구현은 {@link #applyFallback}과 같습니다.</p>
     *
     * @param context 사이클 컨텍스트
     * @return 산출물 설명
     */
    protected String recoverFromFailure(CycleContext context) {
        return applyFallback(context);
    }
}

package com.ryuqq.autocycle.core.cycle;

import java.util.List;

/**
 * Phase 실행 결과.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>skipped이면 success (Capability 부재는 오류가 아님)</li>
 *   <li>실패이면 errorMessage가 비어 있지 않음</li>
 *   <li>fan-out이 아닌 Phase는 targets가 비어 있음</li>
 * </ul>
 *
 * @param phase Phase 이름
 * @param success 성공 여부
 * @param skipped Capability 부재로 기본값을 사용했는지 여부
 * @param errorMessage 실패 시 오류 메시지 (성공 시 null)
 * @param artifactRef 생성된 산출물 요약 참조 (null 가능)
 * @param targets fan-out 대상별 결과 (등록 순서)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record PhaseOutcome(
    PhaseName phase,
    boolean success,
    boolean skipped,
    String errorMessage,
    String artifactRef,
    List<TargetOutcome> targets
) {

    public PhaseOutcome {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (skipped && !success) {
            throw new IllegalArgumentException("skipped phase must be successful (phase: " + phase + ")");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage is required for a failed phase (phase: " + phase + ")");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static PhaseOutcome completed(PhaseName phase, String artifactRef) {
        return new PhaseOutcome(phase, true, false, null, artifactRef, List.of());
    }

    public static PhaseOutcome fallback(PhaseName phase, String artifactRef) {
        return new PhaseOutcome(phase, true, true, null, artifactRef, List.of());
    }

    public static PhaseOutcome failed(PhaseName phase, String errorMessage, String artifactRef) {
        return new PhaseOutcome(phase, false, false, errorMessage, artifactRef, List.of());
    }

    /**
     * 성공한 대상 수.
     *
     * @return success=true인 TargetOutcome 수
     */
    public int succeededTargets() {
        int count = 0;
        for (TargetOutcome target : targets) {
            if (target.success()) {
                count++;
            }
        }
        return count;
    }
}

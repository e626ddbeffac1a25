package com.ryuqq.autocycle.core.cycle;

/**
 * 사이클 중 수집된 비치명적 오류.
 *
 * @param phase 오류가 발생한 Phase
 * @param target fan-out 대상 (Phase 단위 오류면 null)
 * @param message 오류 메시지
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CycleError(PhaseName phase, String target, String message) {

    public CycleError {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static CycleError of(PhaseName phase, String message) {
        return new CycleError(phase, null, message);
    }

    public static CycleError ofTarget(PhaseName phase, String target, String message) {
        return new CycleError(phase, target, message);
    }
}

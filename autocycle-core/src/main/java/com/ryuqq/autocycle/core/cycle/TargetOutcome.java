package com.ryuqq.autocycle.core.cycle;

/**
 * fan-out Phase 내 단일 대상(플랫폼, 채널)의 실행 결과.
 *
 * @param target 대상 이름
 * @param success 성공 여부
 * @param reference 성공 시 참조 (URL 등, null 가능)
 * @param errorMessage 실패 시 오류 메시지 (성공 시 null)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record TargetOutcome(String target, boolean success, String reference, String errorMessage) {

    public TargetOutcome {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage is required for a failed target (target: " + target + ")");
        }
    }

    public static TargetOutcome succeeded(String target, String reference) {
        return new TargetOutcome(target, true, reference, null);
    }

    public static TargetOutcome failed(String target, String errorMessage) {
        return new TargetOutcome(target, false, null, errorMessage);
    }
}

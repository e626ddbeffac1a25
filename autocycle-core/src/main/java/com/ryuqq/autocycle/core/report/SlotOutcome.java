package com.ryuqq.autocycle.core.report;

/**
 * 스케줄된 슬롯(재시도 포함 한 번의 사이클 호출)의 최종 결과.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum SlotOutcome {

    /**
     * 어느 한 시도가 오류 임계값 이하로 완료됨.
     */
    SUCCEEDED,

    /**
     * 최대 시도 횟수를 모두 소진함.
     */
    EXHAUSTED,

    /**
     * Cooldown 중 중지 요청으로 중단됨.
     */
    ABORTED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}

package com.ryuqq.autocycle.core.report;

import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.health.HealthSnapshot;

import java.time.Instant;

/**
 * 슬롯 하나에 대한 영속 리포트.
 *
 * <p>성공, 재시도 소진, 중단 여부와 관계없이 슬롯마다 새로 기록됩니다.</p>
 *
 * @param writtenAt 리포트 작성 시각
 * @param outcome 슬롯 결과
 * @param attempts 사용한 시도 횟수 (1 이상)
 * @param maxRetries 허용된 최대 시도 횟수
 * @param result 마지막 시도의 사이클 결과
 * @param health 슬롯 종료 시점의 헬스 스냅샷
 * @param totals 이 슬롯까지 반영된 누적 통계
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CycleReport(
    Instant writtenAt,
    SlotOutcome outcome,
    int attempts,
    int maxRetries,
    CycleResult result,
    HealthSnapshot health,
    RunTotals totals
) {

    public CycleReport {
        if (writtenAt == null) {
            throw new IllegalArgumentException("writtenAt cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        if (maxRetries < attempts) {
            throw new IllegalArgumentException(
                "maxRetries must be >= attempts (maxRetries: " + maxRetries + ", attempts: " + attempts + ")"
            );
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        if (totals == null) {
            throw new IllegalArgumentException("totals cannot be null");
        }
    }
}

package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.report.RunTotals;

import java.time.Instant;

/**
 * 사이클 실행 입력.
 *
 * <p>호출 간에 전달되는 유일한 입력입니다. 헬스 스냅샷과 누적 통계는 Supervisor가 소유합니다.</p>
 *
 * @param health 최근 헬스 스냅샷 (METRICS_FLUSH에 전달)
 * @param totals 직전 슬롯까지의 누적 통계
 * @param attempt 슬롯 내 시도 번호 (1부터)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CycleRequest(HealthSnapshot health, RunTotals totals, int attempt) {

    public CycleRequest {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        if (totals == null) {
            throw new IllegalArgumentException("totals cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    /**
     * 이전 실행 정보가 없는 첫 요청.
     *
     * @param now 현재 시각
     * @return CycleRequest
     */
    public static CycleRequest initial(Instant now) {
        return new CycleRequest(HealthSnapshot.initial(now), RunTotals.zero(), 1);
    }
}

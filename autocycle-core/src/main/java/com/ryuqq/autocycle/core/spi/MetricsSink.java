package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.health.HealthSnapshot;

/**
 * 메트릭 전송 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * 사이클 결과와 헬스 스냅샷 기록.
     *
     * @param health 최근 헬스 스냅샷
     * @param result 사이클 결과 (METRICS_FLUSH 직전까지의 Phase 포함)
     * @throws RuntimeException 전송 실패 시
     */
    void flush(HealthSnapshot health, CycleResult result);
}

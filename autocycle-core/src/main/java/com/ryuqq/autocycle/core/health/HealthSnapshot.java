package com.ryuqq.autocycle.core.health;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 시스템 상태 스냅샷.
 *
 * <p>HealthMonitor만 생성하며, 사이클마다 갱신되어 상태 파일을 통째로 교체합니다.</p>
 *
 * @param timestamp 샘플링 시각
 * @param uptime 프로세스(모니터) 가동 시간
 * @param gauges 자원 지표
 * @param cycleCount 누적 사이클 시도 수
 * @param errorCount 누적 오류 수 (리셋되지 않음)
 * @param status 판정된 상태
 * @param lastSuccessAt 마지막 성공 시각 (없으면 null)
 * @param lastError 마지막 오류 메시지 (없으면 null)
 * @param recentEvents 최근 이벤트 (크기 제한, 오래된 순)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record HealthSnapshot(
    Instant timestamp,
    Duration uptime,
    ResourceGauges gauges,
    long cycleCount,
    long errorCount,
    HealthStatus status,
    Instant lastSuccessAt,
    String lastError,
    List<HealthEvent> recentEvents
) {

    public HealthSnapshot {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (uptime == null || uptime.isNegative()) {
            throw new IllegalArgumentException("uptime cannot be null or negative");
        }
        if (gauges == null) {
            throw new IllegalArgumentException("gauges cannot be null");
        }
        if (cycleCount < 0 || errorCount < 0) {
            throw new IllegalArgumentException(
                "counters cannot be negative (cycleCount: " + cycleCount + ", errorCount: " + errorCount + ")"
            );
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        recentEvents = recentEvents == null ? List.of() : List.copyOf(recentEvents);
    }

    /**
     * 샘플이 한 번도 없을 때의 초기 스냅샷.
     *
     * @param now 현재 시각
     * @return 카운터 0, HEALTHY 상태의 스냅샷
     */
    public static HealthSnapshot initial(Instant now) {
        return new HealthSnapshot(now, Duration.ZERO, ResourceGauges.unavailable(), 0, 0,
            HealthStatus.HEALTHY, null, null, List.of());
    }
}

package com.ryuqq.autocycle.core.health;

/**
 * 자원 지표 샘플.
 *
 * <p>샘플링 백엔드를 사용할 수 없는 지표는 0.0으로 기록됩니다.</p>
 *
 * @param cpuLoadPercent 프로세서 부하 (%)
 * @param memoryPercent 메모리 사용률 (%)
 * @param diskPercent 디스크 사용률 (%)
 * @param networkReachable 외부 의존성 도달 가능 여부
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record ResourceGauges(double cpuLoadPercent, double memoryPercent, double diskPercent, boolean networkReachable) {

    private static final ResourceGauges UNAVAILABLE = new ResourceGauges(0.0, 0.0, 0.0, false);

    public ResourceGauges {
        cpuLoadPercent = sanitize(cpuLoadPercent);
        memoryPercent = sanitize(memoryPercent);
        diskPercent = sanitize(diskPercent);
    }

    /**
     * 모든 지표가 0이고 도달 불가인 샘플.
     *
     * @return ResourceGauges
     */
    public static ResourceGauges unavailable() {
        return UNAVAILABLE;
    }

    private static double sanitize(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 100.0);
    }
}

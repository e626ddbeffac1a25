package com.ryuqq.autocycle.core.health;

/**
 * 시스템 상태 (심각도 순서).
 *
 * <p>HEALTHY &lt; WARNING &lt; CRITICAL 순으로 심각하며,
 * 한 시점에는 정확히 하나의 상태만 성립합니다 (가장 심각한 상태 우선).</p>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>CRITICAL: 누적 오류 수가 critical 임계값 초과</li>
 *   <li>WARNING: 자원 지표 중 하나라도 경고 임계값 초과</li>
 *   <li>HEALTHY: 그 외</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum HealthStatus {

    /**
     * 정상.
     */
    HEALTHY,

    /**
     * 자원 사용량 경고.
     */
    WARNING,

    /**
     * 누적 오류 과다.
     */
    CRITICAL;

    /**
     * 다른 상태보다 심각한지 확인.
     *
     * @param other 비교 대상 (null이면 HEALTHY로 간주)
     * @return 더 심각하면 true
     */
    public boolean isMoreSevereThan(HealthStatus other) {
        return ordinal() > (other == null ? HEALTHY : other).ordinal();
    }

    /**
     * 두 상태 중 더 심각한 상태.
     *
     * @param a 상태 A
     * @param b 상태 B
     * @return 더 심각한 상태
     */
    public static HealthStatus mostSevere(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * 출력용 소문자 이름.
     *
     * @return "healthy", "warning", "critical"
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}

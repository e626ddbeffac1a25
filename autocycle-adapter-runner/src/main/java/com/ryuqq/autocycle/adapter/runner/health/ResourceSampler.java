package com.ryuqq.autocycle.adapter.runner.health;

/**
 * 호스트 자원 사용률 측정.
 *
 * <p>각 메서드는 0~100 범위의 백분율을 반환합니다. 측정 실패는 예외로 알리며,
 * HealthMonitor가 해당 값을 0.0으로 대체합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface ResourceSampler {

    double cpuLoadPercent() throws Exception;

    double memoryPercent() throws Exception;

    double diskPercent() throws Exception;
}

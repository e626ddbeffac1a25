/**
 * 헬스 모니터링 어댑터.
 *
 * <p>{@link com.ryuqq.autocycle.adapter.runner.health.HealthMonitor}가 자원 측정,
 * 누적 카운터, 알림을 담당합니다. 측정기와 네트워크 확인은 교체 가능한 인터페이스입니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.adapter.runner.health;

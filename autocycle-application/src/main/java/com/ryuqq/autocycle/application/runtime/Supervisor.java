package com.ryuqq.autocycle.application.runtime;

import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.statemachine.DaemonState;

/**
 * 사이클을 반복 실행하는 데몬 런타임.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * runForever() starts
 *   ↓
 * prepare storage (실패 시 치명적)
 *   ↓
 * while (!stopRequested):
 *   1. 슬롯 실행 (최대 maxRetries회 시도, 실패 시 cooldown)
 *   2. 시도마다 HealthMonitor 기록
 *   3. CycleReport + HealthSnapshot 저장
 *   4. cycleInterval 동안 대기 (중지 신호 확인)
 *   ↓
 * STOPPED
 * </pre>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>한 번에 슬롯 하나만 실행합니다.</li>
 *   <li>{@link #requestStop()}은 다른 스레드(종료 훅 등)에서 호출할 수 있습니다.</li>
 *   <li>진행 중인 Phase는 취소되지 않습니다. 중지는 루프 경계와 대기 중에만 반영됩니다.</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface Supervisor {

    /**
     * 중지 요청이 들어올 때까지 슬롯을 반복 실행.
     *
     * @throws com.ryuqq.autocycle.core.spi.PersistenceException 상태 저장 실패 시 (치명적)
     * @throws IllegalStateException 이미 시작된 경우
     */
    void runForever();

    /**
     * 슬롯 하나만 실행 (재시도 정책 적용) 후 종료.
     *
     * @return 기록된 슬롯 리포트
     * @throws com.ryuqq.autocycle.core.spi.PersistenceException 상태 저장 실패 시 (치명적)
     * @throws IllegalStateException 이미 시작된 경우
     */
    CycleReport runOnce();

    /**
     * 중지 요청 (비차단, 멱등).
     */
    void requestStop();

    /**
     * 현재 상태.
     *
     * @return Daemon 상태
     */
    DaemonState state();
}

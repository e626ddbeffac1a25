package com.ryuqq.autocycle.core.statemachine;

/**
 * Daemon Supervisor의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (저장소 준비 완료)
 * RUNNING ◄──────────────┐
 *    │                   │
 *    ├─► RETRYING ───────┤ (cooldown 경과)
 *    │                   │
 *    └─► SLEEPING ───────┘ (interval 경과)
 *
 * (IDLE | RUNNING | RETRYING | SLEEPING) ─► STOPPING ─► STOPPED
 * </pre>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum DaemonState {

    /**
     * 생성 직후 (아직 시작 안 됨).
     */
    IDLE,

    /**
     * 사이클 실행 중.
     */
    RUNNING,

    /**
     * 실패한 시도 후 cooldown 대기 중.
     */
    RETRYING,

    /**
     * 다음 슬롯까지 interval 대기 중.
     */
    SLEEPING,

    /**
     * 중지 요청 처리 중.
     */
    STOPPING,

    /**
     * 종료됨.
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }

    /**
     * 대기 상태(RETRYING, SLEEPING)인지 확인.
     *
     * @return 대기 중이면 true
     */
    public boolean isWaiting() {
        return this == RETRYING || this == SLEEPING;
    }
}

package com.ryuqq.autocycle.core.statemachine;

/**
 * Daemon 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → RUNNING, STOPPING</li>
 *   <li>RUNNING → RETRYING, SLEEPING, STOPPING</li>
 *   <li>RETRYING → RUNNING, STOPPING</li>
 *   <li>SLEEPING → RUNNING, STOPPING</li>
 *   <li>STOPPING → STOPPED</li>
 * </ul>
 *
 * <p>STOPPED에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class DaemonStateTransition {

    private DaemonStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(DaemonState from, DaemonState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IDLE -> to == DaemonState.RUNNING || to == DaemonState.STOPPING;
            case RUNNING -> to == DaemonState.RETRYING
                || to == DaemonState.SLEEPING
                || to == DaemonState.STOPPING;
            case RETRYING, SLEEPING -> to == DaemonState.RUNNING || to == DaemonState.STOPPING;
            case STOPPING -> to == DaemonState.STOPPED;
            case STOPPED -> false; // 종료 상태 (위에서 이미 거부)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static DaemonState transition(DaemonState current, DaemonState next) {
        validate(current, next);
        return next;
    }
}

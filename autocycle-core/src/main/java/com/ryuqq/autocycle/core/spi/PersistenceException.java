package com.ryuqq.autocycle.core.spi;

/**
 * 상태/리포트 저장 실패.
 *
 * <p>영속 상태를 기록하지 못하는 것은 치명적 오류로 분류되며,
 * DaemonSupervisor를 통해 프로세스 종료까지 전파됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

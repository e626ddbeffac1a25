package com.ryuqq.autocycle.daemon;

/**
 * 프로세스 종료 코드.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum ExitCode {

    /** 정상 종료 */
    SUCCESS(0),

    /** 명령은 수행했지만 결과가 실패 (run-once 슬롯 실패, 상태 파일 없음) */
    FAILURE(1),

    /** 알 수 없는 명령 */
    INVALID_ARGS(2),

    /** 치명적 오류 (저장소 실패, 설정 오류 등) */
    FATAL(3);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}

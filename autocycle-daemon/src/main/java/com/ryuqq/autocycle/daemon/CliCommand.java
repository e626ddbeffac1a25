package com.ryuqq.autocycle.daemon;

import java.util.Locale;
import java.util.Optional;

/**
 * 데몬 명령.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum CliCommand {

    /** 중지 요청까지 주기적으로 사이클 실행 (기본값) */
    RUN("run"),

    /** 슬롯 하나를 단일 시도로 실행하고 리포트 출력 */
    RUN_ONCE("run-once"),

    /** 저장된 상태 파일 출력 */
    STATUS("status"),

    /** 새로 측정한 헬스 스냅샷 출력 */
    HEALTH("health");

    public static final String USAGE = "usage: autocycle [run|run-once|status|health]";

    private final String token;

    CliCommand(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * 인자 배열에서 명령 해석.
     *
     * @param args 명령행 인자 (비어 있으면 RUN)
     * @return 명령, 알 수 없는 명령이면 empty
     */
    public static Optional<CliCommand> parse(String[] args) {
        if (args == null || args.length == 0) {
            return Optional.of(RUN);
        }
        String requested = args[0].trim().toLowerCase(Locale.ROOT);
        for (CliCommand command : values()) {
            if (command.token.equals(requested)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}

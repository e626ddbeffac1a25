package com.ryuqq.autocycle.application.pipeline;

/**
 * 예외를 결과 기록용 메시지로 변환.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class Failures {

    private Failures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 비어 있지 않은 오류 메시지 생성.
     *
     * <p>메시지가 비어 있으면 예외 클래스 이름을 사용합니다.</p>
     *
     * @param error 예외
     * @return 오류 메시지
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * 협력자가 null을 반환하지 않았는지 확인.
     *
     * @param value 협력자 반환값
     * @param collaborator 협력자 이름 (오류 메시지용)
     * @param <T> 반환 타입
     * @return value
     * @throws IllegalStateException value가 null인 경우
     */
    public static <T> T requireResult(T value, String collaborator) {
        if (value == null) {
            throw new IllegalStateException(collaborator + " returned null");
        }
        return value;
    }
}

package com.ryuqq.autocycle.adapter.runner;

import java.time.Instant;

/**
 * 슬롯 하나 안의 시도 상태.
 *
 * <p>슬롯이 성공하거나 소진되면 버려집니다.</p>
 *
 * @param attempt 현재 시도 번호 (1..maxRetries)
 * @param maxRetries 최대 시도 횟수
 * @param lastError 직전 시도의 실패 요약 (첫 시도면 null)
 * @param nextAttemptAt 현재 시도가 허용되는 시각 (첫 시도면 null)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record RetryState(int attempt, int maxRetries, String lastError, Instant nextAttemptAt) {

    public RetryState {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (attempt < 1 || attempt > maxRetries) {
            throw new IllegalArgumentException(
                "attempt must be between 1 and " + maxRetries + " (current: " + attempt + ")"
            );
        }
    }

    /**
     * 슬롯의 첫 시도.
     *
     * @param maxRetries 최대 시도 횟수
     * @return RetryState
     */
    public static RetryState first(int maxRetries) {
        return new RetryState(1, maxRetries, null, null);
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxRetries;
    }

    /**
     * 다음 시도로 진행.
     *
     * @param error 방금 실패한 시도의 요약
     * @param eligibleAt 다음 시도가 허용되는 시각
     * @return 다음 RetryState
     * @throws IllegalStateException 남은 시도가 없는 경우
     */
    public RetryState next(String error, Instant eligibleAt) {
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException("No attempts left (maxRetries: " + maxRetries + ")");
        }
        return new RetryState(attempt + 1, maxRetries, error, eligibleAt);
    }
}

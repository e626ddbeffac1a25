package com.ryuqq.autocycle.adapter.runner;

/**
 * 실패한 시도 후 재시도 전 대기 시간 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * multiplier^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, delay * jitterFactor)
 * </pre>
 *
 * <p>기본값은 고정 대기(multiplier=1.0, jitter 없음)이며 매 시도 후 baseDelay만큼 기다립니다.
 * {@link #exponential(long, long, double)}은 시도마다 두 배로 늘어나는 대기를 만듭니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public class RetryCooldown {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 대기 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
     * @param multiplier 시도마다 곱해지는 배수 (1.0 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryCooldown(long baseDelayMs, long maxDelayMs, double multiplier, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must not be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 고정 대기.
     *
     * @param delayMs 대기 시간 (밀리초)
     * @return 매 시도 후 같은 시간을 기다리는 RetryCooldown
     */
    public static RetryCooldown fixed(long delayMs) {
        return new RetryCooldown(delayMs, delayMs, 1.0, 0.0);
    }

    /**
     * 지수 증가 대기 (배수 2).
     *
     * @param baseDelayMs 첫 대기 시간
     * @param maxDelayMs 최대 대기 시간
     * @param jitterFactor Jitter 비율
     * @return RetryCooldown
     */
    public static RetryCooldown exponential(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return new RetryCooldown(baseDelayMs, maxDelayMs, 2.0, jitterFactor);
    }

    /**
     * 실패한 시도 이후의 대기 시간 계산.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public long calculate(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }

        double scaled = baseDelayMs * Math.pow(multiplier, failedAttempt - 1);
        long delay = (long) Math.min(scaled, maxDelayMs);

        long jitter = (long) (delay * jitterFactor * Math.random());
        return Math.min(delay + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}

package com.ryuqq.autocycle.adapter.runner;

/**
 * DaemonSupervisor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>cycleIntervalMs: 슬롯 사이 대기 시간 (기본 3600000ms = 1시간)</li>
 *   <li>maxRetries: 슬롯당 최대 시도 횟수 (기본 3)</li>
 *   <li>retryCooldownMs: 실패한 시도 후 대기 시간 (기본 300000ms = 5분)</li>
 *   <li>errorThreshold: 시도가 실패로 판정되는 오류 수 초과 기준 (기본 3)</li>
 *   <li>stopPollIntervalMs: 대기 중 중지 신호 확인 간격 (기본 1000ms)</li>
 * </ul>
 *
 * <p>시도는 {@code errors().size() > errorThreshold}일 때 실패입니다.</p>
 *
 * @param cycleIntervalMs 슬롯 간격 (밀리초, 양수)
 * @param maxRetries 최대 시도 횟수 (1 이상)
 * @param retryCooldownMs 재시도 대기 (밀리초, 0 이상)
 * @param errorThreshold 오류 임계값 (0 이상)
 * @param stopPollIntervalMs 중지 신호 확인 간격 (밀리초, 양수)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record SupervisorConfig(
    long cycleIntervalMs,
    int maxRetries,
    long retryCooldownMs,
    int errorThreshold,
    long stopPollIntervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: cycleIntervalMs=3600000, maxRetries=3, retryCooldownMs=300000,
     * errorThreshold=3, stopPollIntervalMs=1000</p>
     */
    public SupervisorConfig() {
        this(3600000, 3, 300000, 3, 1000);
    }

    public SupervisorConfig {
        if (cycleIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "cycleIntervalMs must be positive (current: " + cycleIntervalMs + ")"
            );
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException(
                "maxRetries must be positive (current: " + maxRetries + ")"
            );
        }
        if (retryCooldownMs < 0) {
            throw new IllegalArgumentException(
                "retryCooldownMs must not be negative (current: " + retryCooldownMs + ")"
            );
        }
        if (errorThreshold < 0) {
            throw new IllegalArgumentException(
                "errorThreshold must not be negative (current: " + errorThreshold + ")"
            );
        }
        if (stopPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "stopPollIntervalMs must be positive (current: " + stopPollIntervalMs + ")"
            );
        }
    }

    public SupervisorConfig withCycleIntervalMs(long cycleIntervalMs) {
        return new SupervisorConfig(cycleIntervalMs, maxRetries, retryCooldownMs, errorThreshold, stopPollIntervalMs);
    }

    public SupervisorConfig withMaxRetries(int maxRetries) {
        return new SupervisorConfig(cycleIntervalMs, maxRetries, retryCooldownMs, errorThreshold, stopPollIntervalMs);
    }

    public SupervisorConfig withRetryCooldownMs(long retryCooldownMs) {
        return new SupervisorConfig(cycleIntervalMs, maxRetries, retryCooldownMs, errorThreshold, stopPollIntervalMs);
    }

    public SupervisorConfig withErrorThreshold(int errorThreshold) {
        return new SupervisorConfig(cycleIntervalMs, maxRetries, retryCooldownMs, errorThreshold, stopPollIntervalMs);
    }

    public SupervisorConfig withStopPollIntervalMs(long stopPollIntervalMs) {
        return new SupervisorConfig(cycleIntervalMs, maxRetries, retryCooldownMs, errorThreshold, stopPollIntervalMs);
    }
}

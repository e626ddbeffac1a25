package com.ryuqq.autocycle.core.health;

import java.time.Instant;

/**
 * 상태 악화 알림.
 *
 * @param timestamp 발생 시각
 * @param previous 이전 상태
 * @param current 현재 상태
 * @param message 알림 메시지
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record Alert(Instant timestamp, HealthStatus previous, HealthStatus current, String message) {

    public Alert {
        if (timestamp == null || previous == null || current == null) {
            throw new IllegalArgumentException("timestamp, previous and current cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}

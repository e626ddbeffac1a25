package com.ryuqq.autocycle.core.health;

import java.time.Instant;

/**
 * 최근 이벤트 목록의 항목 (사이클 결과, 상태 변화).
 *
 * @param timestamp 발생 시각
 * @param type 이벤트 종류
 * @param message 설명
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record HealthEvent(Instant timestamp, Type type, String message) {

    public HealthEvent {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        message = message == null ? "" : message;
    }

    /**
     * 이벤트 종류.
     */
    public enum Type {
        CYCLE_SUCCEEDED,
        CYCLE_FAILED,
        STATUS_CHANGED
    }
}

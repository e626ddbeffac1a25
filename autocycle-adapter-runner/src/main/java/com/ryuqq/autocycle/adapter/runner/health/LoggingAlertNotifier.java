package com.ryuqq.autocycle.adapter.runner.health;

import com.ryuqq.autocycle.core.health.Alert;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.core.spi.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 알림을 로그로만 남기는 기본 AlertNotifier.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void send(Alert alert) {
        if (alert.current() == HealthStatus.CRITICAL) {
            log.error("[ALERT] health {} -> {}: {}", alert.previous().label(), alert.current().label(), alert.message());
        } else {
            log.warn("[ALERT] health {} -> {}: {}", alert.previous().label(), alert.current().label(), alert.message());
        }
    }
}

package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.health.Alert;

/**
 * 상태 악화 알림 전송 SPI.
 *
 * <p>Webhook, 메신저 등 구현은 어댑터에 위치합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface AlertNotifier {

    /**
     * 알림 전송.
     *
     * @param alert 알림
     * @throws RuntimeException 전송 실패 시 (호출자가 기록 후 무시)
     */
    void send(Alert alert);
}

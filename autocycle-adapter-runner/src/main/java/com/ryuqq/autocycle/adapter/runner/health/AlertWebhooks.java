package com.ryuqq.autocycle.adapter.runner.health;

import java.net.URI;
import java.time.Duration;

/**
 * 알림 Webhook 대상 설정 (불변 record).
 *
 * <p>URL이 하나도 없으면 알림은 로그로만 남습니다.</p>
 *
 * @param discordUrl Discord webhook URL (없으면 null)
 * @param slackUrl Slack webhook URL (없으면 null)
 * @param timeout 연결/요청 제한 시간 (기본 10초)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record AlertWebhooks(URI discordUrl, URI slackUrl, Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public AlertWebhooks() {
        this(null, null, DEFAULT_TIMEOUT);
    }

    public AlertWebhooks {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * Webhook이 하나도 설정되지 않았는지 확인.
     *
     * @return Discord, Slack 모두 없으면 true
     */
    public boolean isEmpty() {
        return discordUrl == null && slackUrl == null;
    }

    public AlertWebhooks withDiscordUrl(URI discordUrl) {
        return new AlertWebhooks(discordUrl, slackUrl, timeout);
    }

    public AlertWebhooks withSlackUrl(URI slackUrl) {
        return new AlertWebhooks(discordUrl, slackUrl, timeout);
    }

    public AlertWebhooks withTimeout(Duration timeout) {
        return new AlertWebhooks(discordUrl, slackUrl, timeout);
    }
}

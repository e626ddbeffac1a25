package com.ryuqq.autocycle.adapter.runner.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.autocycle.core.health.Alert;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.core.spi.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Discord/Slack webhook으로 알림을 전송하는 AlertNotifier.
 *
 * <p>모든 알림은 먼저 로그로 남긴 뒤, 설정된 webhook마다 한 번씩 POST합니다.
 * 한 대상의 실패가 다른 대상 전송을 막지 않으며, 실패한 대상이 있으면
 * 전송을 모두 시도한 후 예외를 던집니다 (HealthMonitor가 기록 후 무시).</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class WebhookAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertNotifier.class);

    static final String TITLE = "Autocycle Alert";

    private final AlertWebhooks webhooks;
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final AlertNotifier logging = new LoggingAlertNotifier();

    /**
     * 생성자.
     *
     * @param webhooks webhook 대상 (최소 하나)
     * @throws IllegalArgumentException webhooks가 null이거나 비어 있는 경우
     */
    public WebhookAlertNotifier(AlertWebhooks webhooks) {
        if (webhooks == null) {
            throw new IllegalArgumentException("webhooks cannot be null");
        }
        if (webhooks.isEmpty()) {
            throw new IllegalArgumentException("webhooks must configure at least one URL");
        }
        this.webhooks = webhooks;
        this.client = HttpClient.newBuilder()
            .connectTimeout(webhooks.timeout())
            .build();
        this.mapper = new ObjectMapper();
    }

    /**
     * 설정에 따라 AlertNotifier 선택.
     *
     * @param webhooks webhook 대상
     * @return URL이 없으면 LoggingAlertNotifier, 있으면 WebhookAlertNotifier
     */
    public static AlertNotifier forWebhooks(AlertWebhooks webhooks) {
        if (webhooks == null || webhooks.isEmpty()) {
            return new LoggingAlertNotifier();
        }
        return new WebhookAlertNotifier(webhooks);
    }

    @Override
    public void send(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("alert cannot be null");
        }
        logging.send(alert);

        List<String> failures = new ArrayList<>();
        if (webhooks.discordUrl() != null) {
            post("discord", webhooks.discordUrl(), discordBody(alert), failures);
        }
        if (webhooks.slackUrl() != null) {
            post("slack", webhooks.slackUrl(), slackBody(alert), failures);
        }
        if (!failures.isEmpty()) {
            throw new IllegalStateException("Alert delivery failed: " + String.join(", ", failures));
        }
    }

    private void post(String channel, URI url, ObjectNode body, List<String> failures) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(url)
                .header("Content-Type", "application/json")
                .timeout(webhooks.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + channel + " alert", e);
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                log.debug("Alert delivered to {} (HTTP {})", channel, status);
            } else {
                log.error("Failed to send {} alert: HTTP {}", channel, status);
                failures.add(channel + " (HTTP " + status + ")");
            }
        } catch (IOException e) {
            log.error("Failed to send {} alert: {}", channel, e.toString());
            failures.add(channel + " (" + e.getClass().getSimpleName() + ")");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures.add(channel + " (interrupted)");
        }
    }

    ObjectNode discordBody(Alert alert) {
        ObjectNode body = mapper.createObjectNode();
        body.put("content", headline(alert));

        ObjectNode embed = body.putArray("embeds").addObject();
        embed.put("title", TITLE);
        embed.put("description", alert.message());
        embed.put("color", color(alert.current()));
        embed.put("timestamp", alert.timestamp().toString());
        ArrayNode fields = embed.putArray("fields");
        fields.addObject().put("name", "Previous").put("value", alert.previous().label());
        fields.addObject().put("name", "Current").put("value", alert.current().label());
        return body;
    }

    ObjectNode slackBody(Alert alert) {
        ObjectNode body = mapper.createObjectNode();
        body.put("text", headline(alert));

        ObjectNode attachment = body.putArray("attachments").addObject();
        attachment.put("color", String.format(Locale.ROOT, "#%06X", color(alert.current())));
        ArrayNode fields = attachment.putArray("fields");
        fields.addObject().put("title", "Alert").put("value", alert.message());
        fields.addObject().put("title", "Previous").put("value", alert.previous().label()).put("short", true);
        fields.addObject().put("title", "Current").put("value", alert.current().label()).put("short", true);
        return body;
    }

    private static String headline(Alert alert) {
        return "[" + alert.current().name() + "] " + alert.message();
    }

    static int color(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> 0x00FF00;
            case WARNING -> 0xFFFF00;
            case CRITICAL -> 0xFF0000;
        };
    }
}

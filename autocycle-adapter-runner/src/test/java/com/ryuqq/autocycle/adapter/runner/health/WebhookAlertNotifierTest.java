package com.ryuqq.autocycle.adapter.runner.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.autocycle.core.health.Alert;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.testkit.fixture.CycleFixtures;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WebhookAlertNotifier 테스트 (로컬 HttpServer 대상).
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
class WebhookAlertNotifierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> received = new ConcurrentHashMap<>();

    private HttpServer server;
    private Alert alert;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/discord", exchange -> {
            received.put("discord", readBody(exchange.getRequestBody()));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/slack", exchange -> {
            received.put("slack", readBody(exchange.getRequestBody()));
            byte[] ok = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, ok.length);
            exchange.getResponseBody().write(ok);
            exchange.close();
        });
        server.createContext("/broken", exchange -> {
            received.put("broken", readBody(exchange.getRequestBody()));
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();

        alert = new Alert(CycleFixtures.BASE_TIME, HealthStatus.HEALTHY, HealthStatus.CRITICAL,
            "errors 11 exceed 10");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private URI url(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    private static String readBody(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Test
    void send_Discord와_Slack에_각각_한번씩_POST() throws Exception {
        WebhookAlertNotifier notifier = new WebhookAlertNotifier(
            new AlertWebhooks(url("/discord"), url("/slack"), Duration.ofSeconds(2)));

        notifier.send(alert);

        JsonNode discord = mapper.readTree(received.get("discord"));
        assertThat(discord.get("content").asText()).isEqualTo("[CRITICAL] errors 11 exceed 10");
        JsonNode embed = discord.get("embeds").get(0);
        assertThat(embed.get("title").asText()).isEqualTo(WebhookAlertNotifier.TITLE);
        assertThat(embed.get("color").asInt()).isEqualTo(0xFF0000);
        assertThat(embed.get("fields").get(0).get("value").asText()).isEqualTo("healthy");
        assertThat(embed.get("fields").get(1).get("value").asText()).isEqualTo("critical");

        JsonNode slack = mapper.readTree(received.get("slack"));
        assertThat(slack.get("text").asText()).isEqualTo("[CRITICAL] errors 11 exceed 10");
        JsonNode attachment = slack.get("attachments").get(0);
        assertThat(attachment.get("color").asText()).isEqualTo("#FF0000");
        assertThat(attachment.get("fields").get(0).get("value").asText()).isEqualTo("errors 11 exceed 10");
    }

    @Test
    void send_한_대상이_실패해도_나머지는_전송_후_예외() {
        WebhookAlertNotifier notifier = new WebhookAlertNotifier(
            new AlertWebhooks(url("/broken"), url("/slack"), Duration.ofSeconds(2)));

        assertThatThrownBy(() -> notifier.send(alert))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("discord (HTTP 500)");
        assertThat(received).containsKeys("broken", "slack");
    }

    @Test
    void send_연결할_수_없으면_예외() {
        WebhookAlertNotifier notifier = new WebhookAlertNotifier(
            new AlertWebhooks(URI.create("http://127.0.0.1:9/hook"), null, Duration.ofMillis(500)));

        assertThatThrownBy(() -> notifier.send(alert))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("Alert delivery failed: discord");
    }

    @Test
    void HealthMonitor_악화_시_webhook으로_알림_전달() {
        HealthMonitor monitor = new HealthMonitor(new StubResourceSampler(10, 20, 30), () -> true,
            new WebhookAlertNotifier(new AlertWebhooks().withSlackUrl(url("/slack"))),
            new HealthThresholds().withCriticalErrorCount(0),
            new MutableClock(CycleFixtures.BASE_TIME));

        monitor.recordCycleOutcome(false, "publish failed");
        monitor.sample();

        assertThat(received).containsOnlyKeys("slack");
        assertThat(received.get("slack")).contains("[CRITICAL]");
    }

    @Test
    void forWebhooks_URL이_없으면_로그_전용_notifier() {
        assertThat(WebhookAlertNotifier.forWebhooks(new AlertWebhooks()))
            .isInstanceOf(LoggingAlertNotifier.class);
        assertThat(WebhookAlertNotifier.forWebhooks(new AlertWebhooks().withDiscordUrl(url("/discord"))))
            .isInstanceOf(WebhookAlertNotifier.class);
    }

    @Test
    void 생성자_URL이_없으면_예외() {
        assertThatThrownBy(() -> new WebhookAlertNotifier(new AlertWebhooks()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AlertWebhooks(null, null, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void color_상태별_색상() {
        assertThat(WebhookAlertNotifier.color(HealthStatus.HEALTHY)).isEqualTo(0x00FF00);
        assertThat(WebhookAlertNotifier.color(HealthStatus.WARNING)).isEqualTo(0xFFFF00);
    }
}

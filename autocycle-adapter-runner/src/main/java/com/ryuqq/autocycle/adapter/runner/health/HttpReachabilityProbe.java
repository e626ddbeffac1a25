package com.ryuqq.autocycle.adapter.runner.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP HEAD 요청으로 외부 도달 가능 여부 확인.
 *
 * <p>응답 코드와 관계없이 응답을 받으면 도달 가능으로 판단합니다.
 * 연결과 요청 모두 같은 타임아웃(기본 5초)을 가집니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class HttpReachabilityProbe implements ReachabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpReachabilityProbe.class);

    public static final URI DEFAULT_TARGET = URI.create("https://api.openai.com");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient client;
    private final URI target;
    private final Duration timeout;

    public HttpReachabilityProbe() {
        this(DEFAULT_TARGET, DEFAULT_TIMEOUT);
    }

    public HttpReachabilityProbe(URI target, Duration timeout) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.target = target;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    public boolean isReachable() {
        HttpRequest request = HttpRequest.newBuilder(target)
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .timeout(timeout)
            .build();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            log.debug("Reachability probe {} answered {}", target, response.statusCode());
            return true;
        } catch (IOException e) {
            log.debug("Reachability probe {} failed: {}", target, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.ryuqq.autocycle.daemon;

import com.ryuqq.autocycle.adapter.runner.SupervisorConfig;
import com.ryuqq.autocycle.adapter.runner.health.AlertWebhooks;
import com.ryuqq.autocycle.adapter.runner.health.HealthMonitor;
import com.ryuqq.autocycle.adapter.runner.health.HealthThresholds;
import com.ryuqq.autocycle.adapter.runner.health.HttpReachabilityProbe;
import com.ryuqq.autocycle.application.pipeline.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 데몬 설정.
 *
 * <p><strong>로딩 순서 (나중 값이 우선):</strong></p>
 * <ol>
 *   <li>클래스패스 {@code autocycle.properties}</li>
 *   <li>{@code -Dautocycle.config=<path>} 외부 파일</li>
 *   <li>{@code autocycle.*} 시스템 프로퍼티</li>
 * </ol>
 *
 * <p>지정되지 않은 키는 각 설정 record의 기본값을 사용합니다.</p>
 *
 * @param dataDirectory 상태/리포트 디렉토리
 * @param supervisor Supervisor 설정
 * @param pipeline 파이프라인 설정
 * @param thresholds 헬스 임계값
 * @param probeTarget 네트워크 도달 확인 대상
 * @param probeTimeout 네트워크 도달 확인 제한 시간
 * @param recentEventLimit 스냅샷에 보관할 최근 이벤트 수
 * @param shutdownWaitMs 종료 훅이 STOPPED를 기다리는 최대 시간
 * @param alerts 알림 webhook 대상 (없으면 로그 전용)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record DaemonProperties(
    Path dataDirectory,
    SupervisorConfig supervisor,
    PipelineConfig pipeline,
    HealthThresholds thresholds,
    URI probeTarget,
    Duration probeTimeout,
    int recentEventLimit,
    long shutdownWaitMs,
    AlertWebhooks alerts
) {

    private static final Logger log = LoggerFactory.getLogger(DaemonProperties.class);

    public static final String PREFIX = "autocycle.";
    public static final String CONFIG_FILE_PROPERTY = "autocycle.config";
    public static final String CLASSPATH_RESOURCE = "autocycle.properties";

    public DaemonProperties {
        if (dataDirectory == null) {
            throw new IllegalArgumentException("dataDirectory cannot be null");
        }
        if (supervisor == null) {
            throw new IllegalArgumentException("supervisor cannot be null");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (probeTarget == null) {
            throw new IllegalArgumentException("probeTarget cannot be null");
        }
        if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be positive (current: " + probeTimeout + ")");
        }
        if (recentEventLimit <= 0) {
            throw new IllegalArgumentException("recentEventLimit must be positive (current: " + recentEventLimit + ")");
        }
        if (shutdownWaitMs <= 0) {
            throw new IllegalArgumentException("shutdownWaitMs must be positive (current: " + shutdownWaitMs + ")");
        }
        if (alerts == null) {
            throw new IllegalArgumentException("alerts cannot be null");
        }
    }

    /**
     * 기본 설정 (./data, 각 record 기본값).
     */
    public DaemonProperties() {
        this(Paths.get("data"), new SupervisorConfig(), new PipelineConfig(), new HealthThresholds(),
            HttpReachabilityProbe.DEFAULT_TARGET, HttpReachabilityProbe.DEFAULT_TIMEOUT,
            HealthMonitor.DEFAULT_RECENT_EVENTS, 30000);
    }

    /**
     * 알림 webhook 없는 설정.
     */
    public DaemonProperties(Path dataDirectory, SupervisorConfig supervisor, PipelineConfig pipeline,
                            HealthThresholds thresholds, URI probeTarget, Duration probeTimeout,
                            int recentEventLimit, long shutdownWaitMs) {
        this(dataDirectory, supervisor, pipeline, thresholds, probeTarget, probeTimeout, recentEventLimit,
            shutdownWaitMs, new AlertWebhooks());
    }

    public DaemonProperties withDataDirectory(Path dataDirectory) {
        return new DaemonProperties(dataDirectory, supervisor, pipeline, thresholds, probeTarget, probeTimeout,
            recentEventLimit, shutdownWaitMs, alerts);
    }

    public DaemonProperties withAlerts(AlertWebhooks alerts) {
        return new DaemonProperties(dataDirectory, supervisor, pipeline, thresholds, probeTarget, probeTimeout,
            recentEventLimit, shutdownWaitMs, alerts);
    }

    public DaemonProperties withSupervisor(SupervisorConfig supervisor) {
        return new DaemonProperties(dataDirectory, supervisor, pipeline, thresholds, probeTarget, probeTimeout,
            recentEventLimit, shutdownWaitMs, alerts);
    }

    /**
     * 클래스패스, 외부 파일, 시스템 프로퍼티를 차례로 병합해 로딩.
     *
     * @return 설정
     * @throws UncheckedIOException 설정 파일을 읽을 수 없는 경우
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static DaemonProperties load() {
        Properties merged = new Properties();

        try (InputStream in = DaemonProperties.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath " + CLASSPATH_RESOURCE, e);
        }

        String external = System.getProperty(CONFIG_FILE_PROPERTY);
        if (external != null && !external.isBlank()) {
            Path file = Paths.get(external);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                merged.load(reader);
                log.info("Loaded configuration overrides from {}", file.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read configuration file " + file, e);
            }
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX) && !name.equals(CONFIG_FILE_PROPERTY)) {
                merged.setProperty(name, System.getProperty(name));
            }
        }
        return from(merged);
    }

    /**
     * 프로퍼티에서 설정 생성.
     *
     * @param properties {@code autocycle.*} 키를 가진 프로퍼티
     * @return 설정
     * @throws IllegalArgumentException 값 형식이 잘못되었거나 범위를 벗어난 경우
     */
    public static DaemonProperties from(Properties properties) {
        DaemonProperties defaults = new DaemonProperties();
        Values values = new Values(properties);

        SupervisorConfig supervisorDefaults = defaults.supervisor();
        SupervisorConfig supervisor = new SupervisorConfig(
            values.longValue("cycle-interval-ms", supervisorDefaults.cycleIntervalMs()),
            values.intValue("max-retries", supervisorDefaults.maxRetries()),
            values.longValue("retry-cooldown-ms", supervisorDefaults.retryCooldownMs()),
            values.intValue("error-threshold", supervisorDefaults.errorThreshold()),
            values.longValue("stop-poll-interval-ms", supervisorDefaults.stopPollIntervalMs())
        );

        PipelineConfig pipelineDefaults = defaults.pipeline();
        PipelineConfig pipeline = new PipelineConfig(
            values.listValue("target-locales", pipelineDefaults.targetLocales()),
            values.longValue("target-timeout-ms", pipelineDefaults.targetTimeoutMs()),
            values.intValue("fanout-concurrency", pipelineDefaults.fanOutConcurrency()),
            values.stringValue("audience", pipelineDefaults.audience()),
            values.stringValue("default-category", pipelineDefaults.defaultCategory())
        );

        HealthThresholds thresholdDefaults = defaults.thresholds();
        HealthThresholds thresholds = new HealthThresholds(
            values.doubleValue("health.cpu-warning-percent", thresholdDefaults.cpuWarningPercent()),
            values.doubleValue("health.memory-warning-percent", thresholdDefaults.memoryWarningPercent()),
            values.doubleValue("health.disk-warning-percent", thresholdDefaults.diskWarningPercent()),
            values.longValue("health.critical-error-count", thresholdDefaults.criticalErrorCount())
        );

        return new DaemonProperties(
            Paths.get(values.stringValue("data-dir", defaults.dataDirectory().toString())),
            supervisor,
            pipeline,
            thresholds,
            URI.create(values.stringValue("health.probe-url", defaults.probeTarget().toString())),
            Duration.ofMillis(values.longValue("health.probe-timeout-ms", defaults.probeTimeout().toMillis())),
            values.intValue("health.recent-events", defaults.recentEventLimit()),
            values.longValue("shutdown-wait-ms", defaults.shutdownWaitMs()),
            new AlertWebhooks(
                values.uriValue("alert.discord-url"),
                values.uriValue("alert.slack-url"),
                Duration.ofMillis(values.longValue("alert.timeout-ms", defaults.alerts().timeout().toMillis()))
            )
        );
    }

    /**
     * {@code autocycle.} 접두사 키 조회와 형변환.
     */
    private static final class Values {

        private final Properties properties;

        Values(Properties properties) {
            if (properties == null) {
                throw new IllegalArgumentException("properties cannot be null");
            }
            this.properties = properties;
        }

        String stringValue(String key, String fallback) {
            String value = properties.getProperty(PREFIX + key);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        long longValue(String key, long fallback) {
            String value = stringValue(key, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PREFIX + key + " must be a number (current: " + value + ")", e);
            }
        }

        int intValue(String key, int fallback) {
            long value = longValue(key, fallback);
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(PREFIX + key + " is out of range (current: " + value + ")");
            }
            return (int) value;
        }

        double doubleValue(String key, double fallback) {
            String value = stringValue(key, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PREFIX + key + " must be a number (current: " + value + ")", e);
            }
        }

        URI uriValue(String key) {
            String value = stringValue(key, null);
            if (value == null) {
                return null;
            }
            try {
                URI uri = new URI(value);
                if (!uri.isAbsolute()) {
                    throw new IllegalArgumentException(PREFIX + key + " must be an absolute URL (current: " + value + ")");
                }
                return uri;
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException(PREFIX + key + " must be a URL (current: " + value + ")", e);
            }
        }

        List<String> listValue(String key, List<String> fallback) {
            String value = stringValue(key, null);
            if (value == null) {
                return fallback;
            }
            List<String> items = new ArrayList<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
            return items.isEmpty() ? fallback : items;
        }
    }
}

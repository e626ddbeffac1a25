package com.ryuqq.autocycle.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.autocycle.adapter.file.JsonFileReportStore;
import com.ryuqq.autocycle.adapter.file.JsonFileStatusStore;
import com.ryuqq.autocycle.adapter.file.JsonMappers;
import com.ryuqq.autocycle.adapter.runner.DaemonSupervisor;
import com.ryuqq.autocycle.adapter.runner.RetryCooldown;
import com.ryuqq.autocycle.adapter.runner.Sleeper;
import com.ryuqq.autocycle.adapter.runner.SupervisorConfig;
import com.ryuqq.autocycle.adapter.runner.health.HealthMonitor;
import com.ryuqq.autocycle.adapter.runner.health.HttpReachabilityProbe;
import com.ryuqq.autocycle.adapter.runner.health.JvmResourceSampler;
import com.ryuqq.autocycle.adapter.runner.health.WebhookAlertNotifier;
import com.ryuqq.autocycle.application.capability.CapabilityRegistry;
import com.ryuqq.autocycle.application.pipeline.PipelineExecutor;
import com.ryuqq.autocycle.core.capability.Capability;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 설정에 따라 데몬 구성 요소를 연결.
 *
 * <p>Capability는 생성 시 ServiceLoader로 한 번만 해석됩니다.
 * 파이프라인 워커 풀과 METRICS 협력자를 소유하므로 사용 후 {@link #close()}해야 합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class DaemonAssembly implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DaemonAssembly.class);

    private final DaemonProperties properties;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final JsonFileStatusStore statusStore;
    private final JsonFileReportStore reportStore;
    private final HealthMonitor monitor;
    private final CapabilitySet capabilities;
    private final PipelineExecutor executor;

    public DaemonAssembly(DaemonProperties properties) {
        this(properties, CapabilityRegistry.fromServiceLoader(DaemonAssembly.class.getClassLoader()).build(),
            Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param properties 데몬 설정
     * @param capabilities 사용할 Capability 집합
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DaemonAssembly(DaemonProperties properties, CapabilitySet capabilities, Clock clock) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.properties = properties;
        this.clock = clock;
        this.capabilities = capabilities;
        this.mapper = JsonMappers.create();
        this.statusStore = new JsonFileStatusStore(properties.dataDirectory(), mapper);
        this.reportStore = new JsonFileReportStore(properties.dataDirectory(), mapper);
        this.monitor = new HealthMonitor(
            new JvmResourceSampler(properties.dataDirectory()),
            new HttpReachabilityProbe(properties.probeTarget(), properties.probeTimeout()),
            WebhookAlertNotifier.forWebhooks(properties.alerts()),
            properties.thresholds(),
            clock,
            properties.recentEventLimit()
        );
        this.executor = new PipelineExecutor(properties.pipeline(), clock);
    }

    /**
     * Supervisor 생성.
     *
     * @param config Supervisor 설정 (run-once는 maxRetries=1)
     * @return DaemonSupervisor
     */
    public DaemonSupervisor supervisor(SupervisorConfig config) {
        return new DaemonSupervisor(executor, capabilities, monitor, statusStore, reportStore, config,
            RetryCooldown.fixed(config.retryCooldownMs()), Sleeper.SYSTEM, clock);
    }

    public DaemonProperties properties() {
        return properties;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonFileStatusStore statusStore() {
        return statusStore;
    }

    public JsonFileReportStore reportStore() {
        return reportStore;
    }

    public HealthMonitor monitor() {
        return monitor;
    }

    public CapabilitySet capabilities() {
        return capabilities;
    }

    @Override
    public void close() {
        executor.close();
        for (Object metrics : capabilities.all(Capability.METRICS, Object.class)) {
            if (metrics instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) metrics).close();
                } catch (Exception e) {
                    log.warn("Failed to close metrics collaborator {}: {}", metrics.getClass().getSimpleName(), e.toString());
                }
            }
        }
    }
}

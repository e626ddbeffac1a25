package com.ryuqq.autocycle.adapter.runner.health;

import com.ryuqq.autocycle.core.health.Alert;
import com.ryuqq.autocycle.core.health.HealthEvent;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.core.health.ResourceGauges;
import com.ryuqq.autocycle.core.spi.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * 누적 헬스 상태 추적기.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>자원 사용률과 네트워크 도달 여부 측정 ({@link #sample()})</li>
 *   <li>시도 결과 누적 ({@link #recordCycleOutcome(boolean, String)})</li>
 *   <li>상태가 이전 측정보다 나빠지면 알림 전송</li>
 * </ul>
 *
 * <p><strong>누적 규칙:</strong></p>
 * <ul>
 *   <li>cycleCount는 시도마다, errorCount는 실패한 시도마다 증가합니다.</li>
 *   <li>카운터는 프로세스 수명 동안 초기화되지 않습니다.</li>
 *   <li>따라서 한 번의 나쁜 사이클은 곧바로 CRITICAL이 되지 않습니다.</li>
 * </ul>
 *
 * <p>네트워크 도달 여부는 스냅샷에 기록되지만 상태 판정에는 사용되지 않습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final int DEFAULT_RECENT_EVENTS = 20;

    private final ResourceSampler sampler;
    private final ReachabilityProbe probe;
    private final AlertNotifier notifier;
    private final HealthThresholds thresholds;
    private final Clock clock;
    private final int recentEventLimit;
    private final Instant startedAt;

    private final Deque<HealthEvent> recentEvents = new ArrayDeque<>();
    private long cycleCount;
    private long errorCount;
    private Instant lastSuccessAt;
    private String lastError;
    private HealthStatus lastStatus = HealthStatus.HEALTHY;
    private HealthSnapshot latest;

    /**
     * 생성자 (최근 이벤트 20건).
     */
    public HealthMonitor(ResourceSampler sampler, ReachabilityProbe probe, AlertNotifier notifier,
                         HealthThresholds thresholds, Clock clock) {
        this(sampler, probe, notifier, thresholds, clock, DEFAULT_RECENT_EVENTS);
    }

    /**
     * 생성자.
     *
     * @param sampler 자원 측정기
     * @param probe 네트워크 도달 확인
     * @param notifier 알림 전송
     * @param thresholds 상태 판정 임계값
     * @param clock 시계
     * @param recentEventLimit 보관할 최근 이벤트 수 (1 이상)
     * @throws IllegalArgumentException 인자가 null이거나 recentEventLimit이 양수가 아닌 경우
     */
    public HealthMonitor(ResourceSampler sampler, ReachabilityProbe probe, AlertNotifier notifier,
                         HealthThresholds thresholds, Clock clock, int recentEventLimit) {
        if (sampler == null) {
            throw new IllegalArgumentException("sampler cannot be null");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (recentEventLimit <= 0) {
            throw new IllegalArgumentException("recentEventLimit must be positive (current: " + recentEventLimit + ")");
        }
        this.sampler = sampler;
        this.probe = probe;
        this.notifier = notifier;
        this.thresholds = thresholds;
        this.clock = clock;
        this.recentEventLimit = recentEventLimit;
        this.startedAt = clock.instant();
        this.latest = HealthSnapshot.initial(startedAt);
    }

    /**
     * 현재 헬스 스냅샷 측정.
     *
     * <p>측정에 실패한 게이지는 0.0, 네트워크 확인 실패는 false로 기록됩니다.
     * 상태가 직전 측정보다 심각해지면 알림을 전송합니다.</p>
     *
     * @return 헬스 스냅샷
     */
    public synchronized HealthSnapshot sample() {
        Instant now = clock.instant();
        ResourceGauges gauges = new ResourceGauges(
            measure("cpu", Gauge.CPU),
            measure("memory", Gauge.MEMORY),
            measure("disk", Gauge.DISK),
            reachable()
        );
        HealthStatus status = evaluate(gauges, errorCount);

        if (status != lastStatus) {
            String message = describeChange(gauges, status);
            addEvent(new HealthEvent(now, HealthEvent.Type.STATUS_CHANGED, message));
            if (status.isMoreSevereThan(lastStatus)) {
                sendAlert(new Alert(now, lastStatus, status, message));
            } else {
                log.info("Health recovered {} -> {}", lastStatus.label(), status.label());
            }
            lastStatus = status;
        }

        latest = new HealthSnapshot(
            now,
            uptime(now),
            gauges,
            cycleCount,
            errorCount,
            status,
            lastSuccessAt,
            lastError,
            List.copyOf(recentEvents)
        );
        return latest;
    }

    /**
     * 시도 결과 기록.
     *
     * @param success 성공 여부
     * @param message 결과 요약 (실패 시 lastError로 기록)
     */
    public synchronized void recordCycleOutcome(boolean success, String message) {
        Instant now = clock.instant();
        cycleCount++;
        if (success) {
            lastSuccessAt = now;
            addEvent(new HealthEvent(now, HealthEvent.Type.CYCLE_SUCCEEDED, message));
        } else {
            errorCount++;
            lastError = message == null || message.isBlank() ? "cycle failed" : message;
            addEvent(new HealthEvent(now, HealthEvent.Type.CYCLE_FAILED, lastError));
            log.warn("Cycle failure recorded ({} of {} attempts failed): {}", errorCount, cycleCount, lastError);
        }
    }

    /**
     * 저장된 스냅샷으로 누적 카운터 복원.
     *
     * <p>{@code health} 명령이 마지막 데몬 실행의 누적 추세를 보고할 때 사용합니다.</p>
     *
     * @param snapshot 저장된 스냅샷
     */
    public synchronized void restore(HealthSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        cycleCount = snapshot.cycleCount();
        errorCount = snapshot.errorCount();
        lastSuccessAt = snapshot.lastSuccessAt();
        lastError = snapshot.lastError();
        lastStatus = snapshot.status();
        recentEvents.clear();
        for (HealthEvent event : snapshot.recentEvents()) {
            addEvent(event);
        }
        latest = snapshot;
    }

    /**
     * 마지막으로 측정한 스냅샷 (측정 전이면 초기 스냅샷).
     *
     * @return 헬스 스냅샷
     */
    public synchronized HealthSnapshot latest() {
        return latest;
    }

    /**
     * 상태 판정.
     *
     * @param gauges 자원 사용률
     * @param errors 누적 오류 수
     * @return 헬스 상태
     */
    HealthStatus evaluate(ResourceGauges gauges, long errors) {
        if (errors > thresholds.criticalErrorCount()) {
            return HealthStatus.CRITICAL;
        }
        if (gauges.cpuLoadPercent() > thresholds.cpuWarningPercent()
            || gauges.memoryPercent() > thresholds.memoryWarningPercent()
            || gauges.diskPercent() > thresholds.diskWarningPercent()) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    private String describeChange(ResourceGauges gauges, HealthStatus status) {
        return String.format(Locale.ROOT, "status %s (errors %d/%d cycles, cpu %.1f%%, memory %.1f%%, disk %.1f%%)",
            status.label(), errorCount, cycleCount,
            gauges.cpuLoadPercent(), gauges.memoryPercent(), gauges.diskPercent());
    }

    private void sendAlert(Alert alert) {
        try {
            notifier.send(alert);
        } catch (RuntimeException e) {
            log.warn("Alert notifier {} failed, alert dropped: {}", notifier.getClass().getSimpleName(), e.toString());
        }
    }

    private double measure(String name, Gauge gauge) {
        try {
            return switch (gauge) {
                case CPU -> sampler.cpuLoadPercent();
                case MEMORY -> sampler.memoryPercent();
                case DISK -> sampler.diskPercent();
            };
        } catch (Exception e) {
            log.debug("Resource gauge {} unavailable: {}", name, e.toString());
            return 0.0;
        }
    }

    private boolean reachable() {
        try {
            return probe.isReachable();
        } catch (RuntimeException e) {
            log.debug("Reachability probe failed: {}", e.toString());
            return false;
        }
    }

    private void addEvent(HealthEvent event) {
        recentEvents.addLast(event);
        while (recentEvents.size() > recentEventLimit) {
            recentEvents.removeFirst();
        }
    }

    private Duration uptime(Instant now) {
        Duration uptime = Duration.between(startedAt, now);
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    private enum Gauge {
        CPU,
        MEMORY,
        DISK
    }
}

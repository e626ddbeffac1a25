package com.ryuqq.autocycle.adapter.runner;

import com.ryuqq.autocycle.adapter.runner.health.HealthMonitor;
import com.ryuqq.autocycle.application.pipeline.CycleRequest;
import com.ryuqq.autocycle.application.pipeline.CycleRunner;
import com.ryuqq.autocycle.application.runtime.Supervisor;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleError;
import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.report.SlotOutcome;
import com.ryuqq.autocycle.core.spi.ReportStore;
import com.ryuqq.autocycle.core.spi.StatusStore;
import com.ryuqq.autocycle.core.statemachine.DaemonState;
import com.ryuqq.autocycle.core.statemachine.DaemonStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Daemon Supervisor 구현체.
 *
 * <p><strong>슬롯 처리 흐름:</strong></p>
 * <pre>
 * attempt = 1
 * loop:
 *   result = runner.runCycle(capabilities, request)
 *   monitor.recordCycleOutcome(errors &lt;= threshold, summary)
 *   성공                → SUCCEEDED
 *   실패 + 시도 소진     → EXHAUSTED
 *   실패 + 시도 남음     → statusStore.write(monitor.sample()), RETRYING, cooldown 대기, attempt++
 *   cooldown 중 중지 요청 → ABORTED
 * reportStore.write(report), statusStore.write(snapshot)
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>재시도 소진은 치명적이지 않습니다. 다음 슬롯이 interval 후 실행됩니다.</li>
 *   <li>저장소 준비/기록 실패({@code PersistenceException})는 치명적이며 호출자에게 전파됩니다.</li>
 * </ul>
 *
 * <p><strong>중지:</strong> {@link #requestStop()} 이후 대기(cooldown, interval)는
 * stopPollIntervalMs 이내에 끝납니다. 진행 중인 사이클은 취소되지 않습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class DaemonSupervisor implements Supervisor {

    private static final Logger log = LoggerFactory.getLogger(DaemonSupervisor.class);

    private final CycleRunner runner;
    private final CapabilitySet capabilities;
    private final HealthMonitor monitor;
    private final StatusStore statusStore;
    private final ReportStore reportStore;
    private final SupervisorConfig config;
    private final RetryCooldown cooldown;
    private final Sleeper sleeper;
    private final Clock clock;

    private final StopSignal stopSignal = new StopSignal();
    private final RunStatistics statistics = new RunStatistics();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile DaemonState state = DaemonState.IDLE;

    /**
     * 생성자 (고정 cooldown, 실제 대기, 시스템 시계).
     */
    public DaemonSupervisor(CycleRunner runner, CapabilitySet capabilities, HealthMonitor monitor,
                            StatusStore statusStore, ReportStore reportStore, SupervisorConfig config) {
        this(runner, capabilities, monitor, statusStore, reportStore, config,
            RetryCooldown.fixed(config.retryCooldownMs()), Sleeper.SYSTEM, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param runner 사이클 실행자
     * @param capabilities 시작 시 해석된 Capability 집합
     * @param monitor 헬스 모니터
     * @param statusStore 상태 저장소
     * @param reportStore 리포트 저장소
     * @param config Supervisor 설정
     * @param cooldown 재시도 대기 계산기
     * @param sleeper 대기 구현
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DaemonSupervisor(CycleRunner runner, CapabilitySet capabilities, HealthMonitor monitor,
                            StatusStore statusStore, ReportStore reportStore, SupervisorConfig config,
                            RetryCooldown cooldown, Sleeper sleeper, Clock clock) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (monitor == null) {
            throw new IllegalArgumentException("monitor cannot be null");
        }
        if (statusStore == null) {
            throw new IllegalArgumentException("statusStore cannot be null");
        }
        if (reportStore == null) {
            throw new IllegalArgumentException("reportStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cooldown == null) {
            throw new IllegalArgumentException("cooldown cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.runner = runner;
        this.capabilities = capabilities;
        this.monitor = monitor;
        this.statusStore = statusStore;
        this.reportStore = reportStore;
        this.config = config;
        this.cooldown = cooldown;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public void runForever() {
        start();
        try {
            while (!stopSignal.isRequested()) {
                runSlot();

                if (stopSignal.isRequested()) {
                    break;
                }
                moveTo(DaemonState.SLEEPING);
                log.info("Sleeping {} ms until next cycle", config.cycleIntervalMs());
                if (!waitFor(config.cycleIntervalMs())) {
                    break;
                }
                moveTo(DaemonState.RUNNING);
            }
        } finally {
            finish();
        }
    }

    @Override
    public CycleReport runOnce() {
        start();
        try {
            return runSlot();
        } finally {
            finish();
        }
    }

    @Override
    public void requestStop() {
        if (stopSignal.request()) {
            log.info("Stop requested (state: {})", state);
        }
    }

    @Override
    public DaemonState state() {
        return state;
    }

    /**
     * STOPPED 상태가 될 때까지 대기.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 제한 시간 안에 종료되면 true
     * @throws InterruptedException 대기 중 인터럽트 시
     */
    public boolean awaitStopped(long timeoutMs) throws InterruptedException {
        return stopped.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 현재 누적 통계.
     */
    public RunStatistics statistics() {
        return statistics;
    }

    /**
     * 저장소 준비 후 RUNNING 진입.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    private void start() {
        if (state != DaemonState.IDLE) {
            throw new IllegalStateException("Supervisor already started (state: " + state + ")");
        }
        try {
            statusStore.prepare();
            reportStore.prepare();
        } catch (RuntimeException e) {
            log.error("Storage preparation failed, supervisor cannot start", e);
            finish();
            throw e;
        }
        moveTo(DaemonState.RUNNING);
        log.info("Supervisor started: interval={} ms, maxRetries={}, errorThreshold={}, capabilities={}",
            config.cycleIntervalMs(), config.maxRetries(), config.errorThreshold(), capabilities.summary());
    }

    /**
     * 슬롯 하나 실행 (재시도 포함) 후 리포트와 상태 기록.
     */
    private CycleReport runSlot() {
        RetryState retry = RetryState.first(config.maxRetries());
        int attemptsUsed = 0;
        CycleResult last;
        SlotOutcome outcome;

        while (true) {
            CycleRequest request = new CycleRequest(monitor.latest(), statistics.snapshot(), retry.attempt());
            last = runner.runCycle(capabilities, request);
            attemptsUsed++;

            boolean failed = last.errorCount() > config.errorThreshold();
            String summary = summarize(last, retry);
            monitor.recordCycleOutcome(!failed, summary);

            if (!failed) {
                outcome = SlotOutcome.SUCCEEDED;
                log.info("Attempt {}/{} succeeded: {}", retry.attempt(), retry.maxRetries(), summary);
                break;
            }
            if (!retry.hasAttemptsLeft()) {
                outcome = SlotOutcome.EXHAUSTED;
                log.error("Cycle slot exhausted after {} attempts: {}", attemptsUsed, summary);
                break;
            }

            statusStore.write(monitor.sample());
            long delay = cooldown.calculate(retry.attempt());
            log.warn("Attempt {}/{} failed ({}), retrying in {} ms",
                retry.attempt(), retry.maxRetries(), summary, delay);
            retry = retry.next(summary, clock.instant().plusMillis(delay));
            moveTo(DaemonState.RETRYING);
            if (!waitFor(delay)) {
                outcome = SlotOutcome.ABORTED;
                log.info("Stop observed during retry cooldown, slot aborted after {} attempts", attemptsUsed);
                break;
            }
            moveTo(DaemonState.RUNNING);
        }

        statistics.record(outcome, attemptsUsed, last);
        return persist(outcome, attemptsUsed, last);
    }

    private CycleReport persist(SlotOutcome outcome, int attemptsUsed, CycleResult last) {
        HealthSnapshot snapshot = monitor.sample();
        CycleReport report = new CycleReport(
            clock.instant(),
            outcome,
            attemptsUsed,
            config.maxRetries(),
            last,
            snapshot,
            statistics.snapshot()
        );
        String reference = reportStore.write(report);
        statusStore.write(snapshot);
        log.info("Slot {} recorded as {} (health: {})", reference, outcome, snapshot.status().label());
        return report;
    }

    /**
     * 중지 신호를 확인하며 대기.
     *
     * @param millis 대기 시간
     * @return 대기를 마치면 true, 중지 요청이 관찰되면 false
     */
    private boolean waitFor(long millis) {
        long remaining = millis;
        while (remaining > 0) {
            if (stopSignal.isRequested()) {
                return false;
            }
            long slice = Math.min(remaining, config.stopPollIntervalMs());
            try {
                sleeper.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestStop();
                return false;
            }
            remaining -= slice;
        }
        return !stopSignal.isRequested();
    }

    private void finish() {
        if (state != DaemonState.STOPPED) {
            moveTo(DaemonState.STOPPING);
            moveTo(DaemonState.STOPPED);
            log.info("Supervisor stopped: {}", statistics.snapshot());
        }
        stopped.countDown();
    }

    private void moveTo(DaemonState next) {
        state = DaemonStateTransition.transition(state, next);
    }

    private String summarize(CycleResult result, RetryState retry) {
        StringBuilder summary = new StringBuilder()
            .append(result.errorCount()).append(" errors (threshold ").append(config.errorThreshold()).append(")");
        if (!result.errors().isEmpty()) {
            CycleError first = result.errors().get(0);
            summary.append(", first: ").append(first.phase());
            if (first.target() != null) {
                summary.append('/').append(first.target());
            }
            summary.append(' ').append(first.message());
        }
        if (retry.attempt() > 1) {
            summary.append(", attempt ").append(retry.attempt());
        }
        return summary.toString();
    }
}

package com.ryuqq.autocycle.adapter.runner.health;

import com.ryuqq.autocycle.core.health.Alert;
import com.ryuqq.autocycle.core.health.HealthEvent;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.health.HealthStatus;
import com.ryuqq.autocycle.core.health.ResourceGauges;
import com.ryuqq.autocycle.core.spi.AlertNotifier;
import com.ryuqq.autocycle.testkit.fixture.CycleFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HealthMonitor 유닛 테스트.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
class HealthMonitorTest {

    private MutableClock clock;
    private StubResourceSampler sampler;
    private List<Alert> alerts;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CycleFixtures.BASE_TIME);
        sampler = new StubResourceSampler(10, 20, 30);
        alerts = new ArrayList<>();
        monitor = new HealthMonitor(sampler, () -> true, alerts::add, new HealthThresholds(), clock);
    }

    // ============================================================
    // 1. 상태 판정
    // ============================================================

    @Test
    void sample_자원과_오류가_임계값_이하면_HEALTHY() {
        HealthSnapshot snapshot = monitor.sample();

        assertThat(snapshot.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(snapshot.gauges()).isEqualTo(new ResourceGauges(10, 20, 30, true));
        assertThat(alerts).isEmpty();
    }

    @Test
    void sample_누적_오류_10회까지는_CRITICAL_아님() {
        for (int i = 0; i < 10; i++) {
            monitor.recordCycleOutcome(false, "failure " + i);
        }

        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void sample_누적_오류_11회면_CRITICAL_이후_성공해도_유지() {
        for (int i = 0; i < 11; i++) {
            monitor.recordCycleOutcome(false, "failure " + i);
        }
        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.CRITICAL);

        for (int i = 0; i < 5; i++) {
            monitor.recordCycleOutcome(true, "ok");
        }
        HealthSnapshot snapshot = monitor.sample();

        assertThat(snapshot.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(snapshot.cycleCount()).isEqualTo(16);
        assertThat(snapshot.errorCount()).isEqualTo(11);
    }

    @Test
    void sample_CPU가_임계값_초과면_WARNING_경계값은_HEALTHY() {
        sampler.set(80.0, 20, 30);
        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.HEALTHY);

        sampler.set(80.1, 20, 30);
        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.WARNING);
    }

    @Test
    void sample_디스크는_90_초과부터_WARNING() {
        sampler.set(10, 20, 85);
        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.HEALTHY);

        sampler.set(10, 20, 95);
        assertThat(monitor.sample().status()).isEqualTo(HealthStatus.WARNING);
    }

    @Test
    void sample_측정_실패한_게이지는_0으로_기록() {
        ResourceSampler failing = new ResourceSampler() {
            @Override
            public double cpuLoadPercent() throws Exception {
                throw new Exception("no cpu data");
            }

            @Override
            public double memoryPercent() {
                return 55.0;
            }

            @Override
            public double diskPercent() {
                throw new IllegalStateException("no disk");
            }
        };
        HealthMonitor degraded = new HealthMonitor(failing, () -> {
            throw new IllegalStateException("dns failure");
        }, alerts::add, new HealthThresholds(), clock);

        HealthSnapshot snapshot = degraded.sample();

        assertThat(snapshot.gauges()).isEqualTo(new ResourceGauges(0.0, 55.0, 0.0, false));
        assertThat(snapshot.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void sample_네트워크_미도달은_상태에_영향_없음() {
        HealthMonitor offline = new HealthMonitor(sampler, () -> false, alerts::add, new HealthThresholds(), clock);

        HealthSnapshot snapshot = offline.sample();

        assertThat(snapshot.gauges().networkReachable()).isFalse();
        assertThat(snapshot.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    // ============================================================
    // 2. 알림과 이벤트
    // ============================================================

    @Test
    void sample_상태가_나빠지면_한번만_알림() {
        sampler.set(95, 20, 30);

        monitor.sample();
        monitor.sample();

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).previous()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(alerts.get(0).current()).isEqualTo(HealthStatus.WARNING);
        assertThat(alerts.get(0).message()).contains("cpu 95.0%");
    }

    @Test
    void sample_상태가_회복되면_알림_없이_이벤트만_기록() {
        sampler.set(95, 20, 30);
        monitor.sample();
        sampler.set(10, 20, 30);

        HealthSnapshot snapshot = monitor.sample();

        assertThat(alerts).hasSize(1);
        assertThat(snapshot.recentEvents())
            .extracting(HealthEvent::type)
            .containsExactly(HealthEvent.Type.STATUS_CHANGED, HealthEvent.Type.STATUS_CHANGED);
    }

    @Test
    void sample_알림_전송_실패해도_측정은_계속() {
        AlertNotifier broken = alert -> {
            throw new IllegalStateException("webhook down");
        };
        HealthMonitor withBrokenNotifier = new HealthMonitor(sampler, () -> true, broken, new HealthThresholds(), clock);
        sampler.set(95, 20, 30);

        HealthSnapshot snapshot = withBrokenNotifier.sample();

        assertThat(snapshot.status()).isEqualTo(HealthStatus.WARNING);
    }

    @Test
    void recordCycleOutcome_최근_이벤트는_제한_개수만_보관() {
        HealthMonitor limited = new HealthMonitor(sampler, () -> true, alerts::add, new HealthThresholds(), clock, 3);
        for (int i = 1; i <= 5; i++) {
            limited.recordCycleOutcome(true, "cycle " + i);
        }

        List<HealthEvent> events = limited.sample().recentEvents();

        assertThat(events).extracting(HealthEvent::message).containsExactly("cycle 3", "cycle 4", "cycle 5");
    }

    @Test
    void recordCycleOutcome_실패_메시지가_비어있으면_기본_메시지() {
        monitor.recordCycleOutcome(false, " ");

        assertThat(monitor.sample().lastError()).isEqualTo("cycle failed");
    }

    // ============================================================
    // 3. 스냅샷 관리
    // ============================================================

    @Test
    void latest_측정_전에는_초기_스냅샷() {
        HealthSnapshot latest = monitor.latest();

        assertThat(latest.cycleCount()).isZero();
        assertThat(latest.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(latest.uptime()).isEqualTo(Duration.ZERO);
    }

    @Test
    void sample_uptime은_생성_시점부터_계산() {
        clock.advance(Duration.ofSeconds(90));

        assertThat(monitor.sample().uptime()).isEqualTo(Duration.ofSeconds(90));
        assertThat(monitor.latest().timestamp()).isEqualTo(CycleFixtures.BASE_TIME.plusSeconds(90));
    }

    @Test
    void restore_저장된_카운터로_이어서_누적() {
        monitor.restore(CycleFixtures.snapshot(20, 11, HealthStatus.CRITICAL));

        monitor.recordCycleOutcome(true, "ok");
        HealthSnapshot snapshot = monitor.sample();

        assertThat(snapshot.cycleCount()).isEqualTo(21);
        assertThat(snapshot.errorCount()).isEqualTo(11);
        assertThat(snapshot.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(alerts).isEmpty();
        assertThat(snapshot.recentEvents()).hasSize(3);
    }

    @Test
    void 생성자_recentEventLimit이_0이면_예외() {
        assertThatThrownBy(() -> new HealthMonitor(sampler, () -> true, alerts::add, new HealthThresholds(), clock, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("recentEventLimit must be positive");
    }
}

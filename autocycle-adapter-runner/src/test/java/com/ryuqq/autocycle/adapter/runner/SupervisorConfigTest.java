package com.ryuqq.autocycle.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupervisorConfigTest {

    @Test
    void 기본값() {
        SupervisorConfig config = new SupervisorConfig();

        assertThat(config.cycleIntervalMs()).isEqualTo(3600000);
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.retryCooldownMs()).isEqualTo(300000);
        assertThat(config.errorThreshold()).isEqualTo(3);
        assertThat(config.stopPollIntervalMs()).isEqualTo(1000);
    }

    @Test
    void withX_해당_값만_변경() {
        SupervisorConfig config = new SupervisorConfig().withMaxRetries(1).withErrorThreshold(0);

        assertThat(config.maxRetries()).isEqualTo(1);
        assertThat(config.errorThreshold()).isZero();
        assertThat(config.cycleIntervalMs()).isEqualTo(3600000);
    }

    @Test
    void 잘못된_값이면_예외() {
        assertThatThrownBy(() -> new SupervisorConfig().withMaxRetries(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxRetries must be positive (current: 0)");
        assertThatThrownBy(() -> new SupervisorConfig().withCycleIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SupervisorConfig().withRetryCooldownMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SupervisorConfig().withStopPollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

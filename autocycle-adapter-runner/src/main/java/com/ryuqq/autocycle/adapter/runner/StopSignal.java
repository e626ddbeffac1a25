package com.ryuqq.autocycle.adapter.runner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 외부 중지 요청 플래그.
 *
 * <p>종료 훅 등 다른 스레드에서 설정하고, Supervisor 스레드가 루프 경계와 대기 중에 확인합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class StopSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * 중지 요청 (멱등).
     *
     * @return 처음 요청된 경우 true
     */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }
}

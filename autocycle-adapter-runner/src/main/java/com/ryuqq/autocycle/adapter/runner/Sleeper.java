package com.ryuqq.autocycle.adapter.runner;

/**
 * 대기 추상화.
 *
 * <p>테스트에서 실제 시간 없이 대기를 기록할 수 있도록 분리되어 있습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    /**
     * 지정한 시간만큼 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트 시
     */
    void sleep(long millis) throws InterruptedException;
}

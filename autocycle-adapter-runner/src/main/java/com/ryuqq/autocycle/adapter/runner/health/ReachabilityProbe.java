package com.ryuqq.autocycle.adapter.runner.health;

/**
 * 외부 네트워크 도달 가능 여부 확인.
 *
 * <p>구현은 자체 타임아웃을 가져야 하며, 무기한 대기해서는 안 됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReachabilityProbe {

    /**
     * 도달 가능 여부.
     *
     * @return 응답을 받으면 true, 타임아웃/오류면 false
     */
    boolean isReachable();
}

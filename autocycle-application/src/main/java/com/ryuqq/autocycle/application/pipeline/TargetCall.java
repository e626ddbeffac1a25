package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.cycle.TargetOutcome;

import java.util.List;

/**
 * Fan-out 대상 하나에 대한 호출.
 *
 * @param <T> 협력자 타입
 * @author Autocycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TargetCall<T> {

    /**
     * 협력자 호출.
     *
     * @param target 대상 이름
     * @param handle 협력자
     * @return 대상 결과 (마케팅처럼 채널 여러 개를 보고할 수 있음)
     * @throws Exception 호출 실패 시
     */
    List<TargetOutcome> call(String target, T handle) throws Exception;
}

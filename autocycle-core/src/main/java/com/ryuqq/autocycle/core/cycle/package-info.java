/**
 * 사이클 결과 모델.
 *
 * <p>{@link com.ryuqq.autocycle.core.cycle.CycleResult}는 Phase별 결과
 * ({@link com.ryuqq.autocycle.core.cycle.PhaseOutcome}), fan-out 대상별 결과
 * ({@link com.ryuqq.autocycle.core.cycle.TargetOutcome}), 비치명적 오류
 * ({@link com.ryuqq.autocycle.core.cycle.CycleError})를 모읍니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.cycle;

/**
 * 다단계 파이프라인 실행.
 *
 * <p>{@link com.ryuqq.autocycle.application.pipeline.PipelineExecutor}가 고정 순서의 Phase를 실행하고,
 * 각 Phase는 {@link com.ryuqq.autocycle.application.pipeline.CapabilityPhase}를 통해
 * Capability 부재와 협력자 실패를 동일한 방식으로 흡수합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.application.pipeline;

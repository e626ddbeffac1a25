/**
 * 사이클을 구성하는 10개 Phase.
 *
 * <p>실행 순서는 {@link com.ryuqq.autocycle.core.cycle.PhaseName} 선언 순서와 같습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.application.pipeline.phase;

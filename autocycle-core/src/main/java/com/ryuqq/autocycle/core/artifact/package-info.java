/**
 * 파이프라인 Phase 간에 전달되는 산출물 값 객체.
 *
 * <p>모든 타입은 불변 record이며, 협력자 SPI의 입출력으로 사용됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.artifact;

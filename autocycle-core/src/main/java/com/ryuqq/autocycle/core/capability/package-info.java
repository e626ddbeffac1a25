/**
 * Capability 모델.
 *
 * <p>선택적 협력자의 존재 여부를 명시적인 값으로 표현합니다.
 * 파이프라인은 {@link com.ryuqq.autocycle.core.capability.CapabilitySet}을 참조로 전달받으며,
 * 각 Phase는 Capability의 present/absent 변형 중 하나를 실행합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autocycle.core.capability.Capability} - 고정된 Capability 열거</li>
 *   <li>{@link com.ryuqq.autocycle.core.capability.CapabilityKey} - Capability + 대상 이름</li>
 *   <li>{@link com.ryuqq.autocycle.core.capability.CapabilitySet} - 읽기 전용 집합</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.capability;

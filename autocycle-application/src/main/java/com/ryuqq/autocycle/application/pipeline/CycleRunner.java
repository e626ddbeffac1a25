package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.cycle.CycleResult;

/**
 * 사이클 한 번을 실행하는 계약.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>반환된 결과는 항상 전체 Phase 목록을 고정 순서로 포함합니다.</li>
 *   <li>예외를 던지지 않습니다. 모든 실패는 결과 안에 기록됩니다.</li>
 *   <li>호출 사이에 숨겨진 재초기화가 없습니다. 재시도는 같은 인스턴스를 다시 호출합니다.</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface CycleRunner {

    /**
     * 사이클 실행.
     *
     * @param capabilities 시작 시 해석된 Capability 집합
     * @param request 사이클 입력
     * @return 사이클 결과
     */
    CycleResult runCycle(CapabilitySet capabilities, CycleRequest request);
}

package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.MarketSignal;

import java.util.List;

/**
 * 시장 트렌드 수집 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface TrendSource {

    /**
     * 현재 시장 신호 수집.
     *
     * @return 시장 신호 (비어 있지 않아야 함)
     * @throws RuntimeException 수집 실패 시
     */
    List<MarketSignal> collect();
}

package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.ChannelStatus;

import java.util.List;

/**
 * 마케팅 캠페인 실행 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface MarketingDispatcher {

    /**
     * 상품 출시 캠페인 실행.
     *
     * @param bundle 홍보할 산출물
     * @param audience 대상 고객군
     * @return 채널별 실행 결과
     * @throws RuntimeException 실행 실패 시
     */
    List<ChannelStatus> launch(ArtifactBundle bundle, String audience);
}

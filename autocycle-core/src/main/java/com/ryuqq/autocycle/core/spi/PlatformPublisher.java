package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.PublishReceipt;

/**
 * 플랫폼별 배포 협력자.
 *
 * <p>플랫폼마다 하나의 구현이 등록되며, PUBLISH Phase에서 서로 독립적으로 호출됩니다.
 * 구현체는 자체 네트워크 타임아웃을 가져야 합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface PlatformPublisher {

    /**
     * 산출물을 플랫폼에 게시.
     *
     * @param bundle 게시할 산출물
     * @return 게시 결과
     * @throws RuntimeException 게시 실패 시
     */
    PublishReceipt publish(ArtifactBundle bundle);
}

package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.AssetSet;
import com.ryuqq.autocycle.core.artifact.ContentSpec;

/**
 * 이미지/소셜 미디어 자산 생성 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface AssetGenerator {

    /**
     * 상품 홍보용 자산 생성.
     *
     * @param content 상품 명세
     * @return 자산 참조 집합
     * @throws RuntimeException 생성 실패 시
     */
    AssetSet generate(ContentSpec content);
}

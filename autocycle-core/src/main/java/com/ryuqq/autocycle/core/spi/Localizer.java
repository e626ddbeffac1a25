package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.artifact.LocalizedBundle;

import java.util.List;

/**
 * 다국어 변환 협력자.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface Localizer {

    /**
     * 콘텐츠를 대상 로케일로 변환.
     *
     * @param content 원본 콘텐츠
     * @param targetLocales 대상 로케일 목록
     * @return 로케일별 콘텐츠 묶음
     * @throws RuntimeException 변환 실패 시
     */
    LocalizedBundle localize(ContentSpec content, List<String> targetLocales);
}

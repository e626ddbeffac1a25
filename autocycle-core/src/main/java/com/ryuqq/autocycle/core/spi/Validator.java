package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.artifact.ArtifactBundle;
import com.ryuqq.autocycle.core.artifact.ValidationReport;

/**
 * 품질 검증 협력자 (중복, 정책 위반, 위험도 검사).
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface Validator {

    /**
     * 산출물 검증.
     *
     * @param bundle 검증할 산출물
     * @return 검증 결과
     * @throws RuntimeException 검증 수행 자체가 실패한 경우
     */
    ValidationReport validate(ArtifactBundle bundle);
}

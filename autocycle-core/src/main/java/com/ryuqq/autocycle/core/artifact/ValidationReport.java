package com.ryuqq.autocycle.core.artifact;

import java.util.List;

/**
 * 품질 검증 결과.
 *
 * @param passed 정책 통과 여부
 * @param issues 발견된 문제
 * @param riskScore 위험 점수 (0.0 이상)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record ValidationReport(boolean passed, List<String> issues, double riskScore) {

    private static final ValidationReport UNCHECKED_PASS = new ValidationReport(true, List.of(), 0.0);

    public ValidationReport {
        if (riskScore < 0.0) {
            throw new IllegalArgumentException("riskScore must not be negative (current: " + riskScore + ")");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * 검증기가 없을 때 사용하는 기본 보고서 (통과, 문제 없음, 위험 0).
     *
     * @return 기본 ValidationReport
     */
    public static ValidationReport uncheckedPass() {
        return UNCHECKED_PASS;
    }
}

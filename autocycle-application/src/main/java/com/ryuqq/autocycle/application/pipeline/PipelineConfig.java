package com.ryuqq.autocycle.application.pipeline;

import java.util.List;

/**
 * PipelineExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>targetLocales: 다국어 변환 대상 로케일 (기본 en, es, pt, ja, de)</li>
 *   <li>targetTimeoutMs: Fan-out 대상 하나의 최대 대기 시간 (기본 30000ms)</li>
 *   <li>fanOutConcurrency: Fan-out 워커 풀 크기 (기본 4)</li>
 *   <li>audience: 마케팅 대상 고객군 (기본 "Busy Professionals")</li>
 *   <li>defaultCategory: 상품 명세에 기능 목록이 없을 때의 카테고리 (기본 "productivity")</li>
 * </ul>
 *
 * @param targetLocales 대상 로케일 (비어 있으면 안 됨)
 * @param targetTimeoutMs 대상별 타임아웃 (밀리초, 양수)
 * @param fanOutConcurrency 워커 풀 크기 (1 이상)
 * @param audience 마케팅 대상 고객군
 * @param defaultCategory 기본 카테고리
 * @author Autocycle Team
 * @since 1.0.0
 */
public record PipelineConfig(
    List<String> targetLocales,
    long targetTimeoutMs,
    int fanOutConcurrency,
    String audience,
    String defaultCategory
) {

    /**
     * 기본 설정 생성자.
     */
    public PipelineConfig() {
        this(List.of("en", "es", "pt", "ja", "de"), 30000, 4, "Busy Professionals", "productivity");
    }

    public PipelineConfig {
        if (targetLocales == null || targetLocales.isEmpty()) {
            throw new IllegalArgumentException("targetLocales cannot be null or empty");
        }
        targetLocales = List.copyOf(targetLocales);
        if (targetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "targetTimeoutMs must be positive (current: " + targetTimeoutMs + ")"
            );
        }
        if (fanOutConcurrency <= 0) {
            throw new IllegalArgumentException(
                "fanOutConcurrency must be positive (current: " + fanOutConcurrency + ")"
            );
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience cannot be null or blank");
        }
        if (defaultCategory == null || defaultCategory.isBlank()) {
            throw new IllegalArgumentException("defaultCategory cannot be null or blank");
        }
    }

    public PipelineConfig withTargetLocales(List<String> targetLocales) {
        return new PipelineConfig(targetLocales, targetTimeoutMs, fanOutConcurrency, audience, defaultCategory);
    }

    public PipelineConfig withTargetTimeoutMs(long targetTimeoutMs) {
        return new PipelineConfig(targetLocales, targetTimeoutMs, fanOutConcurrency, audience, defaultCategory);
    }

    public PipelineConfig withFanOutConcurrency(int fanOutConcurrency) {
        return new PipelineConfig(targetLocales, targetTimeoutMs, fanOutConcurrency, audience, defaultCategory);
    }

    public PipelineConfig withAudience(String audience) {
        return new PipelineConfig(targetLocales, targetTimeoutMs, fanOutConcurrency, audience, defaultCategory);
    }

    public PipelineConfig withDefaultCategory(String defaultCategory) {
        return new PipelineConfig(targetLocales, targetTimeoutMs, fanOutConcurrency, audience, defaultCategory);
    }
}

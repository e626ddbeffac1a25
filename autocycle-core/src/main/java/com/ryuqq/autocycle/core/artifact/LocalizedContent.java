package com.ryuqq.autocycle.core.artifact;

/**
 * 단일 로케일의 번역 콘텐츠.
 *
 * @param locale 로케일 코드 (예: en, es, ja)
 * @param name 번역된 이름
 * @param description 번역된 설명
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record LocalizedContent(String locale, String name, String description) {

    public LocalizedContent {
        if (locale == null || locale.isBlank()) {
            throw new IllegalArgumentException("locale cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        description = description == null ? "" : description;
    }
}

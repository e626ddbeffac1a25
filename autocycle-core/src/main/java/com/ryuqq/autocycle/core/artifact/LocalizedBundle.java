package com.ryuqq.autocycle.core.artifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 다국어 콘텐츠 묶음.
 *
 * @param translations 로케일 → 번역 콘텐츠 (입력 순서 유지)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record LocalizedBundle(Map<String, LocalizedContent> translations) {

    public LocalizedBundle {
        if (translations == null || translations.isEmpty()) {
            throw new IllegalArgumentException("translations cannot be null or empty");
        }
        translations = Collections.unmodifiableMap(new LinkedHashMap<>(translations));
    }

    /**
     * 원본 콘텐츠만 담은 단일 로케일 묶음.
     *
     * @param locale 로케일
     * @param content 원본 콘텐츠
     * @return LocalizedBundle
     */
    public static LocalizedBundle single(String locale, ContentSpec content) {
        return new LocalizedBundle(Map.of(locale, new LocalizedContent(locale, content.name(), content.description())));
    }

    /**
     * 포함된 로케일 목록.
     *
     * @return 로케일 코드 목록
     */
    public List<String> locales() {
        return List.copyOf(translations.keySet());
    }
}

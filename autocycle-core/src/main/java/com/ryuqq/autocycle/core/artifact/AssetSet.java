package com.ryuqq.autocycle.core.artifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 생성된 이미지/미디어 자산 참조.
 *
 * @param assets 자산 종류 → 참조 (URL 또는 파일 경로)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record AssetSet(Map<String, String> assets) {

    private static final AssetSet NONE = new AssetSet(Map.of());

    public AssetSet {
        assets = assets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
    }

    /**
     * 자산이 없는 집합.
     *
     * @return 빈 AssetSet
     */
    public static AssetSet none() {
        return NONE;
    }

    public int size() {
        return assets.size();
    }
}

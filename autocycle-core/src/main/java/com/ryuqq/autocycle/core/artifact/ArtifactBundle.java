package com.ryuqq.autocycle.core.artifact;

/**
 * 검증, 가격 결정, 배포, 마케팅 협력자에게 전달되는 산출물 묶음.
 *
 * @param content 콘텐츠 명세
 * @param localized 다국어 콘텐츠
 * @param assets 생성된 자산
 * @param price 현재 가격 견적
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record ArtifactBundle(ContentSpec content, LocalizedBundle localized, AssetSet assets, PriceQuote price) {

    public ArtifactBundle {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (localized == null) {
            throw new IllegalArgumentException("localized cannot be null");
        }
        if (assets == null) {
            throw new IllegalArgumentException("assets cannot be null");
        }
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
    }
}

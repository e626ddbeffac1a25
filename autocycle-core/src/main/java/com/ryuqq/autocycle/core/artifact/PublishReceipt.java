package com.ryuqq.autocycle.core.artifact;

/**
 * 플랫폼 배포 결과.
 *
 * @param success 배포 성공 여부
 * @param reference 상품 URL 또는 플랫폼 식별자 (실패 시 사유)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record PublishReceipt(boolean success, String reference) {

    public static PublishReceipt published(String reference) {
        return new PublishReceipt(true, reference);
    }

    public static PublishReceipt rejected(String reason) {
        return new PublishReceipt(false, reason);
    }
}

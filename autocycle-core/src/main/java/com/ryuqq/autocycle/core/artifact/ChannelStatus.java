package com.ryuqq.autocycle.core.artifact;

/**
 * 마케팅 채널별 실행 결과.
 *
 * @param channel 채널 이름 (예: telegram, discord, email)
 * @param success 실행 성공 여부
 * @param detail 게시물 참조 또는 실패 사유
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record ChannelStatus(String channel, boolean success, String detail) {

    public ChannelStatus {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
    }
}

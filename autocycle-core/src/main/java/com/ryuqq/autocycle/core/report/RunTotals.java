package com.ryuqq.autocycle.core.report;

/**
 * Daemon 실행 누적 통계의 스냅샷.
 *
 * <p>Supervisor가 소유한 누적기에서 슬롯마다 복사되어 리포트와 CycleRequest에 전달됩니다.</p>
 *
 * @param slots 실행된 슬롯 수
 * @param succeededSlots 성공 슬롯 수
 * @param exhaustedSlots 재시도 소진 슬롯 수
 * @param attempts 총 시도 횟수
 * @param templatesPublished 성공 슬롯에서 생성된 템플릿 수
 * @param platformsReached 누적 배포 플랫폼 수
 * @param campaignsExecuted 누적 캠페인 수
 * @author Autocycle Team
 * @since 1.0.0
 */
public record RunTotals(
    long slots,
    long succeededSlots,
    long exhaustedSlots,
    long attempts,
    long templatesPublished,
    long platformsReached,
    long campaignsExecuted
) {

    public RunTotals {
        requireNonNegative("slots", slots);
        requireNonNegative("succeededSlots", succeededSlots);
        requireNonNegative("exhaustedSlots", exhaustedSlots);
        requireNonNegative("attempts", attempts);
        requireNonNegative("templatesPublished", templatesPublished);
        requireNonNegative("platformsReached", platformsReached);
        requireNonNegative("campaignsExecuted", campaignsExecuted);
    }

    /**
     * 아무것도 실행되지 않은 상태.
     *
     * @return 모든 값이 0인 RunTotals
     */
    public static RunTotals zero() {
        return new RunTotals(0, 0, 0, 0, 0, 0, 0);
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative (current: " + value + ")");
        }
    }
}

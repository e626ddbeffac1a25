package com.ryuqq.autocycle.adapter.runner;

import com.ryuqq.autocycle.core.cycle.CycleResult;
import com.ryuqq.autocycle.core.report.RunTotals;
import com.ryuqq.autocycle.core.report.SlotOutcome;

/**
 * Daemon 실행 누적 통계.
 *
 * <p>Supervisor가 소유하며 슬롯이 끝날 때마다 갱신됩니다.
 * 리포트와 CycleRequest에는 {@link #snapshot()}으로 복사된 값이 전달됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class RunStatistics {

    private long slots;
    private long succeededSlots;
    private long exhaustedSlots;
    private long attempts;
    private long templatesPublished;
    private long platformsReached;
    private long campaignsExecuted;

    /**
     * 슬롯 결과 반영.
     *
     * @param outcome 슬롯 결과
     * @param attemptsUsed 슬롯에서 실행한 시도 수
     * @param last 마지막 시도의 결과
     */
    public synchronized void record(SlotOutcome outcome, int attemptsUsed, CycleResult last) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (last == null) {
            throw new IllegalArgumentException("last cannot be null");
        }
        slots++;
        attempts += attemptsUsed;
        switch (outcome) {
            case SUCCEEDED -> {
                succeededSlots++;
                templatesPublished++;
                platformsReached += last.platformsReached();
                campaignsExecuted += last.campaignsExecuted();
            }
            case EXHAUSTED -> exhaustedSlots++;
            case ABORTED -> {
                // 시도 수만 누적
            }
        }
    }

    /**
     * 현재 누적값 스냅샷.
     *
     * @return 불변 RunTotals
     */
    public synchronized RunTotals snapshot() {
        return new RunTotals(slots, succeededSlots, exhaustedSlots, attempts,
            templatesPublished, platformsReached, campaignsExecuted);
    }
}

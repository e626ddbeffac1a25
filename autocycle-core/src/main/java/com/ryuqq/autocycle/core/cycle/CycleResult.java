package com.ryuqq.autocycle.core.cycle;

import com.ryuqq.autocycle.core.artifact.PriceQuote;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 한 번의 파이프라인 실행 결과.
 *
 * <p>PipelineExecutor가 정확히 한 번 생성하며, 반환 후에는 불변입니다.
 * 호출자(DaemonSupervisor)가 소유하고 감사 목적으로 리포트 파일에 직렬화합니다.</p>
 *
 * <p><strong>불변식:</strong> 완료된 사이클의 phases는 {@link PhaseName} 전체를
 * 순서대로 포함합니다 (Capability 부재로 skip된 Phase 포함).</p>
 *
 * @param cycleId 사이클 식별자
 * @param startedAt 첫 Phase 시작 시각
 * @param finishedAt 마지막 Phase 종료 시각
 * @param phases Phase별 결과 (실행 순서)
 * @param errors 수집된 비치명적 오류
 * @param platformsReached 배포에 성공한 플랫폼 수
 * @param languagesProduced 생성된 로케일 수
 * @param campaignsExecuted 성공한 마케팅 캠페인 수
 * @param templateName 사이클에서 다룬 상품 이름
 * @param finalPrice 최종 가격 견적
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CycleResult(
    String cycleId,
    Instant startedAt,
    Instant finishedAt,
    List<PhaseOutcome> phases,
    List<CycleError> errors,
    int platformsReached,
    int languagesProduced,
    int campaignsExecuted,
    String templateName,
    PriceQuote finalPrice
) {

    public CycleResult {
        if (cycleId == null || cycleId.isBlank()) {
            throw new IllegalArgumentException("cycleId cannot be null or blank");
        }
        if (startedAt == null || finishedAt == null) {
            throw new IllegalArgumentException("startedAt and finishedAt cannot be null");
        }
        if (finishedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("finishedAt cannot be before startedAt");
        }
        phases = phases == null ? List.of() : List.copyOf(phases);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 사이클 소요 시간 (첫 Phase 시작부터 마지막 Phase 종료까지).
     *
     * @return 소요 시간
     */
    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * 수집된 오류 수.
     *
     * @return errors 크기
     */
    public int errorCount() {
        return errors.size();
    }

    /**
     * Phase 결과 조회.
     *
     * @param phase Phase 이름
     * @return 해당 Phase 결과
     * @throws IllegalArgumentException 결과에 Phase가 없는 경우
     */
    public PhaseOutcome phase(PhaseName phase) {
        for (PhaseOutcome outcome : phases) {
            if (outcome.phase() == phase) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Phase not present in result: " + phase);
    }

    /**
     * 모든 Phase가 포함된 완전한 결과인지 확인.
     *
     * @return 모든 PhaseName이 순서대로 존재하면 true
     */
    public boolean isComplete() {
        PhaseName[] expected = PhaseName.values();
        if (phases.size() != expected.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (phases.get(i).phase() != expected[i]) {
                return false;
            }
        }
        return true;
    }
}

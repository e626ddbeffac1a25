package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.health.HealthSnapshot;

import java.util.Optional;

/**
 * 최신 헬스 스냅샷 저장소 SPI.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>쓰기는 단일 writer(DaemonSupervisor)만 수행합니다.</li>
 *   <li>{@link #write(HealthSnapshot)}는 이전 내용을 통째로 교체합니다 (이력 없음).</li>
 *   <li>{@link #read()}는 쓰기 도중에도 이전 또는 새 스냅샷 중 하나를 온전히 반환해야 합니다.</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface StatusStore {

    /**
     * 저장 위치 준비 (디렉토리 생성 등).
     *
     * @throws PersistenceException 준비 실패 시
     */
    void prepare();

    /**
     * 최신 스냅샷 기록 (전체 교체).
     *
     * @param snapshot 헬스 스냅샷
     * @throws IllegalArgumentException snapshot이 null인 경우
     * @throws PersistenceException 기록 실패 시
     */
    void write(HealthSnapshot snapshot);

    /**
     * 마지막으로 기록된 스냅샷 조회.
     *
     * @return 스냅샷 (기록된 적 없으면 empty)
     * @throws PersistenceException 읽기 실패 시
     */
    Optional<HealthSnapshot> read();
}

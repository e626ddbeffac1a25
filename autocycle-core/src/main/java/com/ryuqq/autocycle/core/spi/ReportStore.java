package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.report.CycleReport;

import java.util.List;
import java.util.Optional;

/**
 * 사이클 리포트 저장소 SPI.
 *
 * <p>슬롯(스케줄된 사이클 호출)마다 새 리포트를 기록합니다.
 * 기존 리포트에 덧붙이거나 덮어쓰지 않습니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface ReportStore {

    /**
     * 저장 위치 준비.
     *
     * @throws PersistenceException 준비 실패 시
     */
    void prepare();

    /**
     * 리포트 기록.
     *
     * @param report 사이클 리포트
     * @return 기록된 리포트 참조 (파일 이름 등, 리포트마다 고유)
     * @throws IllegalArgumentException report가 null인 경우
     * @throws PersistenceException 기록 실패 시
     */
    String write(CycleReport report);

    /**
     * 참조로 리포트 조회.
     *
     * @param reference write()가 반환한 참조
     * @return 리포트 (없으면 empty)
     * @throws PersistenceException 읽기 실패 시
     */
    Optional<CycleReport> read(String reference);

    /**
     * 기록된 리포트 참조 목록 (기록 순서).
     *
     * @return 참조 목록
     */
    List<String> list();
}

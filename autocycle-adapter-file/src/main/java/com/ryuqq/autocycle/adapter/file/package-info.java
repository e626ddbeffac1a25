/**
 * JSON 파일 기반 영속화 어댑터.
 *
 * <p>{@code <dataDir>/system_status.json}에 최신 헬스 스냅샷을,
 * {@code <dataDir>/reports/}에 슬롯마다 리포트 파일 하나를 기록합니다.
 * 모든 쓰기는 같은 디렉토리의 임시 파일에 먼저 기록한 뒤 원자적으로 이동합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.adapter.file;

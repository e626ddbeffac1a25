/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>코어가 소비하는 협력자 계약을 정의합니다. 모든 협력자는 선택적이며,
 * 부재는 치명적이지 않습니다.</p>
 *
 * <h2>협력자 SPI</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autocycle.core.spi.TrendSource} - 시장 신호 수집</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.ContentGenerator} - 상품 명세 생성</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.Localizer} - 다국어 변환</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.AssetGenerator} - 이미지 자산 생성</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.Validator} - 품질 검증</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.PaymentProcessor} - 가격/결제</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.PlatformPublisher} - 플랫폼 배포 (×N)</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.MarketingDispatcher} - 마케팅 캠페인</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.CompetitorIntelProvider} - 경쟁사 분석</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.MetricsSink} - 메트릭 전송</li>
 * </ul>
 *
 * <h2>인프라 SPI</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autocycle.core.spi.StatusStore} - 최신 헬스 스냅샷 (단일 writer)</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.ReportStore} - 슬롯별 리포트</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.AlertNotifier} - 상태 악화 알림</li>
 *   <li>{@link com.ryuqq.autocycle.core.spi.CollaboratorFactory} - 협력자 생성</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.spi;

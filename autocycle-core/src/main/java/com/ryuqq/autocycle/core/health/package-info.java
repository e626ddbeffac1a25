/**
 * 헬스 모델.
 *
 * <p>{@link com.ryuqq.autocycle.core.health.HealthSnapshot}은 자원 지표, 누적 카운터,
 * 판정된 {@link com.ryuqq.autocycle.core.health.HealthStatus}를 담습니다.
 * 누적 카운터는 프로세스 생명주기 동안 리셋되지 않으므로, 상태는 마지막 사이클이 아닌
 * 전체 추세를 나타냅니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.health;

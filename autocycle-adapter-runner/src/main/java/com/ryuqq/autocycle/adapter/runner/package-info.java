/**
 * Supervisor 런타임 어댑터.
 *
 * <p>{@link com.ryuqq.autocycle.adapter.runner.DaemonSupervisor}는 사이클을 무한 반복하며
 * 재시도, cooldown, 상태 저장, 중지 처리를 담당합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.adapter.runner;

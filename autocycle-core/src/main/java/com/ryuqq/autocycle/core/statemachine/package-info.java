/**
 * Daemon Supervisor 상태 머신.
 *
 * <p>{@link com.ryuqq.autocycle.core.statemachine.DaemonState}와
 * 전이 규칙 {@link com.ryuqq.autocycle.core.statemachine.DaemonStateTransition}을 정의합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.statemachine;

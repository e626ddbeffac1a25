/**
 * Supervisor 런타임 계약.
 *
 * <p>구현은 {@code autocycle-adapter-runner}의 DaemonSupervisor입니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.application.runtime;

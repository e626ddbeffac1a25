/**
 * 데몬 진입점과 조립.
 *
 * <p>{@link com.ryuqq.autocycle.daemon.AutocycleMain}이 명령을 해석하고,
 * {@link com.ryuqq.autocycle.daemon.DaemonAssembly}가 설정에 따라 어댑터와 파이프라인을 연결합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.daemon;

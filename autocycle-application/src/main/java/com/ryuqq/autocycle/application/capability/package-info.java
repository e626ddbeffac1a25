/**
 * 선택적 협력자 해석.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.application.capability;

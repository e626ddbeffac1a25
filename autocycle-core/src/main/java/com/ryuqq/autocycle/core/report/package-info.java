/**
 * 슬롯 리포트 모델.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.core.report;

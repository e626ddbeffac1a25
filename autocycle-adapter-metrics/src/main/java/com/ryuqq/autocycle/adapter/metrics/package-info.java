/**
 * Micrometer 기반 METRICS Capability 구현.
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
package com.ryuqq.autocycle.adapter.metrics;

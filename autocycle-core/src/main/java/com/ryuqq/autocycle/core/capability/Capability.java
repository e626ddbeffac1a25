package com.ryuqq.autocycle.core.capability;

import com.ryuqq.autocycle.core.spi.AssetGenerator;
import com.ryuqq.autocycle.core.spi.CompetitorIntelProvider;
import com.ryuqq.autocycle.core.spi.ContentGenerator;
import com.ryuqq.autocycle.core.spi.Localizer;
import com.ryuqq.autocycle.core.spi.MarketingDispatcher;
import com.ryuqq.autocycle.core.spi.MetricsSink;
import com.ryuqq.autocycle.core.spi.PaymentProcessor;
import com.ryuqq.autocycle.core.spi.PlatformPublisher;
import com.ryuqq.autocycle.core.spi.TrendSource;
import com.ryuqq.autocycle.core.spi.Validator;

/**
 * 선택적 협력자(Capability) 목록.
 *
 * <p>각 Capability는 하나의 협력자 인터페이스에 대응하며, 프로세스 시작 시
 * {@code CapabilityRegistry}가 생성을 시도합니다. 생성에 실패한 Capability는
 * 프로세스 생명주기 동안 "absent" 상태로 남습니다.</p>
 *
 * <p><strong>다중 대상 Capability:</strong></p>
 * <ul>
 *   <li>{@link #PLATFORM_PUBLISH}: 플랫폼마다 하나의 Publisher (×N)</li>
 *   <li>{@link #MARKETING}: 채널 그룹마다 하나의 Dispatcher</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public enum Capability {

    TREND_ANALYSIS("trend-analysis", TrendSource.class, false),
    CONTENT_GENERATION("content-generation", ContentGenerator.class, false),
    LOCALIZATION("localization", Localizer.class, false),
    ASSET_GENERATION("asset-generation", AssetGenerator.class, false),
    QUALITY_ASSURANCE("quality-assurance", Validator.class, false),
    PAYMENTS("payments", PaymentProcessor.class, false),
    PLATFORM_PUBLISH("platform-publish", PlatformPublisher.class, true),
    MARKETING("marketing", MarketingDispatcher.class, true),
    COMPETITOR_INTEL("competitor-intel", CompetitorIntelProvider.class, false),
    METRICS("metrics", MetricsSink.class, false);

    private final String key;
    private final Class<?> collaboratorType;
    private final boolean multiTarget;

    Capability(String key, Class<?> collaboratorType, boolean multiTarget) {
        this.key = key;
        this.collaboratorType = collaboratorType;
        this.multiTarget = multiTarget;
    }

    /**
     * 직렬화 및 로그에 사용되는 문자열 키.
     *
     * @return Capability 키 (예: "content-generation")
     */
    public String key() {
        return key;
    }

    /**
     * 이 Capability의 handle이 구현해야 하는 협력자 인터페이스.
     *
     * @return 협력자 타입
     */
    public Class<?> collaboratorType() {
        return collaboratorType;
    }

    /**
     * 여러 대상(플랫폼, 채널)을 가질 수 있는지 여부.
     *
     * @return 다중 대상이면 true
     */
    public boolean isMultiTarget() {
        return multiTarget;
    }

    /**
     * 문자열 키로 Capability 조회.
     *
     * @param key Capability 키
     * @return 일치하는 Capability
     * @throws IllegalArgumentException 알 수 없는 키인 경우
     */
    public static Capability fromKey(String key) {
        for (Capability capability : values()) {
            if (capability.key.equals(key)) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown capability key: " + key);
    }
}

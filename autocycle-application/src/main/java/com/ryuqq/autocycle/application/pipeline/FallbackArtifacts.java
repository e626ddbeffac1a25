package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.artifact.ContentSpec;
import com.ryuqq.autocycle.core.artifact.MarketSignal;
import com.ryuqq.autocycle.core.cycle.TargetOutcome;

import java.math.BigDecimal;
import java.util.List;

/**
 * Capability가 없거나 실패했을 때 사용하는 기본 산출물.
 *
 * <p>모든 값은 결정적(deterministic)이며 외부 호출 없이 생성됩니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class FallbackArtifacts {

    /**
     * 트렌드 수집이 불가능할 때의 기본 시장 신호.
     */
    public static final List<MarketSignal> DEFAULT_SIGNALS = List.of(
        new MarketSignal("AI Productivity", 0.95, new BigDecimal("49.00")),
        new MarketSignal("Second Brain", 0.88, new BigDecimal("79.00")),
        new MarketSignal("Digital Planner 2025", 0.78, new BigDecimal("39.00"))
    );

    public static final String DEFAULT_LOCALE = "en";

    private FallbackArtifacts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 콘텐츠 생성이 불가능할 때의 기본 상품 명세.
     *
     * @return placeholder ContentSpec
     */
    public static ContentSpec placeholderContent() {
        return new ContentSpec(
            "placeholder-template",
            "AI Productivity Template",
            "Boost your productivity with AI-powered tools",
            List.of("AI Integration", "Automation", "Analytics"),
            List.of("template", "AI", "productivity"),
            new BigDecimal("49.00"),
            "USD"
        );
    }

    /**
     * 배포 협력자가 없을 때의 모의 배포 결과.
     *
     * @return 두 개의 데모 배포 (모두 성공)
     */
    public static List<TargetOutcome> demoDeployments() {
        return List.of(
            TargetOutcome.succeeded("demo_gumroad", "https://demo.gumroad.com/template1"),
            TargetOutcome.succeeded("demo_etsy", "https://demo.etsy.com/listing/123")
        );
    }
}

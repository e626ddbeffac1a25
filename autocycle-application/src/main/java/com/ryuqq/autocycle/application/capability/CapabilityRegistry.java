package com.ryuqq.autocycle.application.capability;

import com.ryuqq.autocycle.core.capability.CapabilityKey;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import com.ryuqq.autocycle.core.spi.CollaboratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * 시작 시 선택적 협력자를 한 번 해석하는 레지스트리.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>팩토리 목록 획득 (직접 전달 또는 ServiceLoader)</li>
 *   <li>팩토리마다 create() 시도</li>
 *   <li>성공 → present, 예외/LinkageError/null/타입 불일치 → absent (WARN 로그)</li>
 *   <li>언급되지 않은 Capability는 absent</li>
 * </ol>
 *
 * <p>{@link #build()}는 예외를 던지지 않습니다. 팩토리 탐색 자체가 실패하면
 * 빈 CapabilitySet을 반환합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Supplier<List<CollaboratorFactory>> discovery;

    /**
     * 생성자 (팩토리 직접 전달).
     *
     * @param factories 협력자 팩토리 (등록 순서 유지)
     * @throws IllegalArgumentException factories가 null인 경우
     */
    public CapabilityRegistry(List<CollaboratorFactory> factories) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        List<CollaboratorFactory> copy = new ArrayList<>(factories);
        this.discovery = () -> copy;
    }

    private CapabilityRegistry(Supplier<List<CollaboratorFactory>> discovery) {
        this.discovery = discovery;
    }

    /**
     * ServiceLoader로 팩토리를 탐색하는 레지스트리 생성.
     *
     * @param classLoader 탐색에 사용할 ClassLoader
     * @return CapabilityRegistry
     */
    public static CapabilityRegistry fromServiceLoader(ClassLoader classLoader) {
        return new CapabilityRegistry(() -> {
            List<CollaboratorFactory> factories = new ArrayList<>();
            for (CollaboratorFactory factory : ServiceLoader.load(CollaboratorFactory.class, classLoader)) {
                factories.add(factory);
            }
            return factories;
        });
    }

    /**
     * 탐색 함수를 직접 지정한 레지스트리 생성.
     *
     * @param discovery 팩토리 탐색 함수
     * @return CapabilityRegistry
     */
    public static CapabilityRegistry discovering(Supplier<List<CollaboratorFactory>> discovery) {
        if (discovery == null) {
            throw new IllegalArgumentException("discovery cannot be null");
        }
        return new CapabilityRegistry(discovery);
    }

    /**
     * Capability 집합 생성.
     *
     * @return 불변 CapabilitySet (실패해도 예외 없음)
     */
    public CapabilitySet build() {
        List<CollaboratorFactory> factories;
        try {
            factories = discovery.get();
        } catch (RuntimeException | ServiceConfigurationError | LinkageError e) {
            log.warn("Collaborator discovery failed, running with no optional capabilities: {}", e.toString());
            return CapabilitySet.empty();
        }
        if (factories == null) {
            log.warn("Collaborator discovery returned nothing, running with no optional capabilities");
            return CapabilitySet.empty();
        }

        CapabilitySet.Builder builder = CapabilitySet.builder();
        for (CollaboratorFactory factory : factories) {
            resolve(factory, builder);
        }
        CapabilitySet capabilities = builder.build();

        log.info("Capabilities resolved: {} present, {} absent",
            capabilities.presentKeys().size(), capabilities.absentKeys().size());
        return capabilities;
    }

    /**
     * 팩토리 하나 해석.
     *
     * <p>실패는 해당 키만 absent로 만들고 다른 팩토리에 영향을 주지 않습니다.</p>
     */
    private void resolve(CollaboratorFactory factory, CapabilitySet.Builder builder) {
        if (factory == null) {
            return;
        }
        CapabilityKey key;
        try {
            key = factory.key();
        } catch (RuntimeException | LinkageError e) {
            log.warn("Collaborator factory {} has no usable key: {}", factory.getClass().getName(), e.toString());
            return;
        }
        if (key == null) {
            log.warn("Collaborator factory {} declared a null key", factory.getClass().getName());
            return;
        }

        try {
            Object handle = factory.create();
            builder.present(key, handle);
            log.info("Capability {} present ({})", key, handle.getClass().getSimpleName());
        } catch (Exception | LinkageError e) {
            builder.absent(key);
            log.warn("Capability {} absent: {}", key, e.toString());
        }
    }
}

package com.ryuqq.autocycle.core.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 프로세스 생명주기 동안 고정된 Capability 집합.
 *
 * <p>CapabilityRegistry가 한 번 생성하며, 이후 읽기 전용입니다.
 * 어떤 Capability의 부재는 프로세스가 재시작될 때까지 영구적인 상태입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>생성 후 멤버십 변경 불가</li>
 *   <li>present handle은 Capability의 협력자 타입을 구현함</li>
 *   <li>다중 대상 Capability의 handle 순서는 등록 순서를 따름</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class CapabilitySet {

    private static final CapabilitySet EMPTY = new CapabilitySet(Map.of(), Set.of());

    private final Map<CapabilityKey, Object> handles;
    private final Set<CapabilityKey> absent;

    private CapabilitySet(Map<CapabilityKey, Object> handles, Set<CapabilityKey> absent) {
        this.handles = Collections.unmodifiableMap(new LinkedHashMap<>(handles));
        this.absent = Collections.unmodifiableSet(new LinkedHashSet<>(absent));
    }

    /**
     * present Capability가 하나도 없는 집합.
     *
     * @return 빈 CapabilitySet
     */
    public static CapabilitySet empty() {
        return EMPTY;
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Capability가 하나 이상 present인지 확인.
     *
     * @param capability Capability 종류
     * @return present handle이 있으면 true
     */
    public boolean isPresent(Capability capability) {
        for (CapabilityKey key : handles.keySet()) {
            if (key.capability() == capability) {
                return true;
            }
        }
        return false;
    }

    /**
     * 단일 대상 Capability handle 조회.
     *
     * <p>다중 대상 Capability의 경우 첫 번째 handle을 반환합니다.</p>
     *
     * @param capability Capability 종류
     * @param type 협력자 타입
     * @param <T> 협력자 타입
     * @return handle (absent면 empty)
     */
    public <T> Optional<T> find(Capability capability, Class<T> type) {
        List<T> all = all(capability, type);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * Capability의 모든 present handle 조회 (등록 순서).
     *
     * @param capability Capability 종류
     * @param type 협력자 타입
     * @param <T> 협력자 타입
     * @return handle 목록 (absent면 빈 목록)
     */
    public <T> List<T> all(Capability capability, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Map.Entry<CapabilityKey, Object> entry : handles.entrySet()) {
            if (entry.getKey().capability() == capability) {
                result.add(type.cast(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Capability의 present handle을 대상 이름과 함께 조회.
     *
     * @param capability Capability 종류
     * @param type 협력자 타입
     * @param <T> 협력자 타입
     * @return 대상 이름 → handle (등록 순서)
     */
    public <T> Map<String, T> named(Capability capability, Class<T> type) {
        Map<String, T> result = new LinkedHashMap<>();
        for (Map.Entry<CapabilityKey, Object> entry : handles.entrySet()) {
            if (entry.getKey().capability() == capability) {
                result.put(entry.getKey().name(), type.cast(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * present 키 목록.
     *
     * @return present CapabilityKey (등록 순서)
     */
    public Set<CapabilityKey> presentKeys() {
        return handles.keySet();
    }

    /**
     * 생성에 실패했거나 등록되지 않은 키 목록.
     *
     * @return absent CapabilityKey
     */
    public Set<CapabilityKey> absentKeys() {
        return absent;
    }

    /**
     * Capability별 present 여부 요약.
     *
     * @return Capability 키 → present 여부 (모든 Capability 포함)
     */
    public Map<String, Boolean> summary() {
        Map<Capability, Boolean> flags = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            flags.put(capability, isPresent(capability));
        }
        Map<String, Boolean> result = new LinkedHashMap<>();
        flags.forEach((capability, present) -> result.put(capability.key(), present));
        return result;
    }

    @Override
    public String toString() {
        return "CapabilitySet{present=" + handles.keySet() + ", absent=" + absent + '}';
    }

    /**
     * CapabilitySet Builder.
     *
     * <p>CapabilityRegistry 내부에서만 사용되며, build() 이후에는 재사용하지 않습니다.</p>
     */
    public static final class Builder {

        private final Map<CapabilityKey, Object> handles = new LinkedHashMap<>();
        private final Set<CapabilityKey> absent = new LinkedHashSet<>();

        private Builder() {
        }

        /**
         * present handle 등록.
         *
         * @param key Capability 키
         * @param handle 협력자 handle
         * @return this
         * @throws IllegalArgumentException handle이 null이거나 협력자 타입이 아닌 경우
         */
        public Builder present(CapabilityKey key, Object handle) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            if (handle == null) {
                throw new IllegalArgumentException("handle cannot be null (key: " + key + ")");
            }
            Class<?> expected = key.capability().collaboratorType();
            if (!expected.isInstance(handle)) {
                throw new IllegalArgumentException(
                    "handle for " + key + " must implement " + expected.getSimpleName()
                        + " (actual: " + handle.getClass().getName() + ")"
                );
            }
            absent.remove(key);
            handles.put(key, handle);
            return this;
        }

        /**
         * absent 키 등록.
         *
         * @param key Capability 키
         * @return this
         */
        public Builder absent(CapabilityKey key) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            if (!handles.containsKey(key)) {
                absent.add(key);
            }
            return this;
        }

        /**
         * 불변 CapabilitySet 생성.
         *
         * <p>한 번도 언급되지 않은 단일 대상 Capability는 absent로 기록됩니다.</p>
         *
         * @return CapabilitySet
         */
        public CapabilitySet build() {
            for (Capability capability : Capability.values()) {
                boolean mentioned = false;
                for (CapabilityKey key : handles.keySet()) {
                    mentioned |= key.capability() == capability;
                }
                for (CapabilityKey key : absent) {
                    mentioned |= key.capability() == capability;
                }
                if (!mentioned) {
                    absent.add(CapabilityKey.of(capability));
                }
            }
            return new CapabilitySet(handles, absent);
        }
    }
}

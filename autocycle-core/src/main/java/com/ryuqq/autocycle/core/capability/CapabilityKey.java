package com.ryuqq.autocycle.core.capability;

/**
 * Capability 슬롯 식별자.
 *
 * <p>단일 대상 Capability는 이름이 Capability 키와 같고,
 * 다중 대상 Capability는 대상 이름(예: "gumroad")을 가집니다.</p>
 *
 * @param capability Capability 종류
 * @param name 대상 이름 (null 또는 빈 문자열 불가)
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public record CapabilityKey(Capability capability, String name) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException capability가 null이거나 name이 비어 있는 경우
     */
    public CapabilityKey {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    /**
     * 단일 대상 Capability 키 생성.
     *
     * @param capability Capability 종류
     * @return 이름이 Capability 키와 같은 CapabilityKey
     */
    public static CapabilityKey of(Capability capability) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        return new CapabilityKey(capability, capability.key());
    }

    /**
     * 이름이 지정된 대상 Capability 키 생성.
     *
     * @param capability Capability 종류
     * @param name 대상 이름
     * @return CapabilityKey
     */
    public static CapabilityKey of(Capability capability, String name) {
        return new CapabilityKey(capability, name);
    }

    @Override
    public String toString() {
        return capability.isMultiTarget() ? capability.key() + ":" + name : capability.key();
    }
}

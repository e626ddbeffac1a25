package com.ryuqq.autocycle.core.spi;

import com.ryuqq.autocycle.core.capability.CapabilityKey;

/**
 * 선택적 협력자 생성 팩토리.
 *
 * <p>CapabilityRegistry가 시작 시 한 번 호출합니다. {@code java.util.ServiceLoader}로
 * 발견되거나 직접 전달됩니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #create()}는 필요한 설정(API 키 등)이 없으면 예외를 던져야 합니다.</li>
 *   <li>생성 시 파일/소켓을 여는 위험은 협력자 구현이 책임집니다.</li>
 *   <li>반환된 handle은 {@code key().capability().collaboratorType()}을 구현해야 합니다.</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public interface CollaboratorFactory {

    /**
     * 생성할 Capability 슬롯.
     *
     * @return Capability 키
     */
    CapabilityKey key();

    /**
     * 협력자 handle 생성.
     *
     * @return 협력자 handle
     * @throws Exception 생성 실패 시 (해당 Capability는 absent 처리됨)
     */
    Object create() throws Exception;
}

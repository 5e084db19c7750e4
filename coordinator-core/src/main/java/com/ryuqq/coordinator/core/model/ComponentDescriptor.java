package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * Handler 컴포넌트 선언 정보.
 *
 * <p>토폴로지 구성과 등록에만 사용되며, dispatch 정확성에는 관여하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>aggregate "customer": inputs=[customer: CreateCustomer, AddLoyaltyPoints], outputs=[customer: CustomerCreated, ...]</li>
 *   <li>saga "order-fulfillment": inputs=[order: OrderCompleted], outputs=[fulfillment: CreateShipment]</li>
 * </ul>
 *
 * @param name 컴포넌트 이름
 * @param kind 컴포넌트 종류
 * @param inputs 소비하는 (domain, types) 목록
 * @param outputs 생성하는 (domain, types) 목록
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record ComponentDescriptor(
    String name,
    ComponentKind kind,
    List<DomainTypes> inputs,
    List<DomainTypes> outputs
) {

    public ComponentDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}

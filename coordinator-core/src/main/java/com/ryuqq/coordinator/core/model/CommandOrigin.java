package com.ryuqq.coordinator.core.model;

/**
 * Saga 또는 process manager가 발행한 command의 출처.
 *
 * <p>Command가 거부되면 triggeringCover로 revoke command를 보내 보상을 시도하고,
 * 보상할 수 없으면 dead letter 레코드에 출처 컴포넌트로 기록됩니다.</p>
 *
 * @param componentName 발행한 컴포넌트 이름
 * @param componentKind 발행한 컴포넌트 종류
 * @param triggeringCover 원인이 된 event book의 cover (null 가능)
 * @param triggeringSequence 원인이 된 event의 sequence (null 가능)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record CommandOrigin(
    String componentName,
    ComponentKind componentKind,
    Cover triggeringCover,
    Long triggeringSequence
) {

    public CommandOrigin {
        if (componentName == null || componentName.isBlank()) {
            throw new IllegalArgumentException("componentName cannot be null or blank");
        }
        if (componentKind == null) {
            throw new IllegalArgumentException("componentKind cannot be null");
        }
    }

    public CommandOrigin(String componentName, ComponentKind componentKind, Cover triggeringCover) {
        this(componentName, componentKind, triggeringCover, null);
    }

    public boolean canCompensate() {
        return triggeringCover != null;
    }
}

package com.ryuqq.coordinator.core.model;

/**
 * Saga/process manager command가 거부되었을 때 원인 aggregate로 보내는 보상 요청.
 *
 * <p>원인 aggregate는 {@code RevokeEventCommand} suffix로 handler를 등록해 보상 event를
 * 남길 수 있습니다. handler가 없거나 거부하면 원래 command는 dead letter로 기록됩니다.</p>
 *
 * @param componentName 거부된 command를 발행한 컴포넌트 이름
 * @param componentKind 거부된 command를 발행한 컴포넌트 종류
 * @param triggeringSequence 원인이 된 event의 sequence (null 가능)
 * @param rejectionReason 거부 사유
 * @param rejectedDomain 거부한 aggregate의 도메인
 * @param rejectedCommandType 거부된 command의 type URL
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record RevokeEventCommand(
    String componentName,
    ComponentKind componentKind,
    Long triggeringSequence,
    String rejectionReason,
    String rejectedDomain,
    String rejectedCommandType
) {

    /** Wire type name. */
    public static final String TYPE_NAME = "coordinator.RevokeEventCommand";

    public RevokeEventCommand {
        if (componentName == null || componentName.isBlank()) {
            throw new IllegalArgumentException("componentName cannot be null or blank");
        }
        if (componentKind == null) {
            throw new IllegalArgumentException("componentKind cannot be null");
        }
        if (rejectedDomain == null || rejectedDomain.isBlank()) {
            throw new IllegalArgumentException("rejectedDomain cannot be null or blank");
        }
    }
}

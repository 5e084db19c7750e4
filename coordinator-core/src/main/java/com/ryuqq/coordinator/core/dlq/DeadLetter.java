package com.ryuqq.coordinator.core.dlq;

import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.ComponentKind;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.MergeStrategy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 최종 실패 레코드.
 *
 * <p>재시도할 수 없거나 재시도 예산을 소진한 작업을 운영자가 수동으로 처리할 수 있도록
 * 진단 정보와 함께 내보냅니다.</p>
 *
 * <p><strong>Topic 규칙:</strong> {@code coordinator.dlq.<domain>} (도메인별 분리)</p>
 *
 * @param cover 원래 대상 aggregate
 * @param payload 실패한 command 또는 event book
 * @param reason 사람이 읽을 수 있는 사유
 * @param details 구조화된 상세 정보
 * @param occurredAt 발생 시각
 * @param metadata 추가 진단 정보
 * @param sourceComponent 실패를 보고한 컴포넌트 이름
 * @param sourceKind 실패를 보고한 컴포넌트 종류
 * @param retryCount 소진된 재시도 횟수
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record DeadLetter(
    Cover cover,
    DeadLetterPayload payload,
    String reason,
    RejectionDetails details,
    Instant occurredAt,
    Map<String, String> metadata,
    String sourceComponent,
    ComponentKind sourceKind,
    int retryCount
) {

    /** Dead letter topic prefix. */
    public static final String TOPIC_PREFIX = "coordinator.dlq.";

    private static final String UNSPECIFIED_REASON = "unspecified failure";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 누락된 경우
     */
    public DeadLetter {
        if (cover == null) {
            throw new IllegalArgumentException("cover cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (details == null) {
            throw new IllegalArgumentException("details cannot be null");
        }
        if (sourceComponent == null || sourceComponent.isBlank()) {
            throw new IllegalArgumentException("sourceComponent cannot be null or blank");
        }
        if (sourceKind == null) {
            throw new IllegalArgumentException("sourceKind cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Sequence 충돌로 거부된 command.
     *
     * @param command command book
     * @param expected 기대 sequence
     * @param actual 실제 다음 sequence
     * @param strategy 병합 전략
     * @param retryCount 소진된 시도 횟수
     * @param sourceComponent 보고 컴포넌트 이름
     * @param sourceKind 보고 컴포넌트 종류
     * @return DeadLetter
     */
    public static DeadLetter fromSequenceMismatch(
        CommandBook command,
        long expected,
        long actual,
        MergeStrategy strategy,
        int retryCount,
        String sourceComponent,
        ComponentKind sourceKind
    ) {
        return new DeadLetter(
            command.cover(),
            new DeadLetterPayload.RejectedCommand(command),
            "Sequence mismatch: expected " + expected + ", actual " + actual,
            new RejectionDetails.SequenceMismatch(expected, actual, strategy),
            Instant.now(),
            Map.of(),
            sourceComponent,
            sourceKind,
            retryCount
        );
    }

    /**
     * 비즈니스 규칙 위반으로 거부된 command.
     *
     * @param command command book
     * @param reason 거부 사유
     * @param sourceComponent 보고 컴포넌트 이름
     * @param sourceKind 보고 컴포넌트 종류
     * @return DeadLetter
     */
    public static DeadLetter fromValidationFailure(
        CommandBook command,
        String reason,
        String sourceComponent,
        ComponentKind sourceKind
    ) {
        String message = reasonOrDefault(reason);
        return new DeadLetter(
            command.cover(),
            new DeadLetterPayload.RejectedCommand(command),
            message,
            new RejectionDetails.ValidationFailure(message),
            Instant.now(),
            Map.of(),
            sourceComponent,
            sourceKind,
            0
        );
    }

    /**
     * 처리 중 실패한 command.
     *
     * @param command command book
     * @param error 오류 메시지
     * @param retryCount 소진된 재시도 횟수
     * @param transientFailure 일시 장애 여부
     * @param sourceComponent 보고 컴포넌트 이름
     * @param sourceKind 보고 컴포넌트 종류
     * @return DeadLetter
     */
    public static DeadLetter fromProcessingFailure(
        CommandBook command,
        String error,
        int retryCount,
        boolean transientFailure,
        String sourceComponent,
        ComponentKind sourceKind
    ) {
        String reason = reasonOrDefault(error);
        return new DeadLetter(
            command.cover(),
            new DeadLetterPayload.RejectedCommand(command),
            reason,
            new RejectionDetails.ProcessingFailure(reason, retryCount, transientFailure),
            Instant.now(),
            Map.of(),
            sourceComponent,
            sourceKind,
            retryCount
        );
    }

    /**
     * 처리(저장/발행) 중 실패한 event.
     *
     * @param events event book
     * @param error 오류 메시지
     * @param retryCount 소진된 재시도 횟수
     * @param transientFailure 일시 장애 여부
     * @param sourceComponent 보고 컴포넌트 이름
     * @param sourceKind 보고 컴포넌트 종류
     * @return DeadLetter
     */
    public static DeadLetter fromEventProcessingFailure(
        EventBook events,
        String error,
        int retryCount,
        boolean transientFailure,
        String sourceComponent,
        ComponentKind sourceKind
    ) {
        String reason = reasonOrDefault(error);
        return new DeadLetter(
            events.cover(),
            new DeadLetterPayload.RejectedEvents(events),
            reason,
            new RejectionDetails.ProcessingFailure(reason, retryCount, transientFailure),
            Instant.now(),
            Map.of(),
            sourceComponent,
            sourceKind,
            retryCount
        );
    }

    /**
     * 예외를 dead letter 사유 문자열로 변환.
     *
     * <p>메시지가 없는 예외는 클래스 이름으로 대신합니다.</p>
     *
     * @param error 실패 원인
     * @return 비어 있지 않은 사유
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return UNSPECIFIED_REASON;
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }

    private static String reasonOrDefault(String reason) {
        return reason == null || reason.isBlank() ? UNSPECIFIED_REASON : reason;
    }

    /**
     * 도메인별 dead letter topic.
     *
     * @return {@code coordinator.dlq.<domain>}
     */
    public String topic() {
        return TOPIC_PREFIX + cover.domain();
    }

    /**
     * Metadata 항목을 추가한 새 인스턴스 생성.
     *
     * @param key metadata key
     * @param value metadata value
     * @return 새 DeadLetter 인스턴스
     */
    public DeadLetter withMetadata(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new DeadLetter(cover, payload, reason, details, occurredAt, merged,
            sourceComponent, sourceKind, retryCount);
    }
}

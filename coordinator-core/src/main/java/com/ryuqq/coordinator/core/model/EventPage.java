package com.ryuqq.coordinator.core.model;

import java.time.Instant;

/**
 * 영속화된 하나의 사실(event).
 *
 * <p>Sequence는 (domain, root) 안에서 유일하고 전순서를 가집니다. 단,
 * {@code forced=true} page는 sequencing을 우회하여 기록된 것으로
 * 연속성 보장 대상이 아닙니다.</p>
 *
 * @param sequence sequence 번호 (0 이상)
 * @param forced sequencing 우회 여부
 * @param event 판별 event payload
 * @param createdAt 생성 시각
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record EventPage(
    long sequence,
    boolean forced,
    TypedPayload event,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException sequence가 음수이거나 event가 null인 경우
     */
    public EventPage {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * 현재 시각으로 EventPage 생성.
     *
     * @param sequence sequence 번호
     * @param event event payload
     * @return EventPage 인스턴스
     */
    public static EventPage of(long sequence, TypedPayload event) {
        return new EventPage(sequence, false, event, Instant.now());
    }

    /**
     * Sequence만 변경한 새 인스턴스 생성 (payload, createdAt 유지).
     *
     * @param sequence 새 sequence
     * @return 새 EventPage 인스턴스
     */
    public EventPage withSequence(long sequence) {
        return new EventPage(sequence, forced, event, createdAt);
    }

    /**
     * Forced 표시한 새 인스턴스 생성.
     *
     * @return forced=true인 EventPage
     */
    public EventPage asForced() {
        return new EventPage(sequence, true, event, createdAt);
    }
}

package com.ryuqq.coordinator.core.model;

/**
 * 특정 sequence 시점의 materialized state.
 *
 * <p>Snapshot은 replay 비용을 줄이기 위한 최적화일 뿐 진실의 원천이 아닙니다.
 * 항상 sequence 0부터 replay하여 다시 만들 수 있어야 하며, snapshot의
 * sequence는 마지막으로 commit된 event의 sequence를 넘을 수 없습니다.</p>
 *
 * @param sequence 이 state가 계산된 시점의 sequence (이 sequence의 event까지 반영됨)
 * @param state 직렬화된 state
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Snapshot(long sequence, TypedPayload state) {

    public Snapshot {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}

package com.ryuqq.coordinator.core.model;

/**
 * 동기 projector가 만든 read model 결과.
 *
 * @param cover projection 대상 aggregate
 * @param projector projector 이름
 * @param sequence projection이 반영한 마지막 event sequence
 * @param projection projection payload
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Projection(
    Cover cover,
    String projector,
    long sequence,
    TypedPayload projection
) {

    public Projection {
        if (cover == null) {
            throw new IllegalArgumentException("cover cannot be null");
        }
        if (projector == null || projector.isBlank()) {
            throw new IllegalArgumentException("projector cannot be null or blank");
        }
        if (projection == null) {
            throw new IllegalArgumentException("projection cannot be null");
        }
    }
}

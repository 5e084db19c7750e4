package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * Command 처리 결과 (호출자 응답).
 *
 * <p>호출자 도메인에 commit된 event와, 동기 projector가 계산한 projection을
 * 별도 필드로 담습니다.</p>
 *
 * @param events commit된 event book (dry run이면 저장되지 않은 예상 event)
 * @param projections 동기 projection 목록
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record BusinessResponse(EventBook events, List<Projection> projections) {

    public BusinessResponse {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        projections = projections == null ? List.of() : List.copyOf(projections);
    }

    /**
     * Projection 없이 응답 생성.
     *
     * @param events event book
     * @return BusinessResponse 인스턴스
     */
    public static BusinessResponse of(EventBook events) {
        return new BusinessResponse(events, List.of());
    }
}

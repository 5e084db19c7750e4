package com.ryuqq.coordinator.core.outcome;

import com.ryuqq.coordinator.core.model.EventBook;

/**
 * 재시도 가능한 실패.
 *
 * <p>대상 aggregate의 state가 바뀌어 command가 더 이상 유효하지 않을 수 있는 경우입니다.
 * 호출자는 대상 state를 다시 조회하고 command를 다시 만들어야 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Explicit 전략의 sequence 충돌 (병합 불가)</li>
 *   <li>저장소/버스 일시 장애</li>
 * </ul>
 *
 * @param reason 재시도 사유
 * @param currentState 충돌 시점의 대상 이력 (알 수 없으면 null)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Retryable(String reason, EventBook currentState) implements CommandOutcome {

    public Retryable {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}

package com.ryuqq.coordinator.core.dlq;

import com.ryuqq.coordinator.core.model.MergeStrategy;

/**
 * 구조화된 거부 상세 정보.
 *
 * <ul>
 *   <li>{@link ValidationFailure}: 비즈니스 규칙 위반</li>
 *   <li>{@link SequenceMismatch}: 해결되지 않은 sequence 충돌</li>
 *   <li>{@link ProcessingFailure}: 처리 중 예외 (일시 장애 포함)</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public sealed interface RejectionDetails
    permits RejectionDetails.ValidationFailure, RejectionDetails.SequenceMismatch, RejectionDetails.ProcessingFailure {

    /**
     * @param reason 거부 사유
     */
    record ValidationFailure(String reason) implements RejectionDetails {
    }

    /**
     * @param expected 호출자가 기대한 sequence
     * @param actual 저장소의 실제 다음 sequence
     * @param strategy 사용된 병합 전략
     */
    record SequenceMismatch(long expected, long actual, MergeStrategy strategy) implements RejectionDetails {
    }

    /**
     * @param error 오류 메시지
     * @param retryCount 소진된 재시도 횟수
     * @param transientFailure 일시 장애 여부
     */
    record ProcessingFailure(String error, int retryCount, boolean transientFailure) implements RejectionDetails {
    }
}

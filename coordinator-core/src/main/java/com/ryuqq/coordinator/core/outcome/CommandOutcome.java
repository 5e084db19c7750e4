package com.ryuqq.coordinator.core.outcome;

/**
 * Saga 또는 process manager가 발행한 command의 실행 결과.
 *
 * <p>CommandOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Accepted}: command가 처리되어 event가 commit됨</li>
 *   <li>{@link Retryable}: sequence 충돌 또는 일시 장애, 대상 state를 다시 조회하여 재시도 가능</li>
 *   <li>{@link Rejected}: 비즈니스 거부 또는 영구 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Retryable retryable) {
 *     destinations = refetch(retryable.currentState());
 * } else if (outcome instanceof Rejected rejected) {
 *     deadLetter(rejected.reason());
 * }
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public sealed interface CommandOutcome permits Accepted, Retryable, Rejected {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetryable() {
        return this instanceof Retryable;
    }

    /**
     * 결과가 영구 거부인지 확인.
     *
     * @return 영구 거부 여부
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }
}

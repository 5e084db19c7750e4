package com.ryuqq.coordinator.core.error;

/**
 * Coordinator 오류 분류.
 *
 * <ul>
 *   <li>{@link #VALIDATION_REJECTED}: 비즈니스 규칙 위반, 재시도 불가</li>
 *   <li>{@link #SEQUENCE_CONFLICT}: 병합/재시퀀싱으로 해결되지 않은 sequence 충돌</li>
 *   <li>{@link #TRANSIENT_INFRA}: 저장소/버스 일시 장애, 재시도 대상</li>
 *   <li>{@link #UNKNOWN_HANDLER}: 등록된 handler 없음, 재시도 불가</li>
 *   <li>{@link #DECODE_FAILURE}: 잘못된 payload</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public enum ErrorKind {
    VALIDATION_REJECTED(false),
    SEQUENCE_CONFLICT(true),
    TRANSIENT_INFRA(true),
    UNKNOWN_HANDLER(false),
    DECODE_FAILURE(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 재시도로 해결될 가능성이 있는지 확인.
     *
     * @return 재시도 가능 여부
     */
    public boolean isRetryable() {
        return retryable;
    }
}

package com.ryuqq.coordinator.core.error;

/**
 * 호출자에게 노출되는 상태 클래스.
 *
 * <p>원격 transport가 자신의 상태 코드로 매핑할 때 사용합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public enum StatusCode {
    INVALID_ARGUMENT,
    FAILED_PRECONDITION,
    ABORTED,
    UNAVAILABLE,
    UNIMPLEMENTED,
    INTERNAL
}

package com.ryuqq.coordinator.core.error;

/**
 * 비즈니스 규칙 위반으로 command가 거부됨.
 *
 * <p>재시도하지 않으며 사유는 호출자에게 그대로 전달됩니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class ValidationRejectedException extends CoordinatorException {

    public ValidationRejectedException(String reason) {
        super(ErrorKind.VALIDATION_REJECTED, StatusCode.FAILED_PRECONDITION, reason);
    }

    protected ValidationRejectedException(StatusCode status, String reason) {
        super(ErrorKind.VALIDATION_REJECTED, status, reason);
    }

    /**
     * 잘못된 입력(형식 오류, 필수값 누락)으로 인한 거부.
     *
     * @param reason 사유
     * @return INVALID_ARGUMENT 상태의 예외
     */
    public static ValidationRejectedException invalidArgument(String reason) {
        return new ValidationRejectedException(StatusCode.INVALID_ARGUMENT, reason);
    }

    /**
     * 현재 상태에서 허용되지 않는 command로 인한 거부.
     *
     * @param reason 사유
     * @return FAILED_PRECONDITION 상태의 예외
     */
    public static ValidationRejectedException failedPrecondition(String reason) {
        return new ValidationRejectedException(StatusCode.FAILED_PRECONDITION, reason);
    }

    public String getReason() {
        return getMessage();
    }
}

package com.ryuqq.coordinator.core.error;

/**
 * 저장소나 버스의 일시적 장애.
 *
 * <p>Coordinator 내부에서 제한된 backoff로 재시도되며, 예산이 소진되면 호출자에게
 * 전달되거나 dead letter로 기록됩니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class TransientInfraException extends CoordinatorException {

    public TransientInfraException(String message) {
        super(ErrorKind.TRANSIENT_INFRA, StatusCode.UNAVAILABLE, message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_INFRA, StatusCode.UNAVAILABLE, message, cause);
    }
}

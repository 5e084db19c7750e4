package com.ryuqq.coordinator.core.error;

/**
 * Payload decode 실패.
 *
 * <p>쓰기 시점에는 거부 사유가 되고, replay 시점에는 건너뜁니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class DecodeFailureException extends CoordinatorException {

    private final String typeUrl;

    public DecodeFailureException(String typeUrl, String message, Throwable cause) {
        super(ErrorKind.DECODE_FAILURE, StatusCode.INVALID_ARGUMENT, message, cause);
        this.typeUrl = typeUrl;
    }

    public String getTypeUrl() {
        return typeUrl;
    }
}

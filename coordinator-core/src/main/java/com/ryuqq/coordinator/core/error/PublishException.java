package com.ryuqq.coordinator.core.error;

/**
 * Event bus 발행 실패.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class PublishException extends TransientInfraException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}

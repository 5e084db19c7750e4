package com.ryuqq.coordinator.core.error;

/**
 * Sequence 충돌 이외의 저장소 오류.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class StorageException extends TransientInfraException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

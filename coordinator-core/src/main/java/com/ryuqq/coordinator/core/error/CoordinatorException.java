package com.ryuqq.coordinator.core.error;

/**
 * Coordinator 예외 계층의 루트.
 *
 * <p>모든 하위 예외는 unchecked이며 {@link ErrorKind}와 {@link StatusCode}를 가집니다.
 * Transport 계층은 status만 보고 응답 코드를 결정할 수 있습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public abstract class CoordinatorException extends RuntimeException {

    private final ErrorKind kind;
    private final StatusCode status;

    protected CoordinatorException(ErrorKind kind, StatusCode status, String message) {
        this(kind, status, message, null);
    }

    protected CoordinatorException(ErrorKind kind, StatusCode status, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        this.kind = kind;
        this.status = status;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public StatusCode getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}

package com.ryuqq.coordinator.core.error;

/**
 * 타입에 매칭되는 handler가 등록되어 있지 않음.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class UnknownHandlerException extends CoordinatorException {

    private final String typeName;

    public UnknownHandlerException(String typeName, String message) {
        super(ErrorKind.UNKNOWN_HANDLER, StatusCode.UNIMPLEMENTED, message);
        this.typeName = typeName;
    }

    /**
     * 등록되지 않은 command 타입.
     *
     * @param domain 도메인
     * @param typeUrl command type URL
     * @return 예외
     */
    public static UnknownHandlerException forCommand(String domain, String typeUrl) {
        return new UnknownHandlerException(typeUrl, "Unknown command type for domain " + domain + ": " + typeUrl);
    }

    /**
     * Business logic이 등록되지 않은 도메인.
     *
     * @param domain 도메인
     * @return 예외
     */
    public static UnknownHandlerException forDomain(String domain) {
        return new UnknownHandlerException(null, "No business logic registered for domain: " + domain);
    }

    public String getTypeName() {
        return typeName;
    }
}

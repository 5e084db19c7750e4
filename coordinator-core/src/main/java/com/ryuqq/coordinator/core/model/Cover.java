package com.ryuqq.coordinator.core.model;

/**
 * 일관성 경계(consistency boundary) 식별 정보.
 *
 * <p>Cover는 command/event book이 어느 aggregate에 속하는지를 나타냅니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>domain:</strong> 도메인 이름 (예: customer, inventory)</li>
 *   <li><strong>root:</strong> aggregate root 식별자</li>
 *   <li><strong>correlationId:</strong> 도메인 간 인과 추적용 ID (빈 문자열 허용, null 불가)</li>
 *   <li><strong>edition:</strong> 브랜치/에디션 이름 (선택, null 가능)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 변경이 필요하면 {@code withX} 메서드로 새 인스턴스를 만듭니다.</p>
 *
 * @param domain 도메인 이름
 * @param root aggregate root
 * @param correlationId correlation id
 * @param edition edition 이름 (null 가능)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Cover(
    String domain,
    RootId root,
    String correlationId,
    String edition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException domain이 비어 있거나 root가 null인 경우
     */
    public Cover {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (correlationId == null) {
            correlationId = "";
        }
        // edition은 null 허용
    }

    /**
     * correlation id 없이 Cover 생성.
     *
     * @param domain 도메인 이름
     * @param root aggregate root
     * @return Cover 인스턴스
     */
    public static Cover of(String domain, RootId root) {
        return new Cover(domain, root, "", null);
    }

    /**
     * correlation id를 지정하여 Cover 생성.
     *
     * @param domain 도메인 이름
     * @param root aggregate root
     * @param correlationId correlation id
     * @return Cover 인스턴스
     */
    public static Cover of(String domain, RootId root, String correlationId) {
        return new Cover(domain, root, correlationId, null);
    }

    /**
     * correlation id가 지정되어 있는지 확인.
     *
     * @return 지정되어 있으면 true
     */
    public boolean hasCorrelationId() {
        return !correlationId.isEmpty();
    }

    /**
     * correlation id만 변경한 새 인스턴스 생성.
     *
     * @param correlationId 새 correlation id
     * @return 새 Cover 인스턴스
     */
    public Cover withCorrelationId(String correlationId) {
        return new Cover(domain, root, correlationId, edition);
    }

    /**
     * (domain, root) 캐시 키.
     *
     * @return "domain:root" 형식의 키
     */
    public String cacheKey() {
        return domain + ":" + root.asString();
    }
}
